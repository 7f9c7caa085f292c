package io.magicalne.cex.conformance;

import io.magicalne.cex.dto.CexExchange;
import lombok.Data;

/**
 * A conformance job, e.g.
 * <pre>
 * exchange: binance
 * symbols: binance_symbols.json
 * reference: binance_reference.json
 * </pre>
 * Relative paths are resolved against the directory of the yaml file.
 */
@Data
public class ConformanceConfig {
  private CexExchange exchange;
  private String symbols;
  private String reference;
}

package io.magicalne.cex.exchanges.binance;

import com.google.common.collect.ImmutableList;
import io.magicalne.cex.dto.NormalizedCurrency;
import io.magicalne.cex.exception.NormalizationException;
import io.magicalne.cex.handler.EnvelopeUnwrapper;
import io.magicalne.cex.handler.WrappedCurrencyLinker;
import lombok.extern.slf4j.Slf4j;

import java.util.AbstractMap.SimpleImmutableEntry;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The decoded Binance symbols listing, {@code {"data": {"body": {"data": [...]}}}}.
 */
@Slf4j
public class BinanceAllSymbols {

  private static final EnvelopeUnwrapper UNWRAPPER = new EnvelopeUnwrapper("data", "body", "data");

  private final List<BinanceSymbol> symbols;

  public BinanceAllSymbols(List<BinanceSymbol> symbols) {
    this.symbols = ImmutableList.copyOf(symbols);
  }

  public static BinanceAllSymbols parse(String raw) throws NormalizationException {
    return new BinanceAllSymbols(UNWRAPPER.unwrapAll(raw, BinanceSymbol.class, BinanceSymbol::missingField));
  }

  public List<BinanceSymbol> getSymbols() {
    return symbols;
  }

  public List<NormalizedCurrency> normalize() {
    List<NormalizedCurrency> normalized = new ArrayList<>(symbols.size());
    for (BinanceSymbol symbol : symbols) {
      normalized.add(symbol.normalize());
    }
    return WrappedCurrencyLinker.link(normalized);
  }

  /**
   * Compares the raw listing with a canonical batch. The canonical batch folds every wrapped token
   * into its underlying currency, so it is shorter than the listing by the number of currencies
   * that absorbed one.
   */
  public boolean isEquivalent(List<NormalizedCurrency> reference) {
    Set<Map.Entry<String, String>> local = new HashSet<>();
    for (BinanceSymbol symbol : symbols) {
      local.add(new SimpleImmutableEntry<>(symbol.getName(), symbol.getSymbol()));
    }

    int synthetic = 0;
    List<NormalizedCurrency> missing = new ArrayList<>();
    for (NormalizedCurrency currency : reference) {
      if (currency.hasLinkedWrapped()) {
        synthetic++;
      }
      if (!local.contains(new SimpleImmutableEntry<>(currency.getName(), currency.getSymbol()))) {
        missing.add(currency);
      }
    }

    boolean sizeMatches = symbols.size() == reference.size() + synthetic;
    if (!sizeMatches) {
      log.warn("binance symbols: {} records, reference: {} currencies + {} linked wrapped tokens",
        symbols.size(), reference.size(), synthetic);
    }
    if (!missing.isEmpty()) {
      log.warn("binance symbols missing {} reference currencies: {}", missing.size(), missing);
    }
    return sizeMatches && missing.isEmpty();
  }
}

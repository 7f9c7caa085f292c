package io.magicalne.cex.conformance;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;
import io.magicalne.cex.Utils;
import io.magicalne.cex.dto.NormalizedCurrency;
import io.magicalne.cex.exception.NormalizationException;
import io.magicalne.cex.exchanges.ExchangeNormalizer;
import io.magicalne.cex.exchanges.ExchangeNormalizers;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

@Slf4j
public class ConformanceCheck {

  private static final TypeReference<List<NormalizedCurrency>> CURRENCIES =
    new TypeReference<List<NormalizedCurrency>>() {
    };

  private final ObjectMapper objectMapper;

  public ConformanceCheck() {
    this(Utils.objectMapper());
  }

  public ConformanceCheck(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public ConformanceReport run(ConformanceConfig config, Path baseDir) throws IOException, NormalizationException {
    Preconditions.checkNotNull(config.getExchange(), "exchange is required");
    Preconditions.checkNotNull(config.getSymbols(), "symbols is required");
    Preconditions.checkNotNull(config.getReference(), "reference is required");

    ExchangeNormalizer normalizer = ExchangeNormalizers.forExchange(config.getExchange());
    String raw = new String(Files.readAllBytes(baseDir.resolve(config.getSymbols())), StandardCharsets.UTF_8);
    List<NormalizedCurrency> reference =
      objectMapper.readValue(baseDir.resolve(config.getReference()).toFile(), CURRENCIES);

    List<NormalizedCurrency> normalized = normalizer.normalizeCurrencies(raw);
    boolean selfConsistent = normalizer.isEquivalent(raw, normalized);
    boolean equivalent = normalizer.isEquivalent(raw, reference);

    ConformanceReport report = new ConformanceReport(
      config.getExchange(), normalized.size(), reference.size(), selfConsistent, equivalent);
    if (report.passed()) {
      log.info("Conformance passed: {}", report);
    } else {
      log.warn("Conformance failed: {}", report);
    }
    return report;
  }
}

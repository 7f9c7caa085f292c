package io.magicalne.cex.exchanges;

import io.magicalne.cex.dto.CexExchange;
import io.magicalne.cex.dto.ExchangeTradingPair;
import io.magicalne.cex.dto.NormalizedCurrency;
import io.magicalne.cex.dto.NormalizedTradingPair;
import io.magicalne.cex.dto.NormalizedTradingType;
import io.magicalne.cex.exception.InvalidPairFormatException;
import io.magicalne.cex.exception.NormalizationException;

import java.util.List;

/**
 * Conversions between one exchange's wire formats and the canonical model.
 */
public interface ExchangeNormalizer {

  CexExchange exchange();

  boolean isValidPair(String raw);

  ExchangeTradingPair decodePair(String raw) throws InvalidPairFormatException;

  ExchangeTradingPair encodePair(NormalizedTradingPair pair) throws InvalidPairFormatException;

  NormalizedTradingType parseTradingType(String token);

  /**
   * @param rawJson the symbols listing as returned by the exchange
   */
  List<NormalizedCurrency> normalizeCurrencies(String rawJson) throws NormalizationException;

  /**
   * Checks a raw symbols listing against a trusted canonical batch. Mismatches are logged.
   */
  boolean isEquivalent(String rawJson, List<NormalizedCurrency> reference) throws NormalizationException;
}

package io.magicalne.cex.exchanges.binance;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;
import io.magicalne.cex.dto.CexExchange;
import io.magicalne.cex.dto.ExchangeTradingPair;
import io.magicalne.cex.dto.NormalizedTradingPair;
import io.magicalne.cex.exception.InvalidPairFormatException;
import lombok.EqualsAndHashCode;

import java.util.List;
import java.util.Locale;

/**
 * Binance spot symbol such as {@code BTCUSDT}: upper case, no delimiter.
 */
@EqualsAndHashCode
public final class BinanceTradingPair implements ExchangeTradingPair {

  private static final CharMatcher FORBIDDEN = CharMatcher.anyOf(NormalizedTradingPair.DELIMITERS);

  private final String value;

  private BinanceTradingPair(String value) {
    this.value = value;
  }

  /**
   * Non-empty and free of {@code -}, {@code _} and {@code /}.
   */
  public static boolean isValid(String s) {
    return !s.isEmpty() && FORBIDDEN.matchesNoneOf(s);
  }

  @JsonCreator
  public static BinanceTradingPair of(String raw) throws InvalidPairFormatException {
    if (raw == null || raw.isEmpty()) {
      throw new InvalidPairFormatException(CexExchange.BINANCE, raw);
    }
    if (!isValid(raw)) {
      throw new InvalidPairFormatException(CexExchange.BINANCE, raw, "'-', '_', '/'");
    }
    return new BinanceTradingPair(raw.toUpperCase(Locale.ROOT));
  }

  /**
   * Converts a canonical pair, trying in order: explicit base and quote, the raw pair as is, the
   * raw pair split on its delimiter, the raw pair with every delimiter stripped. A split that
   * still leaves a delimiter in either part falls through to stripping instead of being returned.
   */
  public static BinanceTradingPair fromNormalized(NormalizedTradingPair pair) throws InvalidPairFormatException {
    if (pair.hasBaseQuote()) {
      return new BinanceTradingPair(pair.getBase() + pair.getQuote());
    }

    String raw = pair.getPair();
    if (isValid(raw)) {
      return of(raw);
    }

    if (pair.getDelimiter() != null) {
      List<String> parts = pair.splitPair();
      Preconditions.checkArgument(parts.size() == 2 && !parts.get(0).isEmpty() && !parts.get(1).isEmpty(),
        "pair '%s' does not split on '%s' into two parts", raw, pair.getDelimiter());
      String joined = parts.get(0).toUpperCase(Locale.ROOT) + parts.get(1).toUpperCase(Locale.ROOT);
      if (isValid(joined)) {
        return new BinanceTradingPair(joined);
      }
    }

    String stripped = FORBIDDEN.removeFrom(raw);
    if (isValid(stripped)) {
      return of(stripped);
    }

    throw new InvalidPairFormatException(CexExchange.BINANCE, raw);
  }

  @Override
  public CexExchange exchange() {
    return CexExchange.BINANCE;
  }

  @JsonValue
  @Override
  public String value() {
    return value;
  }

  @Override
  public NormalizedTradingPair normalize() {
    return NormalizedTradingPair.ofPair(CexExchange.BINANCE, value);
  }

  public NormalizedTradingPair normalizeWith(String base, String quote) {
    return NormalizedTradingPair.ofBaseQuote(CexExchange.BINANCE, base, quote);
  }

  @Override
  public String toString() {
    return value;
  }
}

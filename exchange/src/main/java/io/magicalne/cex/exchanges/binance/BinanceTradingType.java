package io.magicalne.cex.exchanges.binance;

import com.fasterxml.jackson.annotation.JsonCreator;
import io.magicalne.cex.dto.NormalizedTradingType;

import java.util.Locale;

/**
 * Market types as advertised by Binance endpoints. Unknown tokens map to {@link #OTHER}; linear
 * and inverse contracts are both folded into {@link #PERPETUAL}, keep the original token if the
 * settlement type matters.
 */
public enum BinanceTradingType {
  SPOT(NormalizedTradingType.SPOT),
  PERPETUAL(NormalizedTradingType.PERPETUAL),
  MARGIN(NormalizedTradingType.MARGIN),
  FUTURES(NormalizedTradingType.FUTURES),
  OPTION(NormalizedTradingType.OPTION),
  OTHER(NormalizedTradingType.OTHER);

  private final NormalizedTradingType normalized;

  BinanceTradingType(NormalizedTradingType normalized) {
    this.normalized = normalized;
  }

  @JsonCreator
  public static BinanceTradingType parse(String token) {
    if (token == null) {
      return OTHER;
    }
    switch (token.trim().toLowerCase(Locale.ROOT)) {
      case "spot":
        return SPOT;
      case "perpetual":
      case "perp":
      case "swap":
      case "linear":
      case "inverse":
        return PERPETUAL;
      case "futures":
        return FUTURES;
      case "margin":
        return MARGIN;
      case "option":
        return OPTION;
      default:
        return OTHER;
    }
  }

  public NormalizedTradingType toNormalized() {
    return normalized;
  }
}

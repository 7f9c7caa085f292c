package io.magicalne.cex.exchanges;

import com.google.common.base.Preconditions;
import io.magicalne.cex.dto.CexExchange;
import io.magicalne.cex.exchanges.binance.BinanceNormalizer;

public final class ExchangeNormalizers {

  private static final BinanceNormalizer BINANCE = new BinanceNormalizer();

  private ExchangeNormalizers() {
  }

  public static ExchangeNormalizer forExchange(CexExchange exchange) {
    Preconditions.checkNotNull(exchange, "exchange");
    switch (exchange) {
      case BINANCE:
        return BINANCE;
      default:
        throw new IllegalArgumentException("No normalizer for exchange: " + exchange);
    }
  }
}

package io.magicalne.cex.dto;

/**
 * A trading pair in an exchange's own wire format, e.g. {@code BTCUSDT} on Binance.
 */
public interface ExchangeTradingPair {

    CexExchange exchange();

    String value();

    /**
     * @return the canonical form carrying the native string as raw pair, without a delimiter.
     */
    NormalizedTradingPair normalize();
}

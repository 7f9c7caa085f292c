package io.magicalne.cex.dto;

import com.google.common.collect.ImmutableList;
import org.junit.Assert;
import org.junit.Test;

public class NormalizedTradingPairTest {

    @Test
    public void baseQuotePair() {
        NormalizedTradingPair pair = NormalizedTradingPair.ofBaseQuote(CexExchange.BINANCE, "BTC", "USDT");
        Assert.assertTrue(pair.hasBaseQuote());
        Assert.assertNull(pair.getPair());
        Assert.assertNull(pair.getDelimiter());
    }

    @Test
    public void rawPairWithDelimiter() {
        NormalizedTradingPair pair = NormalizedTradingPair.ofPair(CexExchange.BINANCE, "eth/btc", '/');
        Assert.assertFalse(pair.hasBaseQuote());
        Assert.assertEquals(ImmutableList.of("eth", "btc"), pair.splitPair());
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsUnknownDelimiter() {
        NormalizedTradingPair.ofPair(CexExchange.BINANCE, "BTC:USDT", ':');
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsDelimiterNotSplittingInTwo() {
        NormalizedTradingPair.ofPair(CexExchange.BINANCE, "BTC-USDT-PERP", '-');
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsEmptyPart() {
        NormalizedTradingPair.ofPair(CexExchange.BINANCE, "BTC_", '_');
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsBothShapes() {
        new NormalizedTradingPair(CexExchange.BINANCE, "BTC", "USDT", "BTCUSDT", null);
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsNeitherShape() {
        new NormalizedTradingPair(CexExchange.BINANCE, null, null, null, null);
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsHalfBaseQuote() {
        new NormalizedTradingPair(CexExchange.BINANCE, "BTC", null, null, null);
    }
}

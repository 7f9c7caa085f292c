package io.magicalne.cex.exchanges.binance;

import io.magicalne.cex.dto.CexExchange;
import io.magicalne.cex.dto.NormalizedTradingPair;
import io.magicalne.cex.exception.InvalidPairFormatException;
import org.junit.Assert;
import org.junit.Test;

public class BinanceTradingPairTest {

  @Test
  public void validityRejectsDelimiters() {
    Assert.assertTrue(BinanceTradingPair.isValid("BTCUSDT"));
    Assert.assertTrue(BinanceTradingPair.isValid("ethbtc"));
    Assert.assertFalse(BinanceTradingPair.isValid("BTC-USDT"));
    Assert.assertFalse(BinanceTradingPair.isValid("BTC_USDT"));
    Assert.assertFalse(BinanceTradingPair.isValid("BTC/USDT"));
    Assert.assertFalse(BinanceTradingPair.isValid(""));
  }

  @Test
  public void emptyPairIsRejectedEverywhere() {
    try {
      BinanceTradingPair.of("");
      Assert.fail("expected InvalidPairFormatException");
    } catch (InvalidPairFormatException e) {
      Assert.assertEquals("", e.getRaw());
    }
    for (String raw : new String[]{"", "-", "-/_"}) {
      try {
        BinanceTradingPair.fromNormalized(NormalizedTradingPair.ofPair(CexExchange.BINANCE, raw));
        Assert.fail("expected InvalidPairFormatException for '" + raw + "'");
      } catch (InvalidPairFormatException e) {
        Assert.assertEquals(raw, e.getRaw());
      }
    }
  }

  @Test
  public void decodeUppercases() throws InvalidPairFormatException {
    Assert.assertEquals("ETHBTC", BinanceTradingPair.of("ethBtc").value());
  }

  @Test
  public void decodeIsIdempotent() throws InvalidPairFormatException {
    for (String s : new String[]{"btcusdt", "1000SHIBUSDT", "ETHBTC", "bnbfdusd"}) {
      BinanceTradingPair once = BinanceTradingPair.of(s);
      Assert.assertEquals(once, BinanceTradingPair.of(once.value()));
      Assert.assertEquals(once, BinanceTradingPair.fromNormalized(NormalizedTradingPair.ofPair(CexExchange.BINANCE, s)));
    }
  }

  @Test
  public void decodeRejectsDelimitedPair() {
    try {
      BinanceTradingPair.of("BTC-USDT");
      Assert.fail("expected InvalidPairFormatException");
    } catch (InvalidPairFormatException e) {
      Assert.assertEquals("BTC-USDT", e.getRaw());
    }
  }

  @Test
  public void encodeBaseQuote() throws InvalidPairFormatException {
    NormalizedTradingPair pair = NormalizedTradingPair.ofBaseQuote(CexExchange.BINANCE, "BTC", "USDT");
    Assert.assertEquals("BTCUSDT", BinanceTradingPair.fromNormalized(pair).value());
  }

  @Test
  public void encodeBaseQuoteIsVerbatim() throws InvalidPairFormatException {
    NormalizedTradingPair pair = NormalizedTradingPair.ofBaseQuote(CexExchange.BINANCE, "eth", "btc");
    Assert.assertEquals("ethbtc", BinanceTradingPair.fromNormalized(pair).value());
  }

  @Test
  public void encodeSplitsOnDeclaredDelimiter() throws InvalidPairFormatException {
    NormalizedTradingPair pair = NormalizedTradingPair.ofPair(CexExchange.BINANCE, "BTC-USDT", '-');
    Assert.assertEquals("BTCUSDT", BinanceTradingPair.fromNormalized(pair).value());

    NormalizedTradingPair lower = NormalizedTradingPair.ofPair(CexExchange.BINANCE, "eth/btc", '/');
    Assert.assertEquals("ETHBTC", BinanceTradingPair.fromNormalized(lower).value());
  }

  @Test
  public void encodeStripsUndeclaredDelimiter() throws InvalidPairFormatException {
    NormalizedTradingPair pair = NormalizedTradingPair.ofPair(CexExchange.BINANCE, "BTC_USDT");
    Assert.assertEquals("BTCUSDT", BinanceTradingPair.fromNormalized(pair).value());
  }

  @Test
  public void encodeFallsBackToStrippingAfterSplit() throws InvalidPairFormatException {
    NormalizedTradingPair pair = NormalizedTradingPair.ofPair(CexExchange.BINANCE, "BTC-US_DT", '-');
    Assert.assertEquals("BTCUSDT", BinanceTradingPair.fromNormalized(pair).value());
  }

  @Test
  public void encodeFailsWhenNothingIsLeft() {
    try {
      BinanceTradingPair.fromNormalized(NormalizedTradingPair.ofPair(CexExchange.BINANCE, "-/_"));
      Assert.fail("expected InvalidPairFormatException");
    } catch (InvalidPairFormatException e) {
      Assert.assertEquals("-/_", e.getRaw());
      Assert.assertTrue(e.getMessage().contains("-/_"));
    }
  }

  @Test
  public void normalizeKeepsNativeString() throws InvalidPairFormatException {
    BinanceTradingPair pair = BinanceTradingPair.of("btcusdt");
    Assert.assertEquals(NormalizedTradingPair.ofPair(CexExchange.BINANCE, "BTCUSDT"), pair.normalize());
    Assert.assertEquals(NormalizedTradingPair.ofBaseQuote(CexExchange.BINANCE, "BTC", "USDT"),
      pair.normalizeWith("BTC", "USDT"));
  }
}

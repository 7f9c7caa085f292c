package io.magicalne.cex.exchanges.binance;

import io.magicalne.cex.dto.CexExchange;
import io.magicalne.cex.dto.NormalizedCurrency;
import io.magicalne.cex.dto.NormalizedTradingPair;
import io.magicalne.cex.dto.NormalizedTradingType;
import io.magicalne.cex.exception.InvalidPairFormatException;
import io.magicalne.cex.exception.NormalizationException;
import io.magicalne.cex.exchanges.ExchangeNormalizer;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

@Slf4j
public class BinanceNormalizer implements ExchangeNormalizer {

  @Override
  public CexExchange exchange() {
    return CexExchange.BINANCE;
  }

  @Override
  public boolean isValidPair(String raw) {
    return BinanceTradingPair.isValid(raw);
  }

  @Override
  public BinanceTradingPair decodePair(String raw) throws InvalidPairFormatException {
    return BinanceTradingPair.of(raw);
  }

  @Override
  public BinanceTradingPair encodePair(NormalizedTradingPair pair) throws InvalidPairFormatException {
    return BinanceTradingPair.fromNormalized(pair);
  }

  @Override
  public NormalizedTradingType parseTradingType(String token) {
    return BinanceTradingType.parse(token).toNormalized();
  }

  @Override
  public List<NormalizedCurrency> normalizeCurrencies(String rawJson) throws NormalizationException {
    BinanceAllSymbols symbols = BinanceAllSymbols.parse(rawJson);
    List<NormalizedCurrency> currencies = symbols.normalize();
    log.info("Normalized {} binance symbols into {} currencies.", symbols.getSymbols().size(), currencies.size());
    return currencies;
  }

  @Override
  public boolean isEquivalent(String rawJson, List<NormalizedCurrency> reference) throws NormalizationException {
    return BinanceAllSymbols.parse(rawJson).isEquivalent(reference);
  }
}

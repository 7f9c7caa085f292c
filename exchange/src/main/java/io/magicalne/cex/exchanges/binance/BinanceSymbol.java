package io.magicalne.cex.exchanges.binance;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import io.magicalne.cex.dto.Blockchain;
import io.magicalne.cex.dto.BlockchainCurrency;
import io.magicalne.cex.dto.CexExchange;
import io.magicalne.cex.dto.NormalizedCurrency;
import io.magicalne.cex.dto.WrappedCurrency;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * One entry of the Binance "symbols with addresses" listing.
 */
@Slf4j
@Data
public class BinanceSymbol {
  private Long id;
  private String symbol;
  private String name;
  private String slug;
  @JsonProperty("cmc_rank")
  private Long cmcRank;
  @JsonProperty("num_market_pairs")
  private Long numMarketPairs;
  @JsonProperty("circulating_supply")
  private Double circulatingSupply;
  @JsonProperty("total_supply")
  private Double totalSupply;
  @JsonProperty("max_supply")
  private Double maxSupply;
  @JsonProperty("infinite_supply")
  private Boolean infiniteSupply;
  @JsonProperty("self_reported_circulating_supply")
  private Double selfReportedCirculatingSupply;
  @JsonProperty("self_reported_market_cap")
  private Double selfReportedMarketCap;
  @JsonProperty("tvl_ratio")
  private Double tvlRatio;
  @JsonProperty("last_updated")
  private Instant lastUpdated;
  @JsonProperty("date_added")
  private Instant dateAdded;
  private BinanceSymbolPlatform platform;
  private BinanceSymbolQuote quote;
  private List<String> tags;

  /**
   * Every field except the supply extras, {@code tvl_ratio} and {@code platform} is required; a
   * platform or quote that is present must be complete.
   *
   * @return the first required field that is absent, dotted for nested ones, or null
   */
  public String missingField() {
    String missing = firstMissing(
      "id", id,
      "symbol", symbol,
      "name", name,
      "slug", slug,
      "cmc_rank", cmcRank,
      "num_market_pairs", numMarketPairs,
      "circulating_supply", circulatingSupply,
      "total_supply", totalSupply,
      "infinite_supply", infiniteSupply,
      "last_updated", lastUpdated,
      "date_added", dateAdded,
      "quote", quote,
      "tags", tags);
    if (missing != null) {
      return missing;
    }
    missing = quote.missingField();
    if (missing != null) {
      return "quote." + missing;
    }
    if (platform != null) {
      missing = platform.missingField();
      if (missing != null) {
        return "platform." + missing;
      }
    }
    return null;
  }

  /**
   * @param namesAndValues alternating field name and value
   */
  static String firstMissing(Object... namesAndValues) {
    for (int i = 0; i < namesAndValues.length; i += 2) {
      if (namesAndValues[i + 1] == null) {
        return (String) namesAndValues[i];
      }
    }
    return null;
  }

  public String status() {
    return "last updated: " + lastUpdated;
  }

  /**
   * @throws io.magicalne.cex.exception.UnrecognizedBlockchainException if the platform names an
   *         unknown chain
   */
  public Optional<BlockchainCurrency> parseBlockchain() {
    if (platform == null) {
      return Optional.empty();
    }
    boolean wrapped = WrappedCurrency.looksWrapped(symbol, name);
    return Optional.of(new BlockchainCurrency(
      Blockchain.parse(platform.getName()), platform.getTokenAddress(), wrapped, null));
  }

  public NormalizedCurrency normalize() {
    List<BlockchainCurrency> blockchains = parseBlockchain()
      .map(ImmutableList::of)
      .orElse(ImmutableList.of());
    return new NormalizedCurrency(CexExchange.BINANCE, symbol, name, null, status(), blockchains);
  }

  /**
   * Checks that {@code other} is what this record normalizes to, ignoring platforms added by
   * wrapped-token linking.
   */
  public boolean matches(NormalizedCurrency other) {
    List<BlockchainCurrency> blockchains = parseBlockchain()
      .map(ImmutableList::of)
      .orElse(ImmutableList.of());
    List<BlockchainCurrency> own = other.getBlockchains().stream()
      .filter(b -> b.getWrappedCurrency() == null)
      .collect(Collectors.toList());
    boolean equals = other.getExchange() == CexExchange.BINANCE
      && Objects.equals(other.getSymbol(), symbol)
      && Objects.equals(other.getName(), name)
      && other.getDisplayName() == null
      && Objects.equals(other.getStatus(), status())
      && own.equals(blockchains);

    if (!equals) {
      log.warn("binance currency: {}", this);
      log.warn("normalized currency: {}", other);
    }
    return equals;
  }
}

package io.magicalne.cex.exchanges.binance;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.time.Instant;

@Data
public class BinanceSymbolQuote {

  @JsonProperty("USD")
  private Usd usd;

  public String missingField() {
    if (usd == null) {
      return "USD";
    }
    String missing = usd.missingField();
    return missing == null ? null : "USD." + missing;
  }

  @Data
  public static class Usd {
    @JsonProperty("fully_diluted_market_cap")
    private Double fullyDilutedMarketCap;
    @JsonProperty("last_updated")
    private Instant lastUpdated;
    @JsonProperty("market_cap_dominance")
    private Double marketCapDominance;
    private Double tvl;
    @JsonProperty("percent_change_1h")
    private Double percentChange1h;
    @JsonProperty("percent_change_24h")
    private Double percentChange24h;
    @JsonProperty("percent_change_7d")
    private Double percentChange7d;
    @JsonProperty("percent_change_30d")
    private Double percentChange30d;
    @JsonProperty("percent_change_60d")
    private Double percentChange60d;
    @JsonProperty("percent_change_90d")
    private Double percentChange90d;
    @JsonProperty("market_cap")
    private Double marketCap;
    @JsonProperty("volume_24h")
    private Double volume24h;
    @JsonProperty("volume_change_24h")
    private Double volumeChange24h;
    private Double price;

    /**
     * {@code tvl} is the only optional metric.
     */
    public String missingField() {
      return BinanceSymbol.firstMissing(
        "fully_diluted_market_cap", fullyDilutedMarketCap,
        "last_updated", lastUpdated,
        "market_cap_dominance", marketCapDominance,
        "percent_change_1h", percentChange1h,
        "percent_change_24h", percentChange24h,
        "percent_change_7d", percentChange7d,
        "percent_change_30d", percentChange30d,
        "percent_change_60d", percentChange60d,
        "percent_change_90d", percentChange90d,
        "market_cap", marketCap,
        "volume_24h", volume24h,
        "volume_change_24h", volumeChange24h,
        "price", price);
    }
  }
}

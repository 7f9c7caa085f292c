package io.magicalne.cex.exchanges.binance;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * Chain a token is issued on, e.g.
 * {"symbol":"ETH","name":"Ethereum","token_address":"0x2260...c599","id":1027,"slug":"ethereum"}
 */
@Data
public class BinanceSymbolPlatform {
  private String symbol;
  private String name;
  @JsonProperty("token_address")
  private String tokenAddress;
  private Long id;
  private String slug;

  public String missingField() {
    return BinanceSymbol.firstMissing(
      "symbol", symbol,
      "name", name,
      "token_address", tokenAddress,
      "id", id,
      "slug", slug);
  }
}

package io.magicalne.cex.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Exchange agnostic currency record.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class NormalizedCurrency {

    @JsonProperty("exchange")
    private final CexExchange exchange;
    @JsonProperty("symbol")
    private final String symbol;
    @JsonProperty("name")
    private final String name;
    @JsonProperty("display_name")
    private final String displayName;
    @JsonProperty("status")
    private final String status;
    @JsonProperty("blockchains")
    private final List<BlockchainCurrency> blockchains;

    @JsonCreator
    public NormalizedCurrency(@JsonProperty("exchange") CexExchange exchange,
                              @JsonProperty("symbol") String symbol,
                              @JsonProperty("name") String name,
                              @JsonProperty("display_name") String displayName,
                              @JsonProperty("status") String status,
                              @JsonProperty("blockchains") List<BlockchainCurrency> blockchains) {
        this.exchange = Preconditions.checkNotNull(exchange, "exchange");
        this.symbol = Preconditions.checkNotNull(symbol, "symbol");
        this.name = Preconditions.checkNotNull(name, "name");
        this.displayName = displayName;
        this.status = status;
        this.blockchains = blockchains == null ? ImmutableList.of() : ImmutableList.copyOf(blockchains);
    }

    public NormalizedCurrency withBlockchains(List<BlockchainCurrency> blockchains) {
        return new NormalizedCurrency(exchange, symbol, name, displayName, status, blockchains);
    }

    @JsonIgnore
    public boolean isWrapped() {
        return blockchains.stream().anyMatch(BlockchainCurrency::isWrapped);
    }

    /**
     * True when this record absorbed at least one wrapped token of the raw feed, i.e. the feed
     * holds one more record than the canonical batch for it.
     */
    @JsonIgnore
    public boolean hasLinkedWrapped() {
        return blockchains.stream().anyMatch(BlockchainCurrency::isLinkedWrapped);
    }
}

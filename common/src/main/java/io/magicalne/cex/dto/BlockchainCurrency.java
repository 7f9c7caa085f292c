package io.magicalne.cex.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A chain a currency is issued on.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class BlockchainCurrency {

    @JsonProperty("blockchain")
    private final Blockchain blockchain;
    @JsonProperty("address")
    private final String address;
    @JsonProperty("is_wrapped")
    private final boolean wrapped;
    @JsonProperty("wrapped_currency")
    private final WrappedCurrency wrappedCurrency;

    @JsonCreator
    public BlockchainCurrency(@JsonProperty("blockchain") Blockchain blockchain,
                              @JsonProperty("address") String address,
                              @JsonProperty("is_wrapped") boolean wrapped,
                              @JsonProperty("wrapped_currency") WrappedCurrency wrappedCurrency) {
        this.blockchain = Preconditions.checkNotNull(blockchain, "blockchain");
        this.address = address;
        this.wrapped = wrapped;
        this.wrappedCurrency = wrappedCurrency;
    }

    public BlockchainCurrency withWrappedCurrency(WrappedCurrency wrappedCurrency) {
        return new BlockchainCurrency(blockchain, address, wrapped, wrappedCurrency);
    }

    /**
     * A platform added by linking a wrapped token to its underlying currency.
     */
    @JsonIgnore
    public boolean isLinkedWrapped() {
        return wrapped && wrappedCurrency != null && wrappedCurrency.looksWrapped();
    }
}

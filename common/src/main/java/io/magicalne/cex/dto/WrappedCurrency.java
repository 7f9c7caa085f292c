package io.magicalne.cex.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Collection;
import java.util.Locale;
import java.util.Optional;

/**
 * Lookup key of the wrapped counterpart of a currency. It does not hold the currency itself: the
 * referenced record is found in a batch with {@link #resolve(Collection)}.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class WrappedCurrency {

    @JsonProperty("symbol")
    private final String symbol;
    @JsonProperty("name")
    private final String name;

    @JsonCreator
    public WrappedCurrency(@JsonProperty("symbol") String symbol, @JsonProperty("name") String name) {
        this.symbol = Preconditions.checkNotNull(symbol, "symbol");
        this.name = Preconditions.checkNotNull(name, "name");
    }

    public static WrappedCurrency of(NormalizedCurrency currency) {
        return new WrappedCurrency(currency.getSymbol(), currency.getName());
    }

    /**
     * Heuristic used on raw feeds: the name mentions "wrapped" and the symbol starts with "w".
     */
    public static boolean looksWrapped(String symbol, String name) {
        return name.toLowerCase(Locale.ROOT).contains("wrapped")
                && symbol.toLowerCase(Locale.ROOT).startsWith("w");
    }

    public boolean looksWrapped() {
        return looksWrapped(symbol, name);
    }

    public Optional<NormalizedCurrency> resolve(Collection<NormalizedCurrency> batch) {
        return batch.stream()
                .filter(c -> symbol.equals(c.getSymbol()) && name.equals(c.getName()))
                .findFirst();
    }
}

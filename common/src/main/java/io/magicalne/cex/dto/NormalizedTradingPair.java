package io.magicalne.cex.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Exchange agnostic trading pair. Holds either an explicit base/quote pair or a raw pair string
 * with an optional delimiter, never both.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class NormalizedTradingPair {

    public static final String DELIMITERS = "-_/";
    private static final CharMatcher DELIMITER_MATCHER = CharMatcher.anyOf(DELIMITERS);

    private final CexExchange exchange;
    private final String base;
    private final String quote;
    private final String pair;
    private final Character delimiter;

    @JsonCreator
    NormalizedTradingPair(@JsonProperty("exchange") CexExchange exchange,
                          @JsonProperty("base") String base,
                          @JsonProperty("quote") String quote,
                          @JsonProperty("pair") String pair,
                          @JsonProperty("delimiter") Character delimiter) {
        Preconditions.checkNotNull(exchange, "exchange");
        boolean hasBaseQuote = base != null && quote != null;
        Preconditions.checkArgument((base == null) == (quote == null),
                "base and quote must be set together: %s/%s", base, quote);
        Preconditions.checkArgument(hasBaseQuote != (pair != null),
                "exactly one of base/quote or pair must be set");
        Preconditions.checkArgument(delimiter == null || pair != null,
                "delimiter requires a raw pair");
        if (delimiter != null) {
            Preconditions.checkArgument(DELIMITER_MATCHER.matches(delimiter),
                    "delimiter '%s' is not one of %s", delimiter, DELIMITERS);
            Preconditions.checkArgument(isTwoParts(pair, delimiter),
                    "pair '%s' does not split on '%s' into two parts", pair, delimiter);
        }
        this.exchange = exchange;
        this.base = base;
        this.quote = quote;
        this.pair = pair;
        this.delimiter = delimiter;
    }

    public static NormalizedTradingPair ofBaseQuote(CexExchange exchange, String base, String quote) {
        Preconditions.checkNotNull(base, "base");
        Preconditions.checkNotNull(quote, "quote");
        return new NormalizedTradingPair(exchange, base, quote, null, null);
    }

    public static NormalizedTradingPair ofPair(CexExchange exchange, String pair) {
        return ofPair(exchange, pair, null);
    }

    public static NormalizedTradingPair ofPair(CexExchange exchange, String pair, Character delimiter) {
        Preconditions.checkNotNull(pair, "pair");
        return new NormalizedTradingPair(exchange, null, null, pair, delimiter);
    }

    public boolean hasBaseQuote() {
        return base != null;
    }

    /**
     * Splits the raw pair on its delimiter.
     *
     * @return exactly two non-empty parts
     */
    public List<String> splitPair() {
        Preconditions.checkState(delimiter != null, "pair '%s' has no delimiter", pair);
        return Splitter.on(delimiter).splitToList(pair);
    }

    private static boolean isTwoParts(String pair, char delimiter) {
        List<String> parts = Splitter.on(delimiter).splitToList(pair);
        return parts.size() == 2 && !parts.get(0).isEmpty() && !parts.get(1).isEmpty();
    }
}

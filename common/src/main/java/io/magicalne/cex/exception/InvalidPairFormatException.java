package io.magicalne.cex.exception;

import io.magicalne.cex.dto.CexExchange;

public class InvalidPairFormatException extends NormalizationException {
    private static final String ERR_MSG = "INVALID %s trading pair '%s'";
    private static final String ERR_MSG_1 = "INVALID %s trading pair '%s' contains one of %s";

    private final String raw;

    public InvalidPairFormatException(CexExchange exchange, String raw) {
        super(String.format(ERR_MSG, exchange, raw));
        this.raw = raw;
    }

    public InvalidPairFormatException(CexExchange exchange, String raw, String forbidden) {
        super(String.format(ERR_MSG_1, exchange, raw, forbidden));
        this.raw = raw;
    }

    public String getRaw() {
        return raw;
    }
}

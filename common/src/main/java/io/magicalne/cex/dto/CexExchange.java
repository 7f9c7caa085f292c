package io.magicalne.cex.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum CexExchange {
    BINANCE("binance");

    private final String id;

    CexExchange(String id) {
        this.id = id;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    @JsonCreator
    public static CexExchange fromId(String id) {
        if (id != null) {
            for (CexExchange exchange : values()) {
                if (exchange.id.equalsIgnoreCase(id.trim())) {
                    return exchange;
                }
            }
        }
        throw new IllegalArgumentException("Unsupported exchange: " + id);
    }

    @Override
    public String toString() {
        return id;
    }
}

package io.magicalne.cex.dto;

public enum NormalizedTradingType {
    SPOT,
    PERPETUAL,
    MARGIN,
    FUTURES,
    OPTION,
    OTHER
}

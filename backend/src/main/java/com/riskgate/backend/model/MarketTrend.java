package com.riskgate.backend.model;

import com.fasterxml.jackson.annotation.JsonCreator;

public enum MarketTrend {
    BULLISH,
    BEARISH,
    NEUTRAL;

    @JsonCreator
    public static MarketTrend from(String value) {
        if (value == null || value.isBlank()) {
            return NEUTRAL;
        }
        return MarketTrend.valueOf(value.trim().toUpperCase());
    }
}

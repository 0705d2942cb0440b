package com.riskgate.backend.model;

import com.fasterxml.jackson.annotation.JsonCreator;

public enum OrderSide {
    BUY,
    SELL;

    public OrderSide opposite() {
        return this == BUY ? SELL : BUY;
    }

    @JsonCreator
    public static OrderSide from(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Order side is required");
        }
        return OrderSide.valueOf(value.trim().toUpperCase());
    }
}

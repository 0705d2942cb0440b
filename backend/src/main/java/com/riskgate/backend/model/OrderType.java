package com.riskgate.backend.model;

public enum OrderType {
    MARKET,
    LIMIT
}

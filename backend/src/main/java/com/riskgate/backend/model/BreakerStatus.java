package com.riskgate.backend.model;

public enum BreakerStatus {
    CLOSED,
    OPEN,
    HALF_OPEN
}

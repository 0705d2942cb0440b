package com.riskgate.backend.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum BusMessageType {
    OBSERVATION,
    PROPOSAL,
    CRITIQUE,
    QUERY,
    RESPONSE,
    VOTE,
    CONSENSUS,
    EXECUTION,
    HEARTBEAT;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static BusMessageType from(String value) {
        if (value == null) {
            throw new IllegalArgumentException("message type is required");
        }
        return BusMessageType.valueOf(value.trim().toUpperCase());
    }
}

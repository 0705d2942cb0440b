package com.riskgate.backend.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum SenderRole {
    AGENT,
    COORDINATOR,
    OBSERVER;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static SenderRole from(String value) {
        if (value == null) {
            return AGENT;
        }
        return SenderRole.valueOf(value.trim().toUpperCase());
    }
}

package com.riskgate.backend.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SubmissionStatus {
    SUBMITTED,
    DUPLICATE,
    REJECTED;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }
}

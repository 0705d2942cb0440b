package com.riskgate.backend.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record StatusResponse(String status, String message) {

    public static StatusResponse of(String status) {
        return new StatusResponse(status, null);
    }
}

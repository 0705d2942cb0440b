package com.riskgate.backend.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record TrailingResponse(
        boolean adjusted,
        @JsonProperty("stop_price") Double stopPrice,
        @JsonProperty("locked_in_pct") Double lockedInPct,
        String reason
) {}

package com.riskgate.backend.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * An agent's inference result, forwarded to telemetry as-is.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RegisterDecisionRequest {

    @NotBlank
    @JsonProperty("bot_id")
    private String botId;

    private String symbol;

    @NotBlank
    private String decision;

    @Builder.Default
    private Map<String, Object> context = new HashMap<>();

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private Double confidence;

    private String reasoning;
}

package com.riskgate.backend.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VoteRequest {

    @NotBlank
    @JsonProperty("agent_id")
    private String agentId;

    @NotNull
    private Boolean approved;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    @Builder.Default
    private Double confidence = 0.5;
}

package com.riskgate.backend.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
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
public class TradeResultRequest {

    @NotBlank
    @JsonProperty("agent_id")
    private String agentId;

    @NotBlank
    private String symbol;

    @NotNull
    private Double pnl;
}

package com.riskgate.backend.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.riskgate.backend.model.OrderSide;
import com.riskgate.backend.model.ProposalPayload;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProposalRequest {

    @JsonProperty("proposal_id")
    private String proposalId;

    @NotBlank
    @JsonProperty("proposer_id")
    private String proposerId;

    @JsonProperty("session_id")
    private String sessionId;

    @NotBlank
    private String symbol;

    @NotNull
    private OrderSide side;

    @NotNull
    @Positive
    private Double notional;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    @Builder.Default
    private Double confidence = 0.5;

    private String rationale;

    @Builder.Default
    private Map<String, Object> constraints = new HashMap<>();

    public ProposalPayload toPayload() {
        return new ProposalPayload(symbol.trim().toUpperCase(), side, notional,
                confidence != null ? confidence : 0.5, rationale, constraints);
    }
}

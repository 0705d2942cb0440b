package com.riskgate.backend.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.riskgate.backend.model.MarketAnalysis;
import com.riskgate.backend.model.MarketTrend;
import com.riskgate.backend.model.OrderSide;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TpslRequest {

    @NotBlank
    private String symbol;

    @NotNull
    private OrderSide side;

    @NotNull
    @Positive
    @JsonProperty("entry_price")
    private Double entryPrice;

    @JsonProperty("agent_id")
    private String agentId;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    @Builder.Default
    private Double confidence = 0.7;

    @PositiveOrZero
    private Double atr;

    private MarketTrend trend;

    @DecimalMin("0.0")
    @DecimalMax("100.0")
    private Double rsi;

    public MarketAnalysis toMarketAnalysis() {
        return new MarketAnalysis(atr, trend, rsi);
    }
}

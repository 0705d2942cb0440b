package com.riskgate.backend.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.riskgate.backend.model.OrderSide;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrailingRequest {

    @NotNull
    @JsonProperty("pnl_pct")
    private Double pnlPct;

    @NotNull
    @Positive
    @JsonProperty("current_sl_pct")
    private Double currentSlPct;

    @NotNull
    @Positive
    @JsonProperty("entry_price")
    private Double entryPrice;

    @NotNull
    @Positive
    @JsonProperty("high_water_mark")
    private Double highWaterMark;

    @NotNull
    private OrderSide side;

    @Positive
    private Double activation;

    @Positive
    private Double distance;
}

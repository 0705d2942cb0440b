package com.riskgate.backend.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.riskgate.backend.model.OrderIntent;
import com.riskgate.backend.model.OrderSide;
import com.riskgate.backend.model.OrderType;
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
public class OrderIntentRequest {

    @NotBlank
    private String symbol;

    @NotNull
    private OrderSide side;

    @Builder.Default
    private OrderType type = OrderType.MARKET;

    @NotNull
    @Positive
    private Double notional;

    @Positive
    private Double quantity;

    @Positive
    private Double price;

    @Positive
    @JsonProperty("take_profit")
    private Double takeProfit;

    @Positive
    @JsonProperty("stop_loss")
    private Double stopLoss;

    @Positive
    private Double leverage;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    @Builder.Default
    @JsonProperty("expected_win_rate")
    private Double expectedWinRate = OrderIntent.DEFAULT_WIN_RATE;

    @Positive
    @Builder.Default
    @JsonProperty("reward_to_risk")
    private Double rewardToRisk = OrderIntent.DEFAULT_REWARD_TO_RISK;

    @Builder.Default
    @JsonProperty("client_metadata")
    private Map<String, Object> clientMetadata = new HashMap<>();

    public OrderIntent toIntent() {
        return OrderIntent.builder()
                .symbol(symbol.trim().toUpperCase())
                .side(side)
                .orderType(type != null ? type : OrderType.MARKET)
                .notional(notional)
                .quantity(quantity)
                .price(price)
                .takeProfit(takeProfit)
                .stopLoss(stopLoss)
                .leverage(leverage)
                .expectedWinRate(expectedWinRate != null ? expectedWinRate : OrderIntent.DEFAULT_WIN_RATE)
                .rewardToRisk(rewardToRisk != null ? rewardToRisk : OrderIntent.DEFAULT_REWARD_TO_RISK)
                .clientMetadata(clientMetadata)
                .build();
    }
}

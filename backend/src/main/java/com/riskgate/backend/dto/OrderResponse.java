package com.riskgate.backend.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.riskgate.backend.model.OrderSubmissionResult;
import com.riskgate.backend.model.RiskCheckResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OrderResponse {

    private String status;

    @JsonProperty("order_id")
    private String orderId;

    private String code;

    private String reason;

    @JsonProperty("adjusted_size")
    private Double adjustedSize;

    @JsonProperty("adjusted_leverage")
    private Double adjustedLeverage;

    @JsonProperty("max_loss_usd")
    private Double maxLossUsd;

    public static OrderResponse from(OrderSubmissionResult result) {
        OrderResponseBuilder builder = OrderResponse.builder()
                .status(result.status().value())
                .orderId(result.orderId())
                .reason(result.reason());
        if (result.code() != null) {
            builder.code(result.code().code());
        }
        RiskCheckResult check = result.riskCheck();
        if (check != null) {
            builder.adjustedSize(check.adjustedSize())
                    .adjustedLeverage(check.adjustedLeverage())
                    .maxLossUsd(check.maxLossUsd());
        }
        return builder.build();
    }
}

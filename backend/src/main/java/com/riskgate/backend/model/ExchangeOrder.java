package com.riskgate.backend.model;

import lombok.Builder;

import java.util.Map;

/**
 * Decorated order as forwarded to the exchange.
 */
@Builder(toBuilder = true)
public record ExchangeOrder(
        String clientOrderId,
        String symbol,
        OrderSide side,
        OrderType type,
        double quantity,
        Double price,
        Double stopLossPrice,
        Double takeProfitPrice,
        double notional,
        double leverage,
        Map<String, Object> metadata
) {}

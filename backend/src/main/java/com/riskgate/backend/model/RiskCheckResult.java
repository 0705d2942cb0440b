package com.riskgate.backend.model;

public record RiskCheckResult(
        boolean approved,
        String reason,
        String orderId,
        double adjustedSize,
        double adjustedLeverage,
        double maxLossUsd
) {

    public static RiskCheckResult approve(String orderId, double adjustedSize, double adjustedLeverage,
                                          double maxLossUsd, String reason) {
        return new RiskCheckResult(true, reason, orderId, adjustedSize, adjustedLeverage, maxLossUsd);
    }

    public static RiskCheckResult reject(String reason) {
        return new RiskCheckResult(false, reason, null, 0.0, 0.0, 0.0);
    }

    public RiskCheckResult withOrderId(String newOrderId) {
        return new RiskCheckResult(approved, reason, newOrderId, adjustedSize, adjustedLeverage, maxLossUsd);
    }
}

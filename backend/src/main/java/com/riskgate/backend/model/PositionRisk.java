package com.riskgate.backend.model;

/**
 * One open position as reported by the exchange. {@code positionAmt} is signed:
 * negative for shorts.
 */
public record PositionRisk(String symbol, double positionAmt, double entryPrice, double markPrice,
                           double unrealizedProfit, double leverage) {

    public double notional() {
        return positionAmt * markPrice;
    }
}

package com.riskgate.backend.model;

public record AdaptiveTpsl(
        double tpPct,
        double slPct,
        double tpPrice,
        double slPrice,
        double trailingActivationPct,
        double trailingDistancePct,
        String reasoning
) {

    public double rewardToRisk() {
        return slPct > 0 ? tpPct / slPct : 0.0;
    }
}

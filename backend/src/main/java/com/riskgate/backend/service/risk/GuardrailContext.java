package com.riskgate.backend.service.risk;

import com.riskgate.backend.model.OrderIntent;
import com.riskgate.backend.model.PortfolioSnapshot;

/**
 * Inputs shared by every portfolio guardrail. {@code balance} is floored at 1 so
 * ratio checks stay defined on an empty account.
 */
public record GuardrailContext(PortfolioSnapshot snapshot, OrderIntent intent, double notional) {

    public double balance() {
        return Math.max(snapshot.balance(), 1.0);
    }

    /**
     * Loss if the stop is hit: notional times the entry-to-stop distance. Zero when
     * the intent carries no stop or no usable entry price.
     */
    public double potentialLoss() {
        Double stopPct = intent.stopLossPct();
        return stopPct == null ? 0.0 : notional * stopPct;
    }
}

package com.riskgate.backend.service.risk;

import com.riskgate.backend.config.RiskProperties;
import com.riskgate.backend.model.OrderIntent;
import com.riskgate.backend.model.PortfolioSnapshot;
import com.riskgate.backend.model.RiskCheckResult;
import com.riskgate.backend.util.RiskMath;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.UUID;

@Service
@RequiredArgsConstructor
public class DefaultRiskEngine implements RiskEngine {

    private final RiskProperties riskProperties;

    @Override
    public RiskCheckResult evaluate(PortfolioSnapshot snapshot, OrderIntent intent, double agentAllocationUsd) {
        RiskProperties.Engine limits = riskProperties.getEngine();

        double drawdownPct = RiskMath.drawdownPct(snapshot.peakBalance(), snapshot.equity());
        if (drawdownPct > limits.getMaxDrawdownPct()) {
            return RiskCheckResult.reject("Drawdown " + RiskMath.pct(drawdownPct) + " > " + RiskMath.pct(limits.getMaxDrawdownPct()));
        }

        if (snapshot.balance() < limits.getMinMarginBufferUsdt()) {
            return RiskCheckResult.reject(String.format(Locale.ROOT, "Margin buffer %.2f < %.2f",
                    snapshot.balance(), limits.getMinMarginBufferUsdt()));
        }

        double notional = resolveNotional(snapshot, intent);
        double kelly = RiskMath.kellyFraction(intent.expectedWinRate(), intent.rewardToRisk());
        double fraction = Math.min(kelly, limits.getMaxPerTradePct() / 100.0);
        double cap = Math.max(0.0, agentAllocationUsd) * fraction;
        if (notional > cap) {
            return RiskCheckResult.reject(String.format(Locale.ROOT,
                    "Notional %.2f > per-trade cap %.2f (kelly %.3f, allocation %.2f)",
                    notional, cap, kelly, agentAllocationUsd));
        }

        double leverage = intent.effectiveLeverage();
        Double stopPct = intent.stopLossPct();
        double maxLoss = stopPct != null ? notional * stopPct * leverage : 0.0;
        return RiskCheckResult.approve(UUID.randomUUID().toString(), notional, leverage, maxLoss, "approved");
    }

    /**
     * Quantity times reference price when a quantity is given, falling back to the
     * snapshot mark price, then the configured fallback; otherwise the intent notional.
     */
    double resolveNotional(PortfolioSnapshot snapshot, OrderIntent intent) {
        if (intent.quantity() == null || intent.quantity() <= 0) {
            return intent.notional();
        }
        Double reference = intent.referencePrice();
        if (reference == null) {
            reference = snapshot.markPrice(intent.symbol()).orElse(null);
        }
        if (reference == null && riskProperties.getEngine().getFallbackReferencePrice() > 0) {
            reference = riskProperties.getEngine().getFallbackReferencePrice();
        }
        return reference != null ? intent.quantity() * reference : intent.notional();
    }
}

package com.riskgate.backend.service.risk;

import com.riskgate.backend.config.RiskProperties;
import com.riskgate.backend.model.GuardrailCode;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;

/**
 * Rejects orders whose stop-out would push equity below
 * {@code balance * (1 - max_drawdown)}.
 */
@Component
@Order(4)
@RequiredArgsConstructor
public class DrawdownFloorGuardrail implements Guardrail {

    private final RiskProperties riskProperties;

    @Override
    public GuardrailCode code() {
        return GuardrailCode.DRAWDOWN_GUARDRAIL;
    }

    @Override
    public Optional<String> check(GuardrailContext context) {
        double potentialLoss = context.potentialLoss();
        if (potentialLoss <= 0) {
            return Optional.empty();
        }
        double balance = context.balance();
        double floor = balance * (1 - riskProperties.getGuardrails().getMaxDrawdown());
        double equityAfterStop = balance + context.snapshot().unrealizedPnl() - potentialLoss;
        if (equityAfterStop < floor) {
            return Optional.of(String.format(Locale.ROOT, "Equity after stop %.2f below floor %.2f",
                    equityAfterStop, floor));
        }
        return Optional.empty();
    }
}

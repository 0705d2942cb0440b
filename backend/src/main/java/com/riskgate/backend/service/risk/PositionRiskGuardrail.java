package com.riskgate.backend.service.risk;

import com.riskgate.backend.config.RiskProperties;
import com.riskgate.backend.model.GuardrailCode;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;

@Component
@Order(2)
@RequiredArgsConstructor
public class PositionRiskGuardrail implements Guardrail {

    private final RiskProperties riskProperties;

    @Override
    public GuardrailCode code() {
        return GuardrailCode.POSITION_RISK_LIMIT;
    }

    @Override
    public Optional<String> check(GuardrailContext context) {
        double limit = context.balance() * riskProperties.getGuardrails().getMaxPositionRisk();
        if (context.notional() > limit) {
            return Optional.of(String.format(Locale.ROOT, "Notional %.2f exceeds position limit %.2f",
                    context.notional(), limit));
        }
        return Optional.empty();
    }
}

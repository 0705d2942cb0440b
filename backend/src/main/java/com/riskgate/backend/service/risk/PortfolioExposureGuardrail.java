package com.riskgate.backend.service.risk;

import com.riskgate.backend.config.RiskProperties;
import com.riskgate.backend.model.GuardrailCode;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;

@Component
@Order(3)
@RequiredArgsConstructor
public class PortfolioExposureGuardrail implements Guardrail {

    private final RiskProperties riskProperties;

    @Override
    public GuardrailCode code() {
        return GuardrailCode.PORTFOLIO_EXPOSURE_LIMIT;
    }

    @Override
    public Optional<String> check(GuardrailContext context) {
        double projected = context.snapshot().totalExposure() + context.notional();
        double limit = context.balance() * riskProperties.getGuardrails().getMaxPortfolioLeverage();
        if (projected > limit) {
            return Optional.of(String.format(Locale.ROOT, "Projected exposure %.2f exceeds %.2f", projected, limit));
        }
        return Optional.empty();
    }
}

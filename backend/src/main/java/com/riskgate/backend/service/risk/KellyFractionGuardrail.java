package com.riskgate.backend.service.risk;

import com.riskgate.backend.config.RiskProperties;
import com.riskgate.backend.model.GuardrailCode;
import com.riskgate.backend.util.RiskMath;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;

@Component
@Order(1)
@RequiredArgsConstructor
public class KellyFractionGuardrail implements Guardrail {

    private static final double MIN_FRACTION = 1e-3;

    private final RiskProperties riskProperties;

    @Override
    public GuardrailCode code() {
        return GuardrailCode.KELLY_FRACTION_EXCEEDED;
    }

    @Override
    public Optional<String> check(GuardrailContext context) {
        double kelly = RiskMath.kellyFraction(context.intent().expectedWinRate(), context.intent().rewardToRisk());
        double fraction = Math.max(Math.min(kelly, riskProperties.getGuardrails().getKellyFractionCap()), MIN_FRACTION);
        double limit = context.balance() * fraction;
        if (context.notional() > limit) {
            return Optional.of(String.format(Locale.ROOT, "Notional %.2f exceeds Kelly limit %.2f (fraction %.3f)",
                    context.notional(), limit, fraction));
        }
        return Optional.empty();
    }
}

package com.riskgate.backend.service.risk;

import com.riskgate.backend.model.GuardrailCode;

import java.util.Optional;

/**
 * One named portfolio-level rule. Returns a violation message when the order must be
 * rejected with {@link #code()}.
 */
public interface Guardrail {

    GuardrailCode code();

    Optional<String> check(GuardrailContext context);
}

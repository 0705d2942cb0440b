package com.riskgate.backend.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Stable machine-readable rejection codes returned to order submitters.
 */
public enum GuardrailCode {
    KELLY_FRACTION_EXCEEDED("kelly_fraction_exceeded"),
    POSITION_RISK_LIMIT("position_risk_limit"),
    PORTFOLIO_EXPOSURE_LIMIT("portfolio_exposure_limit"),
    DRAWDOWN_GUARDRAIL("drawdown_guardrail"),
    DUPLICATE("duplicate"),
    RISK_CHECK_FAILED("risk_check_failed"),
    POSITION_SIZING("position_sizing"),
    TRADING_HALTED("trading_halted"),
    PORTFOLIO_HEAT("portfolio_heat"),
    RATE_LIMITED("rate_limited"),
    SERVICE_DEGRADED("service_degraded"),
    UNSIZEABLE_ORDER("unsizeable_order"),
    EVALUATION_ERROR("evaluation_error");

    private final String code;

    GuardrailCode(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}

package com.riskgate.backend.model;

public record TradingPermission(boolean allowed, GuardrailCode code, String reason) {

    private static final TradingPermission ALLOWED = new TradingPermission(true, null, null);

    public static TradingPermission allow() {
        return ALLOWED;
    }

    public static TradingPermission deny(GuardrailCode code, String reason) {
        return new TradingPermission(false, code, reason);
    }
}

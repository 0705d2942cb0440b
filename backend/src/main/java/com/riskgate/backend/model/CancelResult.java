package com.riskgate.backend.model;

public record CancelResult(String symbol, boolean success, String error) {

    public static CancelResult ok(String symbol) {
        return new CancelResult(symbol, true, null);
    }

    public static CancelResult failed(String symbol, String error) {
        return new CancelResult(symbol, false, error);
    }
}

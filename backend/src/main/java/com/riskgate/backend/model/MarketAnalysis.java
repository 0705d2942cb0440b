package com.riskgate.backend.model;

/**
 * Optional market context for exit planning. Any field may be null when the caller
 * has no view on it.
 */
public record MarketAnalysis(Double atr, MarketTrend trend, Double rsi) {

    public static MarketAnalysis none() {
        return new MarketAnalysis(null, null, null);
    }
}

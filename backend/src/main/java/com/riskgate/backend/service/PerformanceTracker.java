package com.riskgate.backend.service;

import com.riskgate.backend.model.SymbolStats;

/**
 * Read side of per-agent trade history used for exit planning.
 */
public interface PerformanceTracker {

    double getSymbolWinRate(String agentId, String symbol);

    SymbolStats getSymbolStats(String agentId, String symbol);
}

package com.riskgate.backend.service;

import com.riskgate.backend.model.SymbolStats;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Service
@Slf4j
public class InMemoryPerformanceTracker implements PerformanceTracker {

    private static final double NEUTRAL_WIN_RATE = 0.5;

    private final Map<String, SymbolStats> stats = new ConcurrentHashMap<>();

    public SymbolStats recordTrade(String agentId, String symbol, double pnl) {
        SymbolStats updated = stats.compute(key(agentId, symbol),
                (key, current) -> (current == null ? SymbolStats.EMPTY : current).record(pnl));
        log.debug("Trade result {} {} pnl={} -> {}W/{}L", agentId, symbol, pnl, updated.wins(), updated.losses());
        return updated;
    }

    @Override
    public double getSymbolWinRate(String agentId, String symbol) {
        SymbolStats current = getSymbolStats(agentId, symbol);
        return current.totalTrades() == 0 ? NEUTRAL_WIN_RATE : current.winRate();
    }

    @Override
    public SymbolStats getSymbolStats(String agentId, String symbol) {
        return stats.getOrDefault(key(agentId, symbol), SymbolStats.EMPTY);
    }

    private String key(String agentId, String symbol) {
        return agentId + "|" + symbol;
    }
}

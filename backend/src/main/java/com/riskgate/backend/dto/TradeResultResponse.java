package com.riskgate.backend.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.riskgate.backend.model.SymbolStats;

public record TradeResultResponse(
        @JsonProperty("daily_pnl") double dailyPnl,
        @JsonProperty("trading_halted") boolean tradingHalted,
        @JsonProperty("halt_reason") String haltReason,
        @JsonProperty("symbol_stats") SymbolStats symbolStats
) {}

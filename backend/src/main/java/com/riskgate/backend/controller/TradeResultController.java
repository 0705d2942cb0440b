package com.riskgate.backend.controller;

import com.riskgate.backend.dto.TradeResultRequest;
import com.riskgate.backend.dto.TradeResultResponse;
import com.riskgate.backend.model.SymbolStats;
import com.riskgate.backend.service.InMemoryPerformanceTracker;
import com.riskgate.backend.service.risk.RiskGuard;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequiredArgsConstructor
@Tag(name = "Orders")
public class TradeResultController {

    private final RiskGuard riskGuard;
    private final InMemoryPerformanceTracker performanceTracker;

    @PostMapping("/trade_result")
    @Operation(summary = "Record a closed trade's P&L")
    public ResponseEntity<TradeResultResponse> record(@Valid @RequestBody TradeResultRequest request) {
        String symbol = request.getSymbol().trim().toUpperCase();
        riskGuard.recordTradeResult(request.getPnl());
        SymbolStats stats = performanceTracker.recordTrade(request.getAgentId(), symbol, request.getPnl());
        return ResponseEntity.ok(new TradeResultResponse(riskGuard.getDailyPnl(), riskGuard.isTradingHalted(),
                riskGuard.getHaltReason(), stats));
    }
}

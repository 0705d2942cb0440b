package com.riskgate.backend.controller;

import com.riskgate.backend.dto.TpslRequest;
import com.riskgate.backend.dto.TrailingRequest;
import com.riskgate.backend.dto.TrailingResponse;
import com.riskgate.backend.model.AdaptiveTpsl;
import com.riskgate.backend.model.TrailingStopUpdate;
import com.riskgate.backend.service.AdaptiveTpslCalculator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Optional;

@RestController
@RequestMapping("/tpsl")
@RequiredArgsConstructor
@Tag(name = "Exit planning")
public class TpslController {

    private final AdaptiveTpslCalculator calculator;

    @PostMapping
    @Operation(summary = "Adaptive take-profit / stop-loss plan")
    public ResponseEntity<AdaptiveTpsl> calculate(@Valid @RequestBody TpslRequest request) {
        AdaptiveTpsl plan = calculator.calculate(request.getSymbol().trim().toUpperCase(), request.getSide(),
                request.getEntryPrice(), request.getAgentId(),
                request.getConfidence() != null ? request.getConfidence() : 0.7,
                request.toMarketAnalysis());
        return ResponseEntity.ok(plan);
    }

    @PostMapping("/trailing")
    @Operation(summary = "Trailing stop ratchet")
    public ResponseEntity<TrailingResponse> trailing(@Valid @RequestBody TrailingRequest request) {
        double activation = request.getActivation() != null
                ? request.getActivation() : AdaptiveTpslCalculator.TRAILING_ACTIVATION_DEFAULT;
        double distance = request.getDistance() != null
                ? request.getDistance() : AdaptiveTpslCalculator.TRAILING_DISTANCE_DEFAULT;
        Optional<TrailingStopUpdate> update = calculator.adjustForTrailing(request.getPnlPct(),
                request.getCurrentSlPct(), request.getEntryPrice(), request.getHighWaterMark(),
                request.getSide(), activation, distance);
        return ResponseEntity.ok(update
                .map(u -> new TrailingResponse(true, u.stopPrice(), u.lockedInPct(), u.reason()))
                .orElseGet(() -> new TrailingResponse(false, null, null, "No adjustment")));
    }
}

package com.riskgate.backend.controller;

import com.riskgate.backend.dto.KillSwitchRequest;
import com.riskgate.backend.dto.SafeguardStatusResponse;
import com.riskgate.backend.model.TradingPermission;
import com.riskgate.backend.service.risk.RiskGuard;
import com.riskgate.backend.service.risk.SafeguardManager;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/safeguards")
@RequiredArgsConstructor
@Tag(name = "Safeguards")
public class SafeguardController {

    private final SafeguardManager safeguardManager;
    private final RiskGuard riskGuard;

    @GetMapping("/status")
    @Operation(summary = "Breakers, heat metrics and kill switch state")
    public ResponseEntity<SafeguardStatusResponse> status() {
        return ResponseEntity.ok(buildStatus());
    }

    @PostMapping("/kill_switch")
    @Operation(summary = "Activate or clear the kill switch")
    public ResponseEntity<SafeguardStatusResponse> killSwitch(@Valid @RequestBody KillSwitchRequest request) {
        if (request.getAction() == KillSwitchRequest.Action.ACTIVATE) {
            String reason = request.getReason() == null || request.getReason().isBlank()
                    ? "Manual activation" : request.getReason();
            safeguardManager.activateKillSwitch(reason);
        } else {
            log.warn("Kill switch cleared by operator");
            safeguardManager.deactivateKillSwitch();
        }
        return ResponseEntity.ok(buildStatus());
    }

    private SafeguardStatusResponse buildStatus() {
        TradingPermission permission = safeguardManager.canTrade();
        return SafeguardStatusResponse.builder()
                .tradingAllowed(permission.allowed())
                .blockedReason(permission.reason())
                .killSwitchActive(safeguardManager.isKillSwitchActive())
                .killSwitchReason(safeguardManager.getKillSwitchReason())
                .ordersLastMinute(safeguardManager.currentOrderRate())
                .dailyPnl(riskGuard.getDailyPnl())
                .lossGuardHalted(riskGuard.isTradingHalted())
                .lossGuardReason(riskGuard.getHaltReason())
                .heat(safeguardManager.getHeatMetrics())
                .breakers(safeguardManager.breakerSnapshots())
                .build();
    }
}

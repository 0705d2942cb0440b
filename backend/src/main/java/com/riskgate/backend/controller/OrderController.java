package com.riskgate.backend.controller;

import com.riskgate.backend.dto.OrderIntentRequest;
import com.riskgate.backend.dto.OrderResponse;
import com.riskgate.backend.dto.PortfolioResponse;
import com.riskgate.backend.dto.RegisterDecisionRequest;
import com.riskgate.backend.dto.StatusResponse;
import com.riskgate.backend.model.EmergencyStopResult;
import com.riskgate.backend.model.OrderSubmissionResult;
import com.riskgate.backend.service.PortfolioStateStore;
import com.riskgate.backend.service.RiskOrchestrator;
import com.riskgate.backend.service.telemetry.EventSink;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestController
@RequiredArgsConstructor
@Tag(name = "Orders")
public class OrderController {

    private final RiskOrchestrator riskOrchestrator;
    private final PortfolioStateStore portfolioStateStore;
    private final EventSink eventSink;
    private final Clock clock;

    @PostMapping("/order/{botId}")
    @Operation(summary = "Submit an order intent through the risk gate")
    public ResponseEntity<OrderResponse> submitOrder(@PathVariable String botId,
                                                     @Valid @RequestBody OrderIntentRequest request) {
        log.info("Order intent from {}: {} {} notional={}", botId, request.getSide(), request.getSymbol(), request.getNotional());
        OrderSubmissionResult result = riskOrchestrator.submitOrder(botId, request.toIntent());
        HttpStatus status = switch (result.status()) {
            case SUBMITTED, DUPLICATE -> HttpStatus.OK;
            case REJECTED -> HttpStatus.BAD_REQUEST;
        };
        return ResponseEntity.status(status).body(OrderResponse.from(result));
    }

    @PostMapping("/emergency_stop")
    @Operation(summary = "Cancel all open orders and halt trading")
    public ResponseEntity<EmergencyStopResult> emergencyStop() {
        log.warn("Emergency stop requested over HTTP");
        return ResponseEntity.ok(riskOrchestrator.emergencyStop());
    }

    @PostMapping("/register_decision")
    @Operation(summary = "Forward an agent decision to telemetry")
    public ResponseEntity<StatusResponse> registerDecision(@Valid @RequestBody RegisterDecisionRequest request) {
        Map<String, Object> event = new LinkedHashMap<>();
        event.put("bot_id", request.getBotId());
        event.put("symbol", request.getSymbol());
        event.put("decision", request.getDecision());
        event.put("context", request.getContext());
        event.put("confidence", request.getConfidence());
        event.put("reasoning", request.getReasoning());
        event.put("timestamp", clock.instant().toString());
        eventSink.publishDecision(event);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(StatusResponse.of("accepted"));
    }

    @GetMapping("/portfolio")
    @Operation(summary = "Current portfolio snapshot")
    public ResponseEntity<PortfolioResponse> portfolio() {
        return ResponseEntity.ok(PortfolioResponse.from(portfolioStateStore.current()));
    }
}

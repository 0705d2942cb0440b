package com.riskgate.backend.service;

import com.riskgate.backend.config.ExchangeProperties;
import com.riskgate.backend.config.RiskProperties;
import com.riskgate.backend.config.SafeguardProperties;
import com.riskgate.backend.exception.ExchangeApiException;
import com.riskgate.backend.exception.ServiceDegradedException;
import com.riskgate.backend.model.CancelResult;
import com.riskgate.backend.model.EmergencyStopResult;
import com.riskgate.backend.model.ExchangeOrder;
import com.riskgate.backend.model.GuardrailCode;
import com.riskgate.backend.model.OrderAck;
import com.riskgate.backend.model.OrderIntent;
import com.riskgate.backend.model.OrderSubmissionResult;
import com.riskgate.backend.model.OrderType;
import com.riskgate.backend.model.PortfolioSnapshot;
import com.riskgate.backend.model.RiskCheckResult;
import com.riskgate.backend.model.TradingPermission;
import com.riskgate.backend.service.exchange.ExchangeGateway;
import com.riskgate.backend.service.risk.AgentAllocationPolicy;
import com.riskgate.backend.service.risk.Guardrail;
import com.riskgate.backend.service.risk.GuardrailContext;
import com.riskgate.backend.service.risk.RiskEngine;
import com.riskgate.backend.service.risk.RiskGuard;
import com.riskgate.backend.service.risk.SafeguardManager;
import com.riskgate.backend.service.telemetry.EventSink;
import com.riskgate.backend.util.RiskMath;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Single choke point between agents and the exchange. Every order passes the
 * safeguards, the risk engine, the portfolio guardrails and loss sizing, in that
 * order, and is forwarded at most once per idempotency window.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RiskOrchestrator {

    private final PortfolioStateStore portfolioStateStore;
    private final RiskEngine riskEngine;
    private final List<Guardrail> guardrails;
    private final RiskGuard riskGuard;
    private final SafeguardManager safeguardManager;
    private final AgentAllocationPolicy allocationPolicy;
    private final IdempotencyService idempotencyService;
    private final ExchangeGateway exchangeGateway;
    private final EventSink eventSink;
    private final MetricsService metricsService;
    private final RiskProperties riskProperties;
    private final ExchangeProperties exchangeProperties;
    @Qualifier("cancelExecutor")
    private final Executor cancelExecutor;
    private final Clock clock;

    public OrderSubmissionResult submitOrder(String botId, OrderIntent intent) {
        TradingPermission permission = safeguardManager.canTrade();
        if (!permission.allowed()) {
            if (permission.code() == GuardrailCode.SERVICE_DEGRADED) {
                throw new ServiceDegradedException(SafeguardProperties.ORDERS, permission.reason());
            }
            return reject(botId, intent, null, permission.code(), permission.reason());
        }

        PortfolioSnapshot snapshot = portfolioStateStore.current();

        String idempotencyKey = botId + ":" + intent.symbol();
        String orderId = idempotencyKey + ":" + clock.millis();
        Optional<String> holder = idempotencyService.reserve(idempotencyKey, orderId);
        if (holder.isPresent()) {
            metricsService.recordDuplicate();
            log.info("Duplicate order {} suppressed, pending as {}", orderId, holder.get());
            return OrderSubmissionResult.duplicate(holder.get());
        }

        Optional<Instant> slot = safeguardManager.tryAcquireOrderSlot();
        if (slot.isEmpty()) {
            idempotencyService.release(idempotencyKey, orderId);
            return reject(botId, intent, orderId, GuardrailCode.RATE_LIMITED, "Order rate limit exceeded");
        }

        Evaluation evaluation;
        try {
            evaluation = evaluate(botId, intent, snapshot);
        } catch (RuntimeException e) {
            safeguardManager.releaseOrderSlot(slot.get());
            idempotencyService.release(idempotencyKey, orderId);
            log.error("Risk evaluation failed for {}", orderId, e);
            return reject(botId, intent, orderId, GuardrailCode.EVALUATION_ERROR, "Risk evaluation failed: " + e.getMessage());
        }
        if (evaluation.rejection() != null) {
            safeguardManager.releaseOrderSlot(slot.get());
            idempotencyService.release(idempotencyKey, orderId);
            return reject(botId, intent, orderId, evaluation.rejection(), evaluation.reason());
        }

        RiskCheckResult approved = evaluation.result().withOrderId(orderId);
        ExchangeOrder order = evaluation.order().toBuilder().clientOrderId(orderId).build();
        OrderAck ack;
        try {
            ack = exchangeGateway.placeOrder(order);
            safeguardManager.recordSuccess(SafeguardProperties.ORDERS);
        } catch (ExchangeApiException e) {
            safeguardManager.recordFailure(SafeguardProperties.ORDERS);
            safeguardManager.releaseOrderSlot(slot.get());
            idempotencyService.release(idempotencyKey, orderId);
            metricsService.recordExchangeError();
            log.error("Exchange rejected order {}: {}", orderId, e.getMessage());
            throw e;
        }
        metricsService.recordSubmitted();
        eventSink.publishDecision(decisionEvent(botId, intent, order, ack));
        log.info("Order {} submitted: {} {} notional={} leverage={}x maxLoss={}", orderId, order.side(), order.symbol(),
                RiskMath.round(order.notional(), 2), order.leverage(), RiskMath.round(approved.maxLossUsd(), 2));
        return OrderSubmissionResult.submitted(orderId, approved);
    }

    /**
     * Cancels open orders for every tracked symbol in parallel and halts trading. Runs to
     * completion: individual cancel failures or timeouts are reported, never thrown.
     */
    public EmergencyStopResult emergencyStop() {
        safeguardManager.activateKillSwitch("Emergency stop requested");
        Set<String> symbols = new LinkedHashSet<>(exchangeProperties.getSymbols());
        if (portfolioStateStore.isReady()) {
            symbols.addAll(portfolioStateStore.get().positions().keySet());
        }
        long timeoutMs = exchangeProperties.getCancelTimeout().toMillis();
        List<CompletableFuture<CancelResult>> futures = new ArrayList<>();
        for (String symbol : symbols) {
            futures.add(CompletableFuture
                    .supplyAsync(() -> {
                        exchangeGateway.cancelAllOrders(symbol);
                        return CancelResult.ok(symbol);
                    }, cancelExecutor)
                    .orTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                    .exceptionally(error -> {
                        Throwable cause = error instanceof CompletionException && error.getCause() != null
                                ? error.getCause() : error;
                        String message = cause instanceof TimeoutException
                                ? "timed out after " + timeoutMs + "ms"
                                : cause.getMessage();
                        log.error("Emergency cancel failed for {}: {}", symbol, message);
                        return CancelResult.failed(symbol, message);
                    }));
        }
        List<CancelResult> results = futures.stream().map(CompletableFuture::join).toList();

        Map<String, Object> reasoning = new LinkedHashMap<>();
        reasoning.put("bot_id", "orchestrator");
        reasoning.put("strategy", "risk");
        reasoning.put("message", "kill_switch");
        reasoning.put("symbols", List.copyOf(symbols));
        reasoning.put("failed", results.stream().filter(result -> !result.success()).map(CancelResult::symbol).toList());
        reasoning.put("timestamp", clock.instant().toString());
        eventSink.publishReasoning(reasoning);

        EmergencyStopResult result = new EmergencyStopResult("halted", results);
        log.error("🛑 Emergency stop complete: {} symbols, {} failed cancels", results.size(), result.failedCount());
        return result;
    }

    private Evaluation evaluate(String botId, OrderIntent intent, PortfolioSnapshot snapshot) {
        double allocation = allocationPolicy.allocationFor(botId, snapshot.balance());
        RiskCheckResult engineResult = riskEngine.evaluate(snapshot, intent, allocation);
        if (!engineResult.approved()) {
            return Evaluation.rejected(GuardrailCode.RISK_CHECK_FAILED, engineResult.reason());
        }
        double notional = engineResult.adjustedSize();

        GuardrailContext context = new GuardrailContext(snapshot, intent, notional);
        for (Guardrail guardrail : guardrails) {
            Optional<String> violation = guardrail.check(context);
            if (violation.isPresent()) {
                return Evaluation.rejected(guardrail.code(), violation.get());
            }
        }

        Double stopPct = intent.stopLossPct();
        double stopLossPct = stopPct != null ? stopPct : riskProperties.getGuard().getDefaultStopLossPct();
        RiskCheckResult sized = riskGuard.checkTrade(snapshot.balance(), notional, intent.effectiveLeverage(),
                stopLossPct, intent.symbol(), metadataDouble(intent, "atr_pct"));
        if (!sized.approved()) {
            GuardrailCode code = riskGuard.isTradingHalted() ? GuardrailCode.TRADING_HALTED : GuardrailCode.POSITION_SIZING;
            return Evaluation.rejected(code, sized.reason());
        }

        Double price = intent.referencePrice();
        if (price == null) {
            price = snapshot.markPrice(intent.symbol()).orElse(null);
        }
        double quantity;
        if (intent.quantity() != null && intent.quantity() > 0) {
            quantity = intent.quantity() * (sized.adjustedSize() / notional);
        } else if (price != null) {
            quantity = sized.adjustedSize() / price;
        } else {
            return Evaluation.rejected(GuardrailCode.UNSIZEABLE_ORDER, "quantity or price required to size order");
        }

        ExchangeOrder order = ExchangeOrder.builder()
                .symbol(intent.symbol())
                .side(intent.side())
                .type(intent.orderType())
                .quantity(RiskMath.round(quantity, 6))
                .price(intent.orderType() == OrderType.LIMIT ? price : null)
                .stopLossPrice(intent.stopLoss())
                .takeProfitPrice(intent.takeProfit())
                .notional(sized.adjustedSize())
                .leverage(sized.adjustedLeverage())
                .metadata(intent.clientMetadata())
                .build();
        return Evaluation.approved(sized, order);
    }

    private OrderSubmissionResult reject(String botId, OrderIntent intent, String orderId, GuardrailCode code, String reason) {
        metricsService.recordReject(code.code());
        log.warn("Order rejected bot={} symbol={} code={} reason={}", botId, intent.symbol(), code.code(), reason);
        return OrderSubmissionResult.rejected(orderId, code, reason);
    }

    private Map<String, Object> decisionEvent(String botId, OrderIntent intent, ExchangeOrder order, OrderAck ack) {
        Map<String, Object> event = new LinkedHashMap<>();
        event.put("bot_id", botId);
        event.put("order_id", order.clientOrderId());
        event.put("exchange_order_id", ack != null ? ack.exchangeOrderId() : null);
        event.put("symbol", order.symbol());
        event.put("side", order.side());
        event.put("notional", RiskMath.round(order.notional(), 2));
        event.put("requested_notional", intent.notional());
        event.put("leverage", order.leverage());
        event.put("metadata", intent.clientMetadata());
        event.put("timestamp", clock.instant().toString());
        return event;
    }

    private Double metadataDouble(OrderIntent intent, String key) {
        Object value = intent.clientMetadata().get(key);
        return value instanceof Number number ? number.doubleValue() : null;
    }

    private record Evaluation(RiskCheckResult result, ExchangeOrder order, GuardrailCode rejection, String reason) {

        static Evaluation approved(RiskCheckResult result, ExchangeOrder order) {
            return new Evaluation(result, order, null, null);
        }

        static Evaluation rejected(GuardrailCode code, String reason) {
            return new Evaluation(null, null, code, reason);
        }
    }
}

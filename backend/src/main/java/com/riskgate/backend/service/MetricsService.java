package com.riskgate.backend.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicReference;

@Service
@RequiredArgsConstructor
public class MetricsService {

    private final MeterRegistry meterRegistry;

    private final AtomicReference<Double> maxDrawdown = new AtomicReference<>(0.0);
    private final AtomicReference<Double> dailyLoss = new AtomicReference<>(0.0);

    private Counter ordersSubmittedCounter;
    private Counter ordersDuplicateCounter;
    private Counter exchangeErrorsCounter;
    private Counter killSwitchCounter;
    private Counter telemetryDroppedCounter;
    private Counter telemetryFailedCounter;

    @PostConstruct
    void init() {
        ordersSubmittedCounter = Counter.builder("orders_submitted_total").register(meterRegistry);
        ordersDuplicateCounter = Counter.builder("orders_duplicate_total").register(meterRegistry);
        exchangeErrorsCounter = Counter.builder("exchange_errors_total").register(meterRegistry);
        killSwitchCounter = Counter.builder("kill_switch_activations_total").register(meterRegistry);
        telemetryDroppedCounter = Counter.builder("telemetry_dropped_total").register(meterRegistry);
        telemetryFailedCounter = Counter.builder("telemetry_failed_total").register(meterRegistry);
        Gauge.builder("portfolio_max_drawdown", maxDrawdown, value -> value.get()).register(meterRegistry);
        Gauge.builder("portfolio_daily_loss", dailyLoss, value -> value.get()).register(meterRegistry);
    }

    public void recordSubmitted() {
        increment(ordersSubmittedCounter);
    }

    public void recordDuplicate() {
        increment(ordersDuplicateCounter);
    }

    public void recordReject(String code) {
        Counter.builder("orders_rejected_total")
                .tag("code", code == null ? "unknown" : code)
                .register(meterRegistry)
                .increment();
    }

    public void recordExchangeError() {
        increment(exchangeErrorsCounter);
    }

    public void recordKillSwitch() {
        increment(killSwitchCounter);
    }

    public void recordTelemetryDropped() {
        increment(telemetryDroppedCounter);
    }

    public void recordTelemetryFailed() {
        increment(telemetryFailedCounter);
    }

    public void recordConsensus(boolean approved, boolean timedOut) {
        Counter.builder("consensus_resolved_total")
                .tag("outcome", approved ? "approved" : "rejected")
                .tag("timed_out", Boolean.toString(timedOut))
                .register(meterRegistry)
                .increment();
    }

    public void updateHeat(double drawdown, double loss) {
        maxDrawdown.set(drawdown);
        dailyLoss.set(loss);
    }

    private void increment(Counter counter) {
        if (counter != null) {
            counter.increment();
        }
    }
}

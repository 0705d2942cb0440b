package com.riskgate.backend.service;

import com.riskgate.backend.config.PortfolioProperties;
import com.riskgate.backend.config.SafeguardProperties;
import com.riskgate.backend.event.PortfolioRefreshedEvent;
import com.riskgate.backend.exception.PortfolioNotReadyException;
import com.riskgate.backend.exception.ServiceDegradedException;
import com.riskgate.backend.model.AccountBalance;
import com.riskgate.backend.model.PortfolioSnapshot;
import com.riskgate.backend.model.PositionRisk;
import com.riskgate.backend.service.exchange.ExchangeGateway;
import com.riskgate.backend.service.risk.SafeguardManager;
import com.riskgate.backend.service.telemetry.EventSink;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the latest published {@link PortfolioSnapshot}. Publication is a single
 * reference swap; a failed refresh leaves the previous snapshot in place.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PortfolioStateStore {

    private final ExchangeGateway exchangeGateway;
    private final SafeguardManager safeguardManager;
    private final EventSink eventSink;
    private final ApplicationEventPublisher eventPublisher;
    private final PortfolioProperties portfolioProperties;
    private final Clock clock;

    private final AtomicReference<PortfolioSnapshot> latest = new AtomicReference<>();

    public PortfolioSnapshot refresh() {
        if (!safeguardManager.checkCircuitBreaker(SafeguardProperties.API)) {
            throw new ServiceDegradedException(SafeguardProperties.API, "Exchange API circuit breaker is open");
        }
        List<AccountBalance> balances;
        List<PositionRisk> positionRisk;
        try {
            balances = exchangeGateway.accountBalance();
            positionRisk = exchangeGateway.positionRisk();
            safeguardManager.recordSuccess(SafeguardProperties.API);
        } catch (RuntimeException e) {
            safeguardManager.recordFailure(SafeguardProperties.API);
            throw e;
        }

        double balance = balances.stream().mapToDouble(AccountBalance::walletBalance).sum();
        Map<String, Double> positions = new LinkedHashMap<>();
        Map<String, Double> markPrices = new LinkedHashMap<>();
        double unrealized = 0.0;
        for (PositionRisk position : positionRisk) {
            if (position.markPrice() > 0) {
                markPrices.put(position.symbol(), position.markPrice());
            }
            if (position.positionAmt() == 0) {
                continue;
            }
            positions.merge(position.symbol(), Math.abs(position.notional()), Double::sum);
            unrealized += position.unrealizedProfit();
        }

        PortfolioSnapshot previous = latest.get();
        double peak = Math.max(balance, previous != null ? previous.peakBalance() : 0.0);
        PortfolioSnapshot snapshot = PortfolioSnapshot.of(balance, positions, markPrices, unrealized, peak, clock.instant());
        latest.set(snapshot);

        safeguardManager.updateHeatMetrics(snapshot);
        eventSink.publishPosition(positionEvent(snapshot));
        eventPublisher.publishEvent(new PortfolioRefreshedEvent(snapshot));
        log.debug("Portfolio refreshed: balance={} exposure={} positions={}",
                snapshot.balance(), snapshot.totalExposure(), snapshot.positionCount());
        return snapshot;
    }

    /**
     * Latest published snapshot regardless of age.
     */
    public PortfolioSnapshot get() {
        PortfolioSnapshot snapshot = latest.get();
        if (snapshot == null) {
            throw new PortfolioNotReadyException("Portfolio snapshot not yet available");
        }
        return snapshot;
    }

    /**
     * Snapshot no older than the cache TTL when a refresh succeeds, else the stale one.
     */
    public PortfolioSnapshot current() {
        PortfolioSnapshot cached = latest.get();
        if (cached != null && !isExpired(cached)) {
            return cached;
        }
        try {
            return refresh();
        } catch (RuntimeException e) {
            if (cached == null) {
                throw new PortfolioNotReadyException("Portfolio snapshot not yet available: " + e.getMessage(), e);
            }
            log.warn("Portfolio refresh failed, serving snapshot from {}: {}", cached.timestamp(), e.getMessage());
            return cached;
        }
    }

    public boolean isReady() {
        return latest.get() != null;
    }

    private boolean isExpired(PortfolioSnapshot snapshot) {
        Duration age = Duration.between(snapshot.timestamp(), clock.instant());
        return age.compareTo(portfolioProperties.getCacheTtl()) >= 0;
    }

    private Map<String, Object> positionEvent(PortfolioSnapshot snapshot) {
        Map<String, Object> event = new LinkedHashMap<>();
        event.put("bot_id", "orchestrator");
        event.put("balance", String.format(Locale.ROOT, "%.2f", snapshot.balance()));
        event.put("total_exposure", String.format(Locale.ROOT, "%.2f", snapshot.totalExposure()));
        event.put("positions", snapshot.positions());
        event.put("unrealized_pnl", String.format(Locale.ROOT, "%.2f", snapshot.unrealizedPnl()));
        event.put("timestamp", snapshot.timestamp().toString());
        return event;
    }
}

package com.riskgate.backend.service.risk;

import com.riskgate.backend.config.SafeguardProperties;
import com.riskgate.backend.model.BreakerSnapshot;
import com.riskgate.backend.model.GuardrailCode;
import com.riskgate.backend.model.HeatMetrics;
import com.riskgate.backend.model.PortfolioSnapshot;
import com.riskgate.backend.model.TradingPermission;
import com.riskgate.backend.service.MetricsService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Process-wide trading safeguards: dependency circuit breakers, portfolio heat,
 * drawdown and daily-loss kill switch, and the order rate window.
 * <p>
 * Breakers guard themselves; everything else here sits behind this manager's monitor.
 * No breaker call is made while holding it.
 */
@Service
@Slf4j
public class SafeguardManager {

    private static final Duration RATE_WINDOW = Duration.ofSeconds(60);

    private final SafeguardProperties properties;
    private final MetricsService metricsService;
    private final Clock clock;
    private final Map<String, DependencyCircuitBreaker> breakers;

    private final Object monitor = new Object();
    private final Deque<Instant> orderTimestamps = new ArrayDeque<>();
    private HeatMetrics heat;
    private double balance;
    private double portfolioPeak;
    private double dailyStartEquity;
    private double lastEquity;
    private boolean rearmed;
    private boolean killSwitchActive;
    private String killSwitchReason = "";

    public SafeguardManager(SafeguardProperties properties, MetricsService metricsService, Clock clock) {
        this.properties = properties;
        this.metricsService = metricsService;
        this.clock = clock;
        Map<String, DependencyCircuitBreaker> configured = new LinkedHashMap<>();
        properties.getBreakers().forEach((name, config) ->
                configured.put(name, new DependencyCircuitBreaker(name, config, clock)));
        this.breakers = Collections.unmodifiableMap(configured);
        this.heat = HeatMetrics.empty(clock.instant());
    }

    public boolean checkCircuitBreaker(String name) {
        DependencyCircuitBreaker breaker = breakers.get(name);
        return breaker == null || breaker.canProceed();
    }

    public void recordSuccess(String name) {
        DependencyCircuitBreaker breaker = breakers.get(name);
        if (breaker != null) {
            breaker.recordSuccess();
        }
    }

    public void recordFailure(String name) {
        DependencyCircuitBreaker breaker = breakers.get(name);
        if (breaker != null) {
            breaker.recordFailure();
        }
    }

    /**
     * Recomputes heat from a fresh snapshot. The drawdown figure only ever ratchets up
     * until an operator re-arms trading.
     */
    public void updateHeatMetrics(PortfolioSnapshot portfolio) {
        HeatMetrics updated;
        synchronized (monitor) {
            double equity = portfolio.equity();
            lastEquity = equity;
            // Once re-armed, the peak only rises on equity seen after the re-arm
            double snapshotPeak = rearmed ? 0.0 : portfolio.peakBalance();
            portfolioPeak = Math.max(portfolioPeak, Math.max(equity, snapshotPeak));
            double drawdown = portfolioPeak > 0 ? Math.max(0.0, (portfolioPeak - equity) / portfolioPeak) : 0.0;
            if (dailyStartEquity <= 0) {
                dailyStartEquity = equity;
            }
            double dailyLoss = dailyStartEquity > 0 ? (equity - dailyStartEquity) / dailyStartEquity : 0.0;
            balance = portfolio.balance();
            heat = new HeatMetrics(portfolio.totalExposure(), portfolio.positionCount(), dailyLoss,
                    Math.max(heat.maxDrawdown(), drawdown), clock.instant());
            updated = heat;
        }
        metricsService.updateHeat(updated.maxDrawdown(), updated.dailyLoss());
    }

    public boolean checkPortfolioHeat() {
        synchronized (monitor) {
            if (killSwitchActive) {
                return false;
            }
            double maxExposure = Math.max(balance, 0.0) * properties.getMaxPortfolioLeverage();
            if (balance > 0 && heat.totalExposure() > maxExposure) {
                log.error("Portfolio heat too high: exposure {} > {}", heat.totalExposure(), maxExposure);
                return false;
            }
            if (heat.positionCount() > properties.getMaxConcurrentPositions()) {
                log.warn("Too many positions: {} > {}", heat.positionCount(), properties.getMaxConcurrentPositions());
                return false;
            }
            return true;
        }
    }

    /**
     * Trips the kill switch when the drawdown high-water mark or the day's loss passes
     * its threshold.
     */
    public boolean checkDrawdownLimits() {
        synchronized (monitor) {
            if (heat.maxDrawdown() > properties.getMaxDrawdown()) {
                activateLocked(String.format(Locale.ROOT, "Drawdown limit exceeded: %.2f%%", heat.maxDrawdown() * 100));
                return false;
            }
            if (heat.dailyLoss() < -properties.getDailyLoss()) {
                activateLocked(String.format(Locale.ROOT, "Daily loss limit exceeded: %.2f%%", heat.dailyLoss() * 100));
                return false;
            }
            return true;
        }
    }

    public boolean checkRateLimits() {
        synchronized (monitor) {
            pruneOrderWindow(clock.instant());
            if (orderTimestamps.size() >= properties.getMaxOrdersPerMinute()) {
                log.warn("Order rate limit reached: {}/min", orderTimestamps.size());
                return false;
            }
            return true;
        }
    }

    /**
     * Claims a slot in the order rate window. Pruning, the limit check and the claim
     * happen in one step so concurrent submissions cannot overshoot the limit.
     *
     * @return the claimed slot, to be handed back via {@link #releaseOrderSlot} when
     * the order never reaches the exchange
     */
    public Optional<Instant> tryAcquireOrderSlot() {
        synchronized (monitor) {
            Instant now = clock.instant();
            pruneOrderWindow(now);
            if (orderTimestamps.size() >= properties.getMaxOrdersPerMinute()) {
                log.warn("Order rate limit reached: {}/min", orderTimestamps.size());
                return Optional.empty();
            }
            orderTimestamps.addLast(now);
            return Optional.of(now);
        }
    }

    public void releaseOrderSlot(Instant slot) {
        synchronized (monitor) {
            orderTimestamps.removeLastOccurrence(slot);
        }
    }

    public TradingPermission canTrade() {
        synchronized (monitor) {
            if (killSwitchActive) {
                return TradingPermission.deny(GuardrailCode.TRADING_HALTED, "Kill switch active: " + killSwitchReason);
            }
        }
        if (!checkCircuitBreaker(SafeguardProperties.ORDERS)) {
            return TradingPermission.deny(GuardrailCode.SERVICE_DEGRADED, "Orders circuit breaker is open");
        }
        if (!checkPortfolioHeat()) {
            return TradingPermission.deny(GuardrailCode.PORTFOLIO_HEAT, "Portfolio heat limits exceeded");
        }
        if (!checkDrawdownLimits()) {
            return TradingPermission.deny(GuardrailCode.TRADING_HALTED, "Drawdown limits exceeded");
        }
        if (!checkRateLimits()) {
            return TradingPermission.deny(GuardrailCode.RATE_LIMITED, "Order rate limit exceeded");
        }
        return TradingPermission.allow();
    }

    public void activateKillSwitch(String reason) {
        synchronized (monitor) {
            activateLocked(reason == null || reason.isBlank() ? "Manual activation" : reason);
        }
    }

    /**
     * Manual re-arm. Drawdown and the day's loss are measured again from the last known
     * equity, so the loss that was just acknowledged does not trip the switch on the
     * next refresh.
     */
    public void deactivateKillSwitch() {
        synchronized (monitor) {
            killSwitchActive = false;
            killSwitchReason = "";
            rearmed = true;
            portfolioPeak = lastEquity;
            dailyStartEquity = lastEquity;
            heat = new HeatMetrics(heat.totalExposure(), heat.positionCount(), 0.0, 0.0, clock.instant());
        }
        log.warn("Kill switch deactivated");
    }

    public boolean isKillSwitchActive() {
        synchronized (monitor) {
            return killSwitchActive;
        }
    }

    public String getKillSwitchReason() {
        synchronized (monitor) {
            return killSwitchReason;
        }
    }

    public HeatMetrics getHeatMetrics() {
        synchronized (monitor) {
            return heat;
        }
    }

    public int currentOrderRate() {
        synchronized (monitor) {
            pruneOrderWindow(clock.instant());
            return orderTimestamps.size();
        }
    }

    public List<BreakerSnapshot> breakerSnapshots() {
        return breakers.values().stream().map(DependencyCircuitBreaker::snapshot).collect(Collectors.toList());
    }

    @Scheduled(cron = "${safeguards.daily-reset-cron:0 0 0 * * *}", zone = "UTC")
    public void resetDailyMetrics() {
        synchronized (monitor) {
            dailyStartEquity = 0.0;
            heat = new HeatMetrics(heat.totalExposure(), heat.positionCount(), 0.0, heat.maxDrawdown(), clock.instant());
        }
        log.info("Daily safeguard metrics reset");
    }

    private void activateLocked(String reason) {
        if (killSwitchActive) {
            return;
        }
        killSwitchActive = true;
        killSwitchReason = reason;
        metricsService.recordKillSwitch();
        log.error("🚨 KILL SWITCH ACTIVATED: {}", reason);
    }

    private void pruneOrderWindow(Instant now) {
        Instant cutoff = now.minus(RATE_WINDOW);
        while (!orderTimestamps.isEmpty() && orderTimestamps.peekFirst().isBefore(cutoff)) {
            orderTimestamps.pollFirst();
        }
    }
}

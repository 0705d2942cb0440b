package com.riskgate.backend.service.risk;

import com.riskgate.backend.config.SafeguardProperties;
import com.riskgate.backend.model.GuardrailCode;
import com.riskgate.backend.model.PortfolioSnapshot;
import com.riskgate.backend.model.TradingPermission;
import com.riskgate.backend.service.MetricsService;
import com.riskgate.backend.util.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class SafeguardManagerTest {

    private final MutableClock clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
    private final MetricsService metricsService = mock(MetricsService.class);
    private SafeguardProperties properties;
    private SafeguardManager manager;

    @BeforeEach
    void setUp() {
        properties = new SafeguardProperties();
        properties.setMaxOrdersPerMinute(3);
        manager = new SafeguardManager(properties, metricsService, clock);
    }

    @Test
    void killSwitchBlocksUntilManuallyCleared() {
        manager.activateKillSwitch("operator drill");

        TradingPermission permission = manager.canTrade();
        assertThat(permission.allowed()).isFalse();
        assertThat(permission.code()).isEqualTo(GuardrailCode.TRADING_HALTED);
        assertThat(permission.reason()).contains("operator drill");

        clock.advance(Duration.ofDays(2));
        assertThat(manager.canTrade().allowed()).isFalse();

        manager.deactivateKillSwitch();
        assertThat(manager.canTrade().allowed()).isTrue();
        verify(metricsService, times(1)).recordKillSwitch();
    }

    @Test
    void openOrdersBreakerReportsServiceDegraded() {
        for (int i = 0; i < 5; i++) {
            manager.recordFailure(SafeguardProperties.ORDERS);
        }

        TradingPermission permission = manager.canTrade();

        assertThat(permission.allowed()).isFalse();
        assertThat(permission.code()).isEqualTo(GuardrailCode.SERVICE_DEGRADED);
    }

    @Test
    void drawdownHighWaterMarkTripsKillSwitch() {
        manager.updateHeatMetrics(snapshot(10_000, 0, 10_000));
        manager.updateHeatMetrics(snapshot(9_400, 0, 10_000));
        // recovery does not lower the recorded drawdown
        manager.updateHeatMetrics(snapshot(9_900, 0, 10_000));

        assertThat(manager.getHeatMetrics().maxDrawdown()).isCloseTo(0.06, within(1e-9));
        assertThat(manager.canTrade().allowed()).isFalse();
        assertThat(manager.isKillSwitchActive()).isTrue();
        assertThat(manager.getKillSwitchReason()).startsWith("Drawdown limit exceeded");
    }

    @Test
    void dailyLossTripsKillSwitch() {
        manager.updateHeatMetrics(snapshot(10_000, 0, 10_000));
        manager.updateHeatMetrics(snapshot(10_000, -350, 10_000));

        assertThat(manager.checkDrawdownLimits()).isFalse();
        assertThat(manager.isKillSwitchActive()).isTrue();
        assertThat(manager.getKillSwitchReason()).startsWith("Daily loss limit exceeded");
    }

    @Test
    void dailyResetStartsLossFromNextSnapshot() {
        manager.updateHeatMetrics(snapshot(10_000, 0, 10_000));
        manager.updateHeatMetrics(snapshot(10_000, -200, 10_000));
        manager.resetDailyMetrics();
        manager.updateHeatMetrics(snapshot(10_000, -200, 10_000));

        assertThat(manager.getHeatMetrics().dailyLoss()).isZero();
        assertThat(manager.checkDrawdownLimits()).isTrue();
    }

    @Test
    void heatRejectsExcessiveExposure() {
        manager.updateHeatMetrics(snapshot(1_000, 0, 1_000, Map.of("BTCUSDT", 3_500.0)));

        TradingPermission permission = manager.canTrade();

        assertThat(permission.allowed()).isFalse();
        assertThat(permission.code()).isEqualTo(GuardrailCode.PORTFOLIO_HEAT);
    }

    @Test
    void slidingWindowLimitsOrderRate() {
        assertThat(manager.tryAcquireOrderSlot()).isPresent();
        clock.advance(Duration.ofSeconds(20));
        assertThat(manager.tryAcquireOrderSlot()).isPresent();
        assertThat(manager.tryAcquireOrderSlot()).isPresent();

        assertThat(manager.tryAcquireOrderSlot()).isEmpty();
        assertThat(manager.canTrade().code()).isEqualTo(GuardrailCode.RATE_LIMITED);
        assertThat(manager.currentOrderRate()).isEqualTo(3);

        clock.advance(Duration.ofSeconds(41));
        assertThat(manager.currentOrderRate()).isEqualTo(2);
        assertThat(manager.canTrade().allowed()).isTrue();
    }

    @Test
    void releasedSlotCanBeClaimedAgain() {
        manager.tryAcquireOrderSlot();
        manager.tryAcquireOrderSlot();
        Instant last = manager.tryAcquireOrderSlot().orElseThrow();

        manager.releaseOrderSlot(last);

        assertThat(manager.currentOrderRate()).isEqualTo(2);
        assertThat(manager.tryAcquireOrderSlot()).isPresent();
    }

    @Test
    void concurrentClaimsNeverExceedTheLimit() throws Exception {
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(10);
        try {
            List<Future<Optional<Instant>>> claims = new ArrayList<>();
            for (int i = 0; i < 10; i++) {
                claims.add(pool.submit(() -> {
                    start.await();
                    return manager.tryAcquireOrderSlot();
                }));
            }
            start.countDown();

            int granted = 0;
            for (Future<Optional<Instant>> claim : claims) {
                if (claim.get(5, TimeUnit.SECONDS).isPresent()) {
                    granted++;
                }
            }

            assertThat(granted).isEqualTo(3);
            assertThat(manager.currentOrderRate()).isEqualTo(3);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void rearmedDrawdownSurvivesNextRefresh() {
        manager.updateHeatMetrics(snapshot(10_000, 0, 10_000));
        manager.resetDailyMetrics();
        manager.updateHeatMetrics(snapshot(9_000, 0, 10_000));
        assertThat(manager.canTrade().allowed()).isFalse();
        assertThat(manager.getKillSwitchReason()).startsWith("Drawdown limit exceeded");

        manager.deactivateKillSwitch();
        // the store still reports the old wallet high-water mark
        manager.updateHeatMetrics(snapshot(9_000, 0, 10_000));

        assertThat(manager.getHeatMetrics().maxDrawdown()).isZero();
        assertThat(manager.canTrade().allowed()).isTrue();
        assertThat(manager.isKillSwitchActive()).isFalse();
    }

    @Test
    void rearmMeasuresFurtherDrawdownFromRearmEquity() {
        manager.updateHeatMetrics(snapshot(10_000, 0, 10_000));
        manager.resetDailyMetrics();
        manager.updateHeatMetrics(snapshot(9_000, 0, 10_000));
        manager.canTrade();
        manager.deactivateKillSwitch();
        manager.resetDailyMetrics();

        manager.updateHeatMetrics(snapshot(8_500, 0, 10_000));

        assertThat(manager.getHeatMetrics().maxDrawdown()).isCloseTo(500.0 / 9_000, within(1e-9));
        assertThat(manager.canTrade().allowed()).isFalse();
    }

    @Test
    void rearmClearsTheDaysLoss() {
        manager.updateHeatMetrics(snapshot(10_000, 0, 10_000));
        manager.updateHeatMetrics(snapshot(9_000, 0, 10_000));
        assertThat(manager.canTrade().allowed()).isFalse();

        manager.deactivateKillSwitch();

        assertThat(manager.getHeatMetrics().dailyLoss()).isZero();
        assertThat(manager.canTrade().allowed()).isTrue();

        manager.updateHeatMetrics(snapshot(9_000, 0, 10_000));
        assertThat(manager.getHeatMetrics().dailyLoss()).isZero();
        assertThat(manager.canTrade().allowed()).isTrue();
    }

    private PortfolioSnapshot snapshot(double balance, double unrealized, double peak) {
        return snapshot(balance, unrealized, peak, Map.of());
    }

    private PortfolioSnapshot snapshot(double balance, double unrealized, double peak, Map<String, Double> positions) {
        return PortfolioSnapshot.of(balance, positions, Map.of(), unrealized, peak, clock.instant());
    }
}

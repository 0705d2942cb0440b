package com.riskgate.backend.service.risk;

import com.riskgate.backend.config.RiskProperties;
import com.riskgate.backend.model.RiskCheckResult;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class RiskGuardTest {

    private final RiskProperties properties = new RiskProperties();
    private final RiskGuard guard = new RiskGuard(properties);

    @Test
    void capsLeverageAndShrinksToLossCap() {
        RiskCheckResult result = guard.checkTrade(10_000, 1000, 20, 0.02, "BTCUSDT", null);

        assertThat(result.approved()).isTrue();
        assertThat(result.adjustedLeverage()).isEqualTo(10.0);
        // 50 / (0.02 * 10)
        assertThat(result.adjustedSize()).isCloseTo(250.0, within(1e-9));
        assertThat(result.maxLossUsd()).isLessThanOrEqualTo(50.0);
        assertThat(result.reason()).contains("Leverage capped").contains("Size reduced");
    }

    @Test
    void approvedTradesNeverRiskMoreThanLossCap() {
        double[] notionals = {15, 99.99, 333.33, 1000, 1499.5, 7777};
        double[] leverages = {1, 2.5, 3, 7, 10, 25};
        double[] stops = {0.003, 0.01, 0.0175, 0.02, 0.033, 0.07};
        for (double notional : notionals) {
            for (double leverage : leverages) {
                for (double stop : stops) {
                    RiskCheckResult result = guard.checkTrade(10_000, notional, leverage, stop, "ETHUSDT", null);
                    if (result.approved()) {
                        assertThat(result.adjustedSize() * stop * result.adjustedLeverage())
                                .as("notional=%s leverage=%s stop=%s", notional, leverage, stop)
                                .isLessThanOrEqualTo(properties.getGuard().getMaxLossPerTradeUsd());
                    }
                }
            }
        }
    }

    @Test
    void capsPositionAtShareOfBalance() {
        RiskCheckResult result = guard.checkTrade(1000, 400, 1, 0.01, "BTCUSDT", null);

        assertThat(result.approved()).isTrue();
        assertThat(result.adjustedSize()).isCloseTo(150.0, within(1e-9));
    }

    @Test
    void halvesSizeInVeryHighVolatility() {
        RiskCheckResult calm = guard.checkTrade(10_000, 100, 1, 0.02, "BTCUSDT", 0.01);
        RiskCheckResult wild = guard.checkTrade(10_000, 100, 1, 0.02, "BTCUSDT", 0.05);

        assertThat(calm.adjustedSize()).isEqualTo(100.0);
        assertThat(wild.adjustedSize()).isEqualTo(50.0);
    }

    @Test
    void rejectsPositionsBelowMinimum() {
        RiskCheckResult result = guard.checkTrade(10_000, 5, 1, 0.02, "BTCUSDT", null);

        assertThat(result.approved()).isFalse();
        assertThat(result.reason()).startsWith("Position too small");
    }

    @Test
    void absoluteDailyLossHaltsUntilReset() {
        assertThat(guard.recordTradeResult(-100)).isTrue();
        assertThat(guard.recordTradeResult(-200)).isFalse();

        assertThat(guard.isTradingHalted()).isTrue();
        assertThat(guard.checkTrade(10_000, 100, 1, 0.02, "BTCUSDT", null).reason()).startsWith("Trading halted");

        guard.resetDaily();

        assertThat(guard.isTradingHalted()).isFalse();
        assertThat(guard.getDailyPnl()).isZero();
        assertThat(guard.checkTrade(10_000, 100, 1, 0.02, "BTCUSDT", null).approved()).isTrue();
    }

    @Test
    void balanceRelativeDailyLimitRejectsWithoutHalting() {
        guard.recordTradeResult(-60);

        RiskCheckResult result = guard.checkTrade(1000, 100, 1, 0.02, "BTCUSDT", null);

        assertThat(result.approved()).isFalse();
        assertThat(result.reason()).startsWith("Daily loss limit reached");
        assertThat(guard.isTradingHalted()).isFalse();
        assertThat(guard.checkDailyLimit(1000)).isFalse();
        assertThat(guard.checkDailyLimit(10_000)).isTrue();
    }
}

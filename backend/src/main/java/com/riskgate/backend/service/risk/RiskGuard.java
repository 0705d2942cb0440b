package com.riskgate.backend.service.risk;

import com.riskgate.backend.config.RiskProperties;
import com.riskgate.backend.model.RiskCheckResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Per-trade loss sizing. Caps leverage and position size, shrinks the notional until a
 * stop-out cannot lose more than the configured amount, and enforces the absolute and
 * balance-relative daily loss limits.
 */
@Service
@Slf4j
public class RiskGuard {

    private static final double VERY_HIGH_VOLATILITY = 0.04;
    private static final double HIGH_VOLATILITY = 0.025;

    private final RiskProperties riskProperties;

    private final Object lock = new Object();
    private double dailyPnl = 0.0;
    private boolean tradingHalted = false;
    private String haltReason;

    public RiskGuard(RiskProperties riskProperties) {
        this.riskProperties = riskProperties;
    }

    public RiskCheckResult checkTrade(double balance, double proposedNotional, double proposedLeverage,
                                      double stopLossPct, String symbol, Double atrPct) {
        RiskProperties.Guard limits = riskProperties.getGuard();
        double currentDailyPnl;
        synchronized (lock) {
            if (tradingHalted) {
                return RiskCheckResult.reject("Trading halted: " + haltReason);
            }
            currentDailyPnl = dailyPnl;
        }
        if (stopLossPct <= 0) {
            return RiskCheckResult.reject("Stop loss distance must be positive");
        }

        List<String> adjustments = new ArrayList<>();
        double leverage = Math.min(Math.max(proposedLeverage, 1.0), limits.getMaxLeverage());
        if (leverage < proposedLeverage) {
            adjustments.add(String.format(Locale.ROOT, "Leverage capped: %.1fx -> %.1fx", proposedLeverage, leverage));
        }

        double notional = Math.min(proposedNotional, balance * limits.getMaxPositionPct());
        if (notional < proposedNotional) {
            adjustments.add(String.format(Locale.ROOT, "Position capped: %.2f -> %.2f", proposedNotional, notional));
        }

        double potentialLoss = notional * stopLossPct * leverage;
        if (potentialLoss > limits.getMaxLossPerTradeUsd()) {
            notional = limits.getMaxLossPerTradeUsd() / (stopLossPct * leverage);
            while (notional * stopLossPct * leverage > limits.getMaxLossPerTradeUsd()) {
                notional = Math.nextDown(notional);
            }
            adjustments.add(String.format(Locale.ROOT, "Size reduced for %.2f loss cap: %.2f",
                    limits.getMaxLossPerTradeUsd(), notional));
        }

        if (atrPct != null) {
            if (atrPct > VERY_HIGH_VOLATILITY) {
                notional *= 0.5;
                adjustments.add(String.format(Locale.ROOT, "High volatility (%.1f%%): size halved", atrPct * 100));
            } else if (atrPct > HIGH_VOLATILITY) {
                notional *= 0.7;
                adjustments.add(String.format(Locale.ROOT, "Elevated volatility (%.1f%%): size reduced 30%%", atrPct * 100));
            }
        }

        double pctLimit = balance * limits.getDailyLossLimitPct();
        if (currentDailyPnl < -pctLimit) {
            return RiskCheckResult.reject(String.format(Locale.ROOT, "Daily loss limit reached: %.2f > %.2f",
                    Math.abs(currentDailyPnl), pctLimit));
        }

        if (notional < limits.getMinPositionUsd()) {
            return RiskCheckResult.reject(String.format(Locale.ROOT, "Position too small: %.2f < %.2f",
                    notional, limits.getMinPositionUsd()));
        }

        double maxLoss = notional * stopLossPct * leverage;
        String reason = adjustments.isEmpty()
                ? "Approved: all risk checks passed"
                : "Approved with adjustments: " + String.join(" | ", adjustments);
        log.info("RiskGuard {}: notional={} leverage={}x maxLoss={}", symbol,
                String.format(Locale.ROOT, "%.2f", notional), leverage, String.format(Locale.ROOT, "%.2f", maxLoss));
        return RiskCheckResult.approve(null, notional, leverage, maxLoss, reason);
    }

    /**
     * Adds a realized trade result to the day's P&L.
     *
     * @return false once the absolute daily loss limit has halted trading
     */
    public boolean recordTradeResult(double pnl) {
        synchronized (lock) {
            dailyPnl += pnl;
            if (pnl < 0) {
                log.warn("Trade loss {} | daily P&L {}", pnl, dailyPnl);
            }
            if (tradingHalted) {
                return false;
            }
            if (dailyPnl < -riskProperties.getGuard().getDailyLossLimitUsd()) {
                tradingHalted = true;
                haltReason = String.format(Locale.ROOT, "Daily loss limit reached: %.2f", Math.abs(dailyPnl));
                log.error("🛑 TRADING HALTED: {}", haltReason);
                return false;
            }
            return true;
        }
    }

    public boolean checkDailyLimit(double balance) {
        synchronized (lock) {
            if (tradingHalted) {
                return false;
            }
            return dailyPnl >= -(balance * riskProperties.getGuard().getDailyLossLimitPct());
        }
    }

    public double getDailyPnl() {
        synchronized (lock) {
            return dailyPnl;
        }
    }

    public boolean isTradingHalted() {
        synchronized (lock) {
            return tradingHalted;
        }
    }

    public String getHaltReason() {
        synchronized (lock) {
            return haltReason;
        }
    }

    @Scheduled(cron = "${safeguards.daily-reset-cron:0 0 0 * * *}", zone = "UTC")
    public void resetDaily() {
        synchronized (lock) {
            dailyPnl = 0.0;
            tradingHalted = false;
            haltReason = null;
        }
        log.info("RiskGuard daily P&L reset");
    }
}

package com.riskgate.backend.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

public final class RiskMath {

    private RiskMath() {
    }

    /**
     * Kelly fraction {@code p - (1 - p) / b}, floored at zero.
     */
    public static double kellyFraction(double winRate, double rewardToRisk) {
        if (rewardToRisk <= 0) {
            return 0.0;
        }
        double p = clamp(winRate, 0.0, 1.0);
        return Math.max(0.0, p - (1.0 - p) / rewardToRisk);
    }

    /**
     * Decline of equity from its peak in percent. Never negative; zero without a peak.
     */
    public static double drawdownPct(double peakBalance, double equity) {
        if (peakBalance <= 0) {
            return 0.0;
        }
        return Math.max(0.0, (peakBalance - equity) / peakBalance * 100.0);
    }

    public static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    public static double round(double value, int scale) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }

    public static String pct(double value) {
        return BigDecimal.valueOf(value).setScale(1, RoundingMode.HALF_UP).toPlainString() + "%";
    }
}

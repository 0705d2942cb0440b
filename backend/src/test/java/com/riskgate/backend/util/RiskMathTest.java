package com.riskgate.backend.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class RiskMathTest {

    @Test
    void kellyFractionForSixtyPercentAtTwoToOne() {
        assertThat(RiskMath.kellyFraction(0.6, 2.0)).isCloseTo(0.4, within(1e-12));
    }

    @Test
    void kellyFractionNeverNegative() {
        assertThat(RiskMath.kellyFraction(0.2, 1.0)).isZero();
        assertThat(RiskMath.kellyFraction(0.9, 0.0)).isZero();
    }

    @Test
    void drawdownGrowsAsEquityFallsAndIsNeverNegative() {
        double previous = -1;
        for (double equity = 2500; equity >= 0; equity -= 100) {
            double drawdown = RiskMath.drawdownPct(2000, equity);
            assertThat(drawdown).isGreaterThanOrEqualTo(0.0);
            assertThat(drawdown).isGreaterThanOrEqualTo(previous);
            previous = drawdown;
        }
        assertThat(RiskMath.drawdownPct(2000, 1000)).isEqualTo(50.0);
        assertThat(RiskMath.drawdownPct(0, 1000)).isZero();
    }

    @Test
    void formatsPercentWithOneDecimal() {
        assertThat(RiskMath.pct(50.0)).isEqualTo("50.0%");
        assertThat(RiskMath.pct(10)).isEqualTo("10.0%");
    }
}

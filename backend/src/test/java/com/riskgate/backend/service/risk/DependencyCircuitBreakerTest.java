package com.riskgate.backend.service.risk;

import com.riskgate.backend.config.SafeguardProperties;
import com.riskgate.backend.model.BreakerStatus;
import com.riskgate.backend.util.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class DependencyCircuitBreakerTest {

    private final MutableClock clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
    private final DependencyCircuitBreaker breaker = new DependencyCircuitBreaker("api",
            new SafeguardProperties.Breaker(3, Duration.ofSeconds(60), 2), clock);

    @Test
    void opensAfterThresholdThenProbesAndCloses() {
        breaker.recordFailure();
        breaker.recordFailure();
        assertThat(breaker.getStatus()).isEqualTo(BreakerStatus.CLOSED);

        breaker.recordFailure();
        assertThat(breaker.getStatus()).isEqualTo(BreakerStatus.OPEN);
        assertThat(breaker.canProceed()).isFalse();

        clock.advance(Duration.ofSeconds(59));
        assertThat(breaker.canProceed()).isFalse();

        clock.advance(Duration.ofSeconds(1));
        assertThat(breaker.canProceed()).isTrue();
        assertThat(breaker.getStatus()).isEqualTo(BreakerStatus.HALF_OPEN);

        breaker.recordSuccess();
        assertThat(breaker.getStatus()).isEqualTo(BreakerStatus.CLOSED);
        assertThat(breaker.snapshot().failureCount()).isZero();
    }

    @Test
    void reopensWithFreshTimerWhenHalfOpenProbesFail() {
        for (int i = 0; i < 3; i++) {
            breaker.recordFailure();
        }
        clock.advance(Duration.ofSeconds(60));
        assertThat(breaker.canProceed()).isTrue();

        breaker.recordFailure();
        assertThat(breaker.getStatus()).isEqualTo(BreakerStatus.HALF_OPEN);
        breaker.recordFailure();
        assertThat(breaker.getStatus()).isEqualTo(BreakerStatus.OPEN);
        assertThat(breaker.snapshot().openedAt()).isEqualTo(clock.instant());

        clock.advance(Duration.ofSeconds(30));
        assertThat(breaker.canProceed()).isFalse();
    }

    @Test
    void successWhileClosedResetsFailureCount() {
        breaker.recordFailure();
        breaker.recordFailure();
        breaker.recordSuccess();
        breaker.recordFailure();

        assertThat(breaker.getStatus()).isEqualTo(BreakerStatus.CLOSED);
        assertThat(breaker.snapshot().failureCount()).isEqualTo(1);
    }
}

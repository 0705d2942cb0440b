package com.riskgate.backend.service.risk;

import com.riskgate.backend.config.SafeguardProperties;
import com.riskgate.backend.model.BreakerSnapshot;
import com.riskgate.backend.model.BreakerStatus;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

/**
 * CLOSED / OPEN / HALF_OPEN breaker for one dependency.
 * <p>
 * Opens once {@code failureThreshold} failures accumulate. After {@code timeout} the next
 * {@link #canProceed()} moves it to HALF_OPEN and lets probes through; a success closes it,
 * while {@code halfOpenMax} failed probes re-open it with a fresh timer.
 */
@Slf4j
public class DependencyCircuitBreaker {

    private final int failureThreshold;
    private final Duration timeout;
    private final int halfOpenMax;
    private final Clock clock;
    private final CircuitBreakerState state;
    private final ReentrantLock lock = new ReentrantLock();

    public DependencyCircuitBreaker(String name, SafeguardProperties.Breaker config, Clock clock) {
        this.failureThreshold = config.getFailureThreshold();
        this.timeout = config.getTimeout();
        this.halfOpenMax = config.getHalfOpenMax();
        this.clock = clock;
        this.state = new CircuitBreakerState(name);
    }

    public String getName() {
        return state.getName();
    }

    public boolean canProceed() {
        lock.lock();
        try {
            switch (state.getStatus()) {
                case CLOSED:
                case HALF_OPEN:
                    return true;
                default:
                    Instant now = clock.instant();
                    if (state.getOpenedAt() != null
                            && !now.isBefore(state.getOpenedAt().plus(timeout))) {
                        state.setStatus(BreakerStatus.HALF_OPEN);
                        state.setHalfOpenAttempts(0);
                        log.info("Circuit breaker {} moving to half-open", state.getName());
                        return true;
                    }
                    return false;
            }
        } finally {
            lock.unlock();
        }
    }

    public void recordSuccess() {
        lock.lock();
        try {
            if (state.getStatus() == BreakerStatus.HALF_OPEN) {
                log.info("Circuit breaker {} closing after successful probe", state.getName());
                reset();
            } else if (state.getStatus() == BreakerStatus.CLOSED) {
                state.setFailureCount(0);
            }
        } finally {
            lock.unlock();
        }
    }

    public void recordFailure() {
        lock.lock();
        try {
            Instant now = clock.instant();
            state.setFailureCount(state.getFailureCount() + 1);
            state.setLastFailure(now);
            switch (state.getStatus()) {
                case HALF_OPEN:
                    state.setHalfOpenAttempts(state.getHalfOpenAttempts() + 1);
                    if (state.getHalfOpenAttempts() >= halfOpenMax) {
                        state.setStatus(BreakerStatus.OPEN);
                        state.setOpenedAt(now);
                        log.warn("Circuit breaker {} failed while half-open, re-opening", state.getName());
                    }
                    break;
                case CLOSED:
                    if (state.getFailureCount() >= failureThreshold) {
                        state.setStatus(BreakerStatus.OPEN);
                        state.setOpenedAt(now);
                        log.error("Circuit breaker {} OPENED after {} failures", state.getName(), state.getFailureCount());
                    }
                    break;
                default:
                    break;
            }
        } finally {
            lock.unlock();
        }
    }

    public BreakerStatus getStatus() {
        lock.lock();
        try {
            return state.getStatus();
        } finally {
            lock.unlock();
        }
    }

    public BreakerSnapshot snapshot() {
        lock.lock();
        try {
            return new BreakerSnapshot(state.getName(), state.getStatus(), state.getFailureCount(),
                    state.getLastFailure(), state.getOpenedAt());
        } finally {
            lock.unlock();
        }
    }

    private void reset() {
        state.setStatus(BreakerStatus.CLOSED);
        state.setFailureCount(0);
        state.setHalfOpenAttempts(0);
        state.setOpenedAt(null);
    }
}

package com.riskgate.backend.service.risk;

import com.riskgate.backend.model.BreakerStatus;
import lombok.Data;

import java.time.Instant;

/**
 * Mutable breaker bookkeeping. Owned by a single {@link DependencyCircuitBreaker} and
 * only touched under its lock.
 */
@Data
class CircuitBreakerState {

    private final String name;
    private BreakerStatus status = BreakerStatus.CLOSED;
    private int failureCount;
    private Instant lastFailure;
    private Instant openedAt;
    private int halfOpenAttempts;
}

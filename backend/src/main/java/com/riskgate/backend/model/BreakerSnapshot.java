package com.riskgate.backend.model;

import java.time.Instant;

public record BreakerSnapshot(
        String name,
        BreakerStatus status,
        int failureCount,
        Instant lastFailure,
        Instant openedAt
) {}

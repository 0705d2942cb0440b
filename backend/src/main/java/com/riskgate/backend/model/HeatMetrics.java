package com.riskgate.backend.model;

import java.time.Instant;

/**
 * Aggregate portfolio risk posture. {@code maxDrawdown} is a high-water mark and
 * {@code dailyLoss} is a signed fraction of the day's starting equity.
 */
public record HeatMetrics(
        double totalExposure,
        int positionCount,
        double dailyLoss,
        double maxDrawdown,
        Instant lastUpdated
) {

    public static HeatMetrics empty(Instant now) {
        return new HeatMetrics(0.0, 0, 0.0, 0.0, now);
    }
}

package com.riskgate.backend.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Point-in-time account state. {@code totalExposure} always equals the sum of absolute
 * position notionals; the canonical constructor rejects anything else.
 */
public record PortfolioSnapshot(
        double balance,
        double totalExposure,
        Map<String, Double> positions,
        Map<String, Double> markPrices,
        double unrealizedPnl,
        double peakBalance,
        Instant timestamp
) {

    private static final double EXPOSURE_TOLERANCE = 1e-6;

    public PortfolioSnapshot {
        positions = positions == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(positions));
        markPrices = markPrices == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(markPrices));
        double expected = sumExposure(positions);
        if (Math.abs(expected - totalExposure) > EXPOSURE_TOLERANCE * Math.max(1.0, expected)) {
            throw new IllegalArgumentException("total exposure " + totalExposure + " does not match positions " + expected);
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp is required");
        }
    }

    public static PortfolioSnapshot of(double balance,
                                       Map<String, Double> positions,
                                       Map<String, Double> markPrices,
                                       double unrealizedPnl,
                                       double peakBalance,
                                       Instant timestamp) {
        return new PortfolioSnapshot(balance, sumExposure(positions), positions, markPrices,
                unrealizedPnl, peakBalance, timestamp);
    }

    public double equity() {
        return balance + unrealizedPnl;
    }

    public int positionCount() {
        return (int) positions.values().stream().filter(notional -> notional != 0.0).count();
    }

    public Optional<Double> markPrice(String symbol) {
        Double price = markPrices.get(symbol);
        return price != null && price > 0 ? Optional.of(price) : Optional.empty();
    }

    private static double sumExposure(Map<String, Double> positions) {
        if (positions == null) {
            return 0.0;
        }
        return positions.values().stream().mapToDouble(value -> Math.abs(value == null ? 0.0 : value)).sum();
    }
}

package com.riskgate.backend.model;

import lombok.Builder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A proposed trade awaiting risk clearance. Immutable once built.
 */
@Builder(toBuilder = true)
public record OrderIntent(
        String symbol,
        OrderSide side,
        OrderType orderType,
        double notional,
        Double quantity,
        Double price,
        Double takeProfit,
        Double stopLoss,
        Double leverage,
        double expectedWinRate,
        double rewardToRisk,
        Map<String, Object> clientMetadata
) {

    public static final double DEFAULT_WIN_RATE = 0.55;
    public static final double DEFAULT_REWARD_TO_RISK = 2.0;

    public OrderIntent {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("symbol is required");
        }
        if (side == null) {
            throw new IllegalArgumentException("side is required");
        }
        if (!(notional > 0)) {
            throw new IllegalArgumentException("notional must be positive");
        }
        orderType = orderType != null ? orderType : OrderType.MARKET;
        clientMetadata = clientMetadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(clientMetadata));
    }

    /**
     * Price used to size and evaluate the order: the explicit limit price, else an
     * {@code entry_price} hint carried in the client metadata.
     */
    public Double referencePrice() {
        if (price != null && price > 0) {
            return price;
        }
        Object hint = clientMetadata.get("entry_price");
        if (hint instanceof Number number && number.doubleValue() > 0) {
            return number.doubleValue();
        }
        if (hint instanceof String text && !text.isBlank()) {
            try {
                double parsed = Double.parseDouble(text);
                return parsed > 0 ? parsed : null;
            } catch (NumberFormatException ignored) {
                return null;
            }
        }
        return null;
    }

    /**
     * Distance from reference price to stop as a fraction, when both are known.
     */
    public Double stopLossPct() {
        Double reference = referencePrice();
        if (stopLoss == null || stopLoss <= 0 || reference == null) {
            return null;
        }
        double pct = Math.abs(reference - stopLoss) / reference;
        return pct > 0 ? pct : null;
    }

    public double effectiveLeverage() {
        return leverage != null && leverage > 0 ? leverage : 1.0;
    }
}

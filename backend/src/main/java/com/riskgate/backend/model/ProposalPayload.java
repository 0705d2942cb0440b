package com.riskgate.backend.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What an agent proposes to trade. Carried inside a consensus proposal until it
 * is resolved.
 */
public record ProposalPayload(
        String symbol,
        OrderSide side,
        double notional,
        double confidence,
        String rationale,
        Map<String, Object> constraints
) {

    public ProposalPayload {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("symbol is required");
        }
        if (side == null) {
            throw new IllegalArgumentException("side is required");
        }
        if (!(notional > 0)) {
            throw new IllegalArgumentException("notional must be positive");
        }
        constraints = constraints == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(constraints));
    }
}

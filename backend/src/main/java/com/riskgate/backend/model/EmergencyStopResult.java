package com.riskgate.backend.model;

import java.util.List;

public record EmergencyStopResult(String status, List<CancelResult> cancellations) {

    public EmergencyStopResult {
        cancellations = cancellations == null ? List.of() : List.copyOf(cancellations);
    }

    public long failedCount() {
        return cancellations.stream().filter(result -> !result.success()).count();
    }
}

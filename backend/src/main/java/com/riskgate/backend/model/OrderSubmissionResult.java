package com.riskgate.backend.model;

public record OrderSubmissionResult(
        SubmissionStatus status,
        String orderId,
        GuardrailCode code,
        String reason,
        RiskCheckResult riskCheck
) {

    public static OrderSubmissionResult submitted(String orderId, RiskCheckResult riskCheck) {
        return new OrderSubmissionResult(SubmissionStatus.SUBMITTED, orderId, null, null, riskCheck);
    }

    public static OrderSubmissionResult duplicate(String orderId) {
        return new OrderSubmissionResult(SubmissionStatus.DUPLICATE, orderId, null, null, null);
    }

    public static OrderSubmissionResult rejected(String orderId, GuardrailCode code, String reason) {
        return new OrderSubmissionResult(SubmissionStatus.REJECTED, orderId, code, reason, null);
    }

    public boolean isSubmitted() {
        return status == SubmissionStatus.SUBMITTED;
    }
}

package com.riskgate.backend.service.telemetry;

import java.util.Map;

/**
 * Fire-and-forget telemetry. Publishing never throws and never blocks the caller on I/O.
 */
public interface EventSink {

    void publishDecision(Map<String, ?> payload);

    void publishPosition(Map<String, ?> payload);

    void publishReasoning(Map<String, ?> payload);
}

package com.riskgate.backend.service.telemetry;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One flat record destined for a telemetry stream. Values are already rendered to
 * strings so any stream backend can take them as-is.
 */
public record TelemetryEvent(TelemetryChannel channel, Map<String, String> fields) {

    public TelemetryEvent {
        fields = fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }
}

package com.riskgate.backend.service.telemetry;

public interface EventStreamWriter {

    void write(TelemetryEvent event);
}

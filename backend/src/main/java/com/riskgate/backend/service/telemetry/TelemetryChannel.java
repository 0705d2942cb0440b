package com.riskgate.backend.service.telemetry;

public enum TelemetryChannel {
    DECISIONS("decisions"),
    POSITIONS("positions"),
    REASONING("reasoning");

    private final String streamName;

    TelemetryChannel(String streamName) {
        this.streamName = streamName;
    }

    public String streamName() {
        return streamName;
    }
}

package com.riskgate.backend.service.telemetry;

import lombok.extern.slf4j.Slf4j;

@Slf4j
public class LoggingEventStreamWriter implements EventStreamWriter {

    @Override
    public void write(TelemetryEvent event) {
        log.info("telemetry {} {}", event.channel().streamName(), event.fields());
    }
}

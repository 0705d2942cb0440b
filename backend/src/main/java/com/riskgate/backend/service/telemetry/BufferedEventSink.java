package com.riskgate.backend.service.telemetry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.riskgate.backend.service.MetricsService;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded queue drained by one worker thread. A full queue drops the event; drops and
 * write failures are counted and logged.
 */
@Slf4j
public class BufferedEventSink implements EventSink {

    private static final Duration POLL_TIMEOUT = Duration.ofMillis(500);

    private final BlockingQueue<TelemetryEvent> queue;
    private final EventStreamWriter writer;
    private final MetricsService metricsService;
    private final ObjectMapper objectMapper;
    private final AtomicLong dropped = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong written = new AtomicLong();

    private volatile boolean running;
    private Thread worker;

    public BufferedEventSink(int capacity, EventStreamWriter writer, MetricsService metricsService, ObjectMapper objectMapper) {
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.writer = writer;
        this.metricsService = metricsService;
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void start() {
        running = true;
        worker = new Thread(this::drain, "telemetry-worker");
        worker.setDaemon(true);
        worker.start();
    }

    @PreDestroy
    public void stop() throws InterruptedException {
        running = false;
        if (worker != null) {
            worker.join(POLL_TIMEOUT.toMillis() * 4);
        }
        if (!queue.isEmpty()) {
            log.warn("Telemetry stopped with {} undelivered events", queue.size());
        }
    }

    @Override
    public void publishDecision(Map<String, ?> payload) {
        enqueue(TelemetryChannel.DECISIONS, payload);
    }

    @Override
    public void publishPosition(Map<String, ?> payload) {
        enqueue(TelemetryChannel.POSITIONS, payload);
    }

    @Override
    public void publishReasoning(Map<String, ?> payload) {
        enqueue(TelemetryChannel.REASONING, payload);
    }

    public long droppedCount() {
        return dropped.get();
    }

    public long failedCount() {
        return failed.get();
    }

    public long writtenCount() {
        return written.get();
    }

    public int backlog() {
        return queue.size();
    }

    private void enqueue(TelemetryChannel channel, Map<String, ?> payload) {
        TelemetryEvent event = new TelemetryEvent(channel, flatten(payload));
        if (!queue.offer(event)) {
            dropped.incrementAndGet();
            metricsService.recordTelemetryDropped();
            log.warn("Telemetry queue full, dropped {} event", channel.streamName());
        }
    }

    private void drain() {
        while (running || !queue.isEmpty()) {
            TelemetryEvent event;
            try {
                event = queue.poll(POLL_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Telemetry worker interrupted with {} events pending", queue.size());
                return;
            }
            if (event == null) {
                continue;
            }
            try {
                writer.write(event);
                written.incrementAndGet();
            } catch (RuntimeException e) {
                failed.incrementAndGet();
                metricsService.recordTelemetryFailed();
                log.warn("Telemetry write to {} failed: {}", event.channel().streamName(), e.getMessage());
            }
        }
    }

    private Map<String, String> flatten(Map<String, ?> payload) {
        Map<String, String> fields = new LinkedHashMap<>();
        if (payload == null) {
            return fields;
        }
        payload.forEach((key, value) -> {
            if (value == null) {
                fields.put(key, "");
            } else if (value instanceof CharSequence || value instanceof Number || value instanceof Boolean
                    || value instanceof Enum<?>) {
                fields.put(key, value.toString());
            } else {
                fields.put(key, toJson(value));
            }
        });
        return fields;
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }
}

package com.riskgate.backend.service.telemetry;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.riskgate.backend.service.MetricsService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class BufferedEventSinkTest {

    private final EventStreamWriter writer = mock(EventStreamWriter.class);
    private final MetricsService metricsService = mock(MetricsService.class);
    private BufferedEventSink sink;

    @AfterEach
    void tearDown() throws InterruptedException {
        if (sink != null) {
            sink.stop();
        }
    }

    @Test
    void payloadIsFlattenedToStrings() {
        sink = new BufferedEventSink(10, writer, metricsService, new ObjectMapper());
        sink.start();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("bot_id", "momentum");
        payload.put("notional", 125.5);
        payload.put("approved", true);
        payload.put("exchange_order_id", null);
        payload.put("positions", Map.of("BTCUSDT", 1));

        sink.publishDecision(payload);

        ArgumentCaptor<TelemetryEvent> event = ArgumentCaptor.forClass(TelemetryEvent.class);
        verify(writer, timeout(2000)).write(event.capture());
        assertThat(event.getValue().channel()).isEqualTo(TelemetryChannel.DECISIONS);
        assertThat(event.getValue().fields())
                .containsEntry("bot_id", "momentum")
                .containsEntry("notional", "125.5")
                .containsEntry("approved", "true")
                .containsEntry("exchange_order_id", "")
                .containsEntry("positions", "{\"BTCUSDT\":1}");
    }

    @Test
    void fullQueueDropsAndCounts() {
        sink = new BufferedEventSink(2, writer, metricsService, new ObjectMapper());

        sink.publishPosition(Map.of("n", 1));
        sink.publishPosition(Map.of("n", 2));
        sink.publishPosition(Map.of("n", 3));

        assertThat(sink.droppedCount()).isEqualTo(1);
        assertThat(sink.backlog()).isEqualTo(2);
        verify(metricsService).recordTelemetryDropped();

        sink.start();
        ArgumentCaptor<TelemetryEvent> events = ArgumentCaptor.forClass(TelemetryEvent.class);
        verify(writer, timeout(2000).times(2)).write(events.capture());
        List<String> order = events.getAllValues().stream().map(e -> e.fields().get("n")).toList();
        assertThat(order).containsExactly("1", "2");
    }

    @Test
    void writerFailureIsCountedAndWorkerKeepsGoing() {
        doThrow(new IllegalStateException("redis down")).doNothing().when(writer).write(any());
        sink = new BufferedEventSink(10, writer, metricsService, new ObjectMapper());
        sink.start();

        sink.publishReasoning(Map.of("message", "first"));
        sink.publishReasoning(Map.of("message", "second"));

        verify(writer, timeout(2000).times(2)).write(any());
        verify(metricsService, timeout(2000)).recordTelemetryFailed();
        assertThat(sink.failedCount()).isEqualTo(1);
    }
}

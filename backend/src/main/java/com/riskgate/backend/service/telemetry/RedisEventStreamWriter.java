package com.riskgate.backend.service.telemetry;

import com.riskgate.backend.config.TelemetryProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.data.redis.connection.stream.RecordId;
import org.springframework.data.redis.connection.stream.StreamRecords;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Appends events to {@code <prefix>:<channel>} Redis streams, trimmed to an
 * approximate maximum length.
 */
@RequiredArgsConstructor
public class RedisEventStreamWriter implements EventStreamWriter {

    private final StringRedisTemplate redisTemplate;
    private final TelemetryProperties properties;

    @Override
    public void write(TelemetryEvent event) {
        String key = streamKey(event.channel());
        RecordId id = redisTemplate.opsForStream().add(StreamRecords.string(event.fields()).withStreamKey(key));
        if (id == null) {
            throw new IllegalStateException("Redis returned no record id for " + key);
        }
        redisTemplate.opsForStream().trim(key, properties.getMaxStreamLength(), true);
    }

    public String streamKey(TelemetryChannel channel) {
        return properties.getStreamPrefix() + ":" + channel.streamName();
    }
}

package com.riskgate.backend.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.riskgate.backend.service.MetricsService;
import com.riskgate.backend.service.telemetry.BufferedEventSink;
import com.riskgate.backend.service.telemetry.EventStreamWriter;
import com.riskgate.backend.service.telemetry.LoggingEventStreamWriter;
import com.riskgate.backend.service.telemetry.RedisEventStreamWriter;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

@Configuration
public class TelemetryConfig {

    @Bean
    public EventStreamWriter eventStreamWriter(TelemetryProperties telemetryProperties,
                                               ObjectProvider<StringRedisTemplate> redisTemplate) {
        StringRedisTemplate template = redisTemplate.getIfAvailable();
        if (telemetryProperties.isRedisEnabled() && template != null) {
            return new RedisEventStreamWriter(template, telemetryProperties);
        }
        return new LoggingEventStreamWriter();
    }

    @Bean
    public BufferedEventSink eventSink(TelemetryProperties telemetryProperties, EventStreamWriter eventStreamWriter,
                                       MetricsService metricsService, ObjectMapper objectMapper) {
        return new BufferedEventSink(telemetryProperties.getQueueCapacity(), eventStreamWriter, metricsService, objectMapper);
    }
}

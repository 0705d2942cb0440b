package com.riskgate.backend.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "telemetry")
@Data
@Validated
public class TelemetryProperties {

    @Min(1)
    private int queueCapacity = 1000;

    @NotBlank
    private String streamPrefix = "stream";

    @Min(1)
    private long maxStreamLength = 10_000;

    private boolean redisEnabled = true;
}

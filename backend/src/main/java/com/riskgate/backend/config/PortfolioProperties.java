package com.riskgate.backend.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "portfolio")
@Data
@Validated
public class PortfolioProperties {

    @Min(1000)
    private long refreshIntervalMs = 180_000;

    @NotNull
    private Duration cacheTtl = Duration.ofSeconds(60);

    private boolean watcherEnabled = true;
}

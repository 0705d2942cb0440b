package com.riskgate.backend.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "consensus")
@Data
@Validated
public class ConsensusProperties {

    @Min(1)
    private int minVotes = 3;

    @Positive
    @DecimalMax("1.0")
    private double threshold = 0.67;

    @NotNull
    private Duration timeout = Duration.ofSeconds(30);

    @Min(100)
    private long sweepIntervalMs = 5000;

    // Approved proposals are submitted to the orchestrator on behalf of the proposer
    private boolean autoExecute = true;
}

package com.riskgate.backend.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "bus")
@Data
@Validated
public class BusProperties {

    @Min(0)
    private int replaySize = 50;

    @Min(1)
    private int historySize = 200;

    @NotBlank
    private String defaultSession = "default";

    @NotBlank
    private String coordinatorId = "risk-orchestrator";
}

package com.riskgate.backend.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "tpsl")
@Data
@Validated
public class TpslProperties {

    @NotNull
    private Duration atrCacheTtl = Duration.ofMinutes(5);

    @Min(1)
    private int minTradesForWinRate = 5;
}

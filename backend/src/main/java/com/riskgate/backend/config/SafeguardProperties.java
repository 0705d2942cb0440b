package com.riskgate.backend.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@Configuration
@ConfigurationProperties(prefix = "safeguards")
@Data
@Validated
public class SafeguardProperties {

    public static final String API = "api";
    public static final String ORDERS = "orders";
    public static final String MARKET_DATA = "market_data";

    @Valid
    private Map<String, Breaker> breakers = defaultBreakers();

    @Positive
    @DecimalMax("1.0")
    private double maxDrawdown = 0.05;

    @Positive
    @DecimalMax("1.0")
    private double dailyLoss = 0.03;

    @Min(1)
    private int maxOrdersPerMinute = 20;

    @Positive
    private double maxPortfolioLeverage = 3.0;

    @Min(1)
    private int maxConcurrentPositions = 10;

    private String dailyResetCron = "0 0 0 * * *";

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Breaker {
        @Min(1)
        private int failureThreshold = 3;

        @NotNull
        private Duration timeout = Duration.ofSeconds(60);

        @Min(1)
        private int halfOpenMax = 3;
    }

    private static Map<String, Breaker> defaultBreakers() {
        Map<String, Breaker> defaults = new LinkedHashMap<>();
        defaults.put(API, new Breaker(3, Duration.ofSeconds(60), 3));
        defaults.put(ORDERS, new Breaker(5, Duration.ofSeconds(120), 3));
        defaults.put(MARKET_DATA, new Breaker(3, Duration.ofSeconds(30), 3));
        return defaults;
    }
}

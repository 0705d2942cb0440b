package com.riskgate.backend.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@Configuration
@ConfigurationProperties(prefix = "risk")
@Data
@Validated
public class RiskProperties {

    private Engine engine = new Engine();
    private Guardrails guardrails = new Guardrails();
    private Allocation allocation = new Allocation();
    private Guard guard = new Guard();

    @Data
    public static class Engine {
        @Positive
        private double maxDrawdownPct = 10.0;

        @Positive
        @DecimalMax("100.0")
        private double maxPerTradePct = 20.0;

        @PositiveOrZero
        private double minMarginBufferUsdt = 50.0;

        // 0 means "size from intent notional"
        @PositiveOrZero
        private double fallbackReferencePrice = 0.0;
    }

    @Data
    public static class Guardrails {
        @Positive
        @DecimalMax("1.0")
        private double kellyFractionCap = 0.25;

        @Positive
        private double maxPortfolioLeverage = 3.0;

        @Positive
        @DecimalMax("1.0")
        private double maxPositionRisk = 0.15;

        @Positive
        @DecimalMax("1.0")
        private double maxDrawdown = 0.2;

        @NotNull
        private Duration idempotencyTtl = Duration.ofSeconds(120);

        private boolean redisIdempotencyEnabled = true;
    }

    @Data
    public static class Allocation {
        /**
         * Capital assumed for agents without an override. Zero switches to an equal
         * split of the current balance across {@link #equalSplitAgents}.
         */
        @PositiveOrZero
        private double defaultAllocationUsd = 0.0;

        @Min(1)
        private int equalSplitAgents = 4;

        private Map<String, Double> overrides = new LinkedHashMap<>();
    }

    @Data
    public static class Guard {
        @Positive
        private double maxLossPerTradeUsd = 50.0;

        @Positive
        private double maxLeverage = 10.0;

        @Positive
        @DecimalMax("1.0")
        private double maxPositionPct = 0.15;

        @PositiveOrZero
        private double minPositionUsd = 10.0;

        @Positive
        private double dailyLossLimitUsd = 250.0;

        @Positive
        @DecimalMax("1.0")
        private double dailyLossLimitPct = 0.05;

        @DecimalMin("0.0001")
        private double defaultStopLossPct = 0.02;
    }
}

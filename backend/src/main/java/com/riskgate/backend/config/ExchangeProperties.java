package com.riskgate.backend.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "exchange")
@Data
@Validated
public class ExchangeProperties {

    @NotNull
    private Mode mode = Mode.PAPER;

    private String baseUrl = "https://fapi.asterdex.com";
    private String apiKey;
    private String apiSecret;

    // Symbols swept by the emergency stop
    private List<String> symbols = new ArrayList<>(List.of("BTCUSDT", "ETHUSDT"));

    @NotNull
    private Duration cancelTimeout = Duration.ofSeconds(5);

    @Min(1)
    private int connectTimeoutMs = 5000;

    @Min(1)
    private int readTimeoutMs = 10000;

    @Min(1)
    private long recvWindowMs = 5000;

    private Paper paper = new Paper();

    public enum Mode {
        PAPER,
        LIVE
    }

    @Data
    public static class Paper {
        @Positive
        private double initialBalance = 10_000.0;

        private String asset = "USDT";
    }
}

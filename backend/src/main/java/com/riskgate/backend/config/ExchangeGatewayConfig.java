package com.riskgate.backend.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.riskgate.backend.service.MetricsService;
import com.riskgate.backend.service.exchange.ExchangeGateway;
import com.riskgate.backend.service.exchange.ExchangeHttpClient;
import com.riskgate.backend.service.exchange.PaperExchangeGateway;
import com.riskgate.backend.service.exchange.RestExchangeGateway;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.retry.Retry;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;

@Configuration
@Slf4j
public class ExchangeGatewayConfig {

    @Bean
    @ConditionalOnProperty(prefix = "exchange", name = "mode", havingValue = "paper", matchIfMissing = true)
    public ExchangeGateway paperExchangeGateway(ExchangeProperties exchangeProperties) {
        log.info("Exchange gateway: PAPER (initial balance {})", exchangeProperties.getPaper().getInitialBalance());
        return new PaperExchangeGateway(exchangeProperties);
    }

    @Bean
    @ConditionalOnProperty(prefix = "exchange", name = "mode", havingValue = "live")
    public ExchangeGateway liveExchangeGateway(RestTemplate exchangeRestTemplate,
                                               ExchangeProperties exchangeProperties,
                                               RateLimiter exchangeRateLimiter,
                                               Retry exchangeRetry,
                                               MetricsService metricsService,
                                               MeterRegistry meterRegistry,
                                               ObjectMapper objectMapper,
                                               Clock clock) {
        if (exchangeProperties.getApiKey() == null || exchangeProperties.getApiSecret() == null) {
            throw new IllegalStateException("exchange.api-key and exchange.api-secret are required in live mode");
        }
        log.info("Exchange gateway: LIVE ({})", exchangeProperties.getBaseUrl());
        ExchangeHttpClient client = new ExchangeHttpClient(exchangeRestTemplate, exchangeProperties,
                exchangeRateLimiter, exchangeRetry, metricsService, meterRegistry, clock);
        return new RestExchangeGateway(client, objectMapper);
    }
}

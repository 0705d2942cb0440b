package com.riskgate.backend.config;

import com.riskgate.backend.exception.ExchangeRateLimitException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;

import java.time.Duration;

@Configuration
public class ExchangeResilienceConfig {

    @Bean
    public RateLimiter exchangeRateLimiter(
            @Value("${exchange.resilience.rate.limit-per-second:10}") int limitPerSecond,
            @Value("${exchange.resilience.rate.timeout-ms:500}") long timeoutMs
    ) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(limitPerSecond)
                .timeoutDuration(Duration.ofMillis(timeoutMs))
                .build();
        return RateLimiter.of("exchange", config);
    }

    @Bean
    public Retry exchangeRetry(
            @Value("${exchange.resilience.retry.max-attempts:3}") int maxAttempts,
            @Value("${exchange.resilience.retry.base-delay-ms:250}") long baseDelayMs,
            @Value("${exchange.resilience.retry.jitter-factor:0.2}") double jitterFactor
    ) {
        IntervalFunction intervalFunction = IntervalFunction.ofExponentialRandomBackoff(
                Duration.ofMillis(baseDelayMs),
                2.0,
                jitterFactor
        );
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(intervalFunction)
                .retryExceptions(ExchangeRateLimitException.class, ResourceAccessException.class, HttpServerErrorException.class)
                .build();
        return Retry.of("exchange", config);
    }
}

package com.riskgate.backend.service.exchange;

import com.riskgate.backend.config.ExchangeProperties;
import com.riskgate.backend.exception.ExchangeApiException;
import com.riskgate.backend.exception.ExchangeRateLimitException;
import com.riskgate.backend.service.MetricsService;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import io.github.resilience4j.retry.Retry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Signed REST transport for the live exchange. Every call goes through the rate
 * limiter, then retry, and is timed per method.
 */
@Slf4j
public class ExchangeHttpClient {

    static final String API_KEY_HEADER = "X-MBX-APIKEY";

    private final RestTemplate restTemplate;
    private final ExchangeProperties properties;
    private final RequestSigner signer;
    private final RateLimiter rateLimiter;
    private final Retry retry;
    private final MetricsService metricsService;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public ExchangeHttpClient(RestTemplate restTemplate, ExchangeProperties properties, RateLimiter rateLimiter,
                              Retry retry, MetricsService metricsService, MeterRegistry meterRegistry, Clock clock) {
        this.restTemplate = restTemplate;
        this.properties = properties;
        this.signer = new RequestSigner(properties.getApiSecret());
        this.rateLimiter = rateLimiter;
        this.retry = retry;
        this.metricsService = metricsService;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    public String signedGet(String path, Map<String, String> params) {
        return execute(HttpMethod.GET, path, params);
    }

    public String signedPost(String path, Map<String, String> params) {
        return execute(HttpMethod.POST, path, params);
    }

    public String signedDelete(String path, Map<String, String> params) {
        return execute(HttpMethod.DELETE, path, params);
    }

    private String execute(HttpMethod method, String path, Map<String, String> params) {
        Timer.Sample sample = Timer.start(meterRegistry);
        boolean success = false;
        // Signature carries the timestamp, so each retry attempt re-signs
        Supplier<String> supplier = () -> doRequest(method, path, params);
        try {
            Supplier<String> decorated = Retry.decorateSupplier(retry, supplier);
            decorated = RateLimiter.decorateSupplier(rateLimiter, decorated);
            String response = decorated.get();
            success = true;
            return response;
        } catch (RequestNotPermitted e) {
            metricsService.recordExchangeError();
            throw new ExchangeRateLimitException("Local exchange rate limit exceeded", 429, e);
        } catch (ExchangeApiException e) {
            metricsService.recordExchangeError();
            log.warn("Exchange request failed method={} path={} status={} message={}",
                    method, path, e.getStatusCode(), e.getMessage());
            throw e;
        } catch (ResourceAccessException | HttpServerErrorException e) {
            metricsService.recordExchangeError();
            log.warn("Exchange request failed method={} path={} message={}", method, path, e.getMessage());
            throw new ExchangeApiException("Exchange unreachable: " + e.getMessage(), e);
        } finally {
            sample.stop(Timer.builder("exchange_call_latency")
                    .tag("method", method.name())
                    .tag("path", path)
                    .tag("status", success ? "success" : "error")
                    .register(meterRegistry));
        }
    }

    private String doRequest(HttpMethod method, String path, Map<String, String> params) {
        Map<String, String> signedParams = new LinkedHashMap<>(params);
        signedParams.put("recvWindow", Long.toString(properties.getRecvWindowMs()));
        signedParams.put("timestamp", Long.toString(clock.millis()));
        String query = signer.canonicalQuery(signedParams);
        String url = properties.getBaseUrl() + path + "?" + query + "&signature=" + signer.sign(query);

        HttpHeaders headers = new HttpHeaders();
        if (properties.getApiKey() != null) {
            headers.set(API_KEY_HEADER, properties.getApiKey());
        }
        try {
            ResponseEntity<String> response = restTemplate.exchange(URI.create(url), method,
                    new HttpEntity<>(headers), String.class);
            return response.getBody();
        } catch (HttpClientErrorException.TooManyRequests e) {
            log.warn("Exchange rate limit 429 for {}", path);
            throw new ExchangeRateLimitException("Exchange rate limit", 429, e);
        } catch (HttpClientErrorException e) {
            throw new ExchangeApiException("Exchange API error (" + e.getStatusCode().value() + "): "
                    + e.getResponseBodyAsString(), e.getStatusCode().value(), e);
        }
    }
}

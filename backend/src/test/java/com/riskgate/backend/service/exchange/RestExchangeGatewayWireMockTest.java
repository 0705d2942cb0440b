package com.riskgate.backend.service.exchange;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.stubbing.Scenario;
import com.riskgate.backend.config.ExchangeProperties;
import com.riskgate.backend.exception.ExchangeApiException;
import com.riskgate.backend.exception.ExchangeRateLimitException;
import com.riskgate.backend.model.AccountBalance;
import com.riskgate.backend.model.ExchangeOrder;
import com.riskgate.backend.model.OrderAck;
import com.riskgate.backend.model.OrderSide;
import com.riskgate.backend.model.OrderType;
import com.riskgate.backend.model.PositionRisk;
import com.riskgate.backend.service.MetricsService;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

class RestExchangeGatewayWireMockTest {

    private static final WireMockServer wireMock = new WireMockServer(0);

    static {
        wireMock.start();
        configureFor("localhost", wireMock.port());
    }

    @AfterAll
    static void stopWireMock() {
        wireMock.stop();
    }

    private SimpleMeterRegistry meterRegistry;
    private RestExchangeGateway gateway;

    @BeforeEach
    void setUp() {
        wireMock.resetAll();
        ExchangeProperties properties = new ExchangeProperties();
        properties.setBaseUrl("http://localhost:" + wireMock.port());
        properties.setApiKey("test-key");
        properties.setApiSecret("test-secret");

        RateLimiter rateLimiter = RateLimiter.of("test", RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(100)
                .timeoutDuration(Duration.ofMillis(100))
                .build());
        Retry retry = Retry.of("test", RetryConfig.custom()
                .maxAttempts(3)
                .waitDuration(Duration.ofMillis(10))
                .retryExceptions(ExchangeRateLimitException.class, ResourceAccessException.class, HttpServerErrorException.class)
                .build());
        meterRegistry = new SimpleMeterRegistry();
        Clock clock = Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC);

        ExchangeHttpClient client = new ExchangeHttpClient(new RestTemplate(), properties, rateLimiter, retry,
                mock(MetricsService.class), meterRegistry, clock);
        gateway = new RestExchangeGateway(client, new ObjectMapper());
    }

    @Test
    void balanceRequestIsSignedAndParsed() {
        stubFor(get(urlPathEqualTo(RestExchangeGateway.BALANCE_PATH))
                .withHeader(ExchangeHttpClient.API_KEY_HEADER, equalTo("test-key"))
                .withQueryParam("timestamp", equalTo("1704067200000"))
                .withQueryParam("signature", matching("[0-9a-f]{64}"))
                .willReturn(okJson("[{\"asset\":\"USDT\",\"balance\":\"1000.50\",\"availableBalance\":\"900\",\"crossUnPnl\":\"-2.5\"}]")));

        List<AccountBalance> balances = gateway.accountBalance();

        assertThat(balances).containsExactly(new AccountBalance("USDT", 1000.50, 900, -2.5));
        assertThat(meterRegistry.find("exchange_call_latency").tag("status", "success").timer()).isNotNull();
    }

    @Test
    void positionRiskSkipsEntriesWithoutSymbol() {
        stubFor(get(urlPathEqualTo(RestExchangeGateway.POSITION_RISK_PATH))
                .willReturn(okJson("[{\"symbol\":\"BTCUSDT\",\"positionAmt\":\"-0.01\",\"entryPrice\":\"50000\","
                        + "\"markPrice\":\"49000\",\"unRealizedProfit\":\"10\",\"leverage\":\"5\"},{\"symbol\":\"\"}]")));

        List<PositionRisk> positions = gateway.positionRisk();

        assertThat(positions).hasSize(1);
        assertThat(positions.get(0).notional()).isEqualTo(-490.0);
        assertThat(positions.get(0).leverage()).isEqualTo(5.0);
    }

    @Test
    void placeOrderSendsOrderParameters() {
        stubFor(post(urlPathEqualTo(RestExchangeGateway.ORDER_PATH))
                .willReturn(okJson("{\"orderId\":12345,\"clientOrderId\":\"momentum:BTCUSDT:1\",\"status\":\"NEW\"}")));
        ExchangeOrder order = ExchangeOrder.builder()
                .clientOrderId("momentum:BTCUSDT:1")
                .symbol("BTCUSDT")
                .side(OrderSide.BUY)
                .type(OrderType.LIMIT)
                .quantity(0.002)
                .price(50_000.0)
                .notional(100)
                .leverage(1)
                .metadata(Map.<String, Object>of("reduceOnly", "false", "rationale", "breakout"))
                .build();

        OrderAck ack = gateway.placeOrder(order);

        assertThat(ack.exchangeOrderId()).isEqualTo("12345");
        verify(postRequestedFor(urlPathEqualTo(RestExchangeGateway.ORDER_PATH))
                .withQueryParam("symbol", equalTo("BTCUSDT"))
                .withQueryParam("side", equalTo("BUY"))
                .withQueryParam("quantity", equalTo("0.002"))
                .withQueryParam("price", equalTo("50000"))
                .withQueryParam("timeInForce", equalTo("GTC"))
                .withQueryParam("reduceOnly", equalTo("false"))
                .withQueryParam("rationale", absent()));
    }

    @Test
    void serverErrorIsRetried() {
        stubFor(delete(urlPathEqualTo(RestExchangeGateway.CANCEL_ALL_PATH))
                .inScenario("flaky").whenScenarioStateIs(Scenario.STARTED)
                .willReturn(serviceUnavailable())
                .willSetStateTo("recovered"));
        stubFor(delete(urlPathEqualTo(RestExchangeGateway.CANCEL_ALL_PATH))
                .inScenario("flaky").whenScenarioStateIs("recovered")
                .willReturn(okJson("{\"code\":200}")));

        gateway.cancelAllOrders("BTCUSDT");

        verify(2, deleteRequestedFor(urlPathEqualTo(RestExchangeGateway.CANCEL_ALL_PATH)));
    }

    @Test
    void clientErrorIsNotRetried() {
        stubFor(get(urlPathEqualTo(RestExchangeGateway.BALANCE_PATH))
                .willReturn(aResponse().withStatus(400).withBody("{\"code\":-1102,\"msg\":\"bad param\"}")));

        assertThatThrownBy(() -> gateway.accountBalance())
                .isInstanceOf(ExchangeApiException.class)
                .satisfies(error -> assertThat(((ExchangeApiException) error).getStatusCode()).isEqualTo(400));

        verify(1, getRequestedFor(urlPathEqualTo(RestExchangeGateway.BALANCE_PATH)));
    }

    @Test
    void rateLimitRetriesStopAfterMaxAttempts() {
        stubFor(get(urlPathEqualTo(RestExchangeGateway.BALANCE_PATH))
                .willReturn(aResponse().withStatus(429)));

        assertThatThrownBy(() -> gateway.accountBalance()).isInstanceOf(ExchangeRateLimitException.class);

        verify(3, getRequestedFor(urlPathEqualTo(RestExchangeGateway.BALANCE_PATH)));
    }
}

package com.riskgate.backend.service.exchange;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.riskgate.backend.exception.ExchangeApiException;
import com.riskgate.backend.model.AccountBalance;
import com.riskgate.backend.model.ExchangeOrder;
import com.riskgate.backend.model.OrderAck;
import com.riskgate.backend.model.OrderType;
import com.riskgate.backend.model.PositionRisk;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Live futures gateway speaking the exchange's signed REST API.
 */
@Slf4j
@RequiredArgsConstructor
public class RestExchangeGateway implements ExchangeGateway {

    static final String ORDER_PATH = "/fapi/v1/order";
    static final String CANCEL_ALL_PATH = "/fapi/v1/allOpenOrders";
    static final String BALANCE_PATH = "/fapi/v2/balance";
    static final String POSITION_RISK_PATH = "/fapi/v2/positionRisk";

    // Metadata keys the order endpoint understands; anything else stays local
    private static final Set<String> PASSTHROUGH_PARAMS = Set.of("positionSide", "reduceOnly", "workingType", "timeInForce");

    private final ExchangeHttpClient httpClient;
    private final ObjectMapper objectMapper;

    @Override
    public OrderAck placeOrder(ExchangeOrder order) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("symbol", order.symbol());
        params.put("side", order.side().name());
        params.put("type", order.type().name());
        params.put("quantity", plain(order.quantity()));
        params.put("newClientOrderId", order.clientOrderId());
        if (order.type() == OrderType.LIMIT && order.price() != null) {
            params.put("price", plain(order.price()));
            params.put("timeInForce", "GTC");
        }
        if (order.takeProfitPrice() != null) {
            params.put("stopPrice", plain(order.takeProfitPrice()));
        }
        if (order.stopLossPrice() != null) {
            params.put("stopLossPrice", plain(order.stopLossPrice()));
            params.put("closePosition", "false");
        }
        if (order.metadata() != null) {
            order.metadata().forEach((key, value) -> {
                if (PASSTHROUGH_PARAMS.contains(key) && value != null) {
                    params.putIfAbsent(key, String.valueOf(value));
                }
            });
        }
        JsonNode root = parse(httpClient.signedPost(ORDER_PATH, params));
        return new OrderAck(root.path("orderId").asText(null),
                root.path("clientOrderId").asText(order.clientOrderId()),
                root.path("status").asText("NEW"));
    }

    @Override
    public void cancelAllOrders(String symbol) {
        httpClient.signedDelete(CANCEL_ALL_PATH, Map.of("symbol", symbol));
    }

    @Override
    public List<AccountBalance> accountBalance() {
        JsonNode root = parse(httpClient.signedGet(BALANCE_PATH, Map.of()));
        List<AccountBalance> balances = new ArrayList<>();
        for (JsonNode node : root) {
            balances.add(new AccountBalance(
                    node.path("asset").asText(),
                    number(node, "balance"),
                    number(node, "availableBalance"),
                    number(node, "crossUnPnl")));
        }
        return balances;
    }

    @Override
    public List<PositionRisk> positionRisk() {
        JsonNode root = parse(httpClient.signedGet(POSITION_RISK_PATH, Map.of()));
        List<PositionRisk> positions = new ArrayList<>();
        for (JsonNode node : root) {
            String symbol = node.path("symbol").asText(null);
            if (symbol == null || symbol.isBlank()) {
                continue;
            }
            positions.add(new PositionRisk(
                    symbol,
                    number(node, "positionAmt"),
                    number(node, "entryPrice"),
                    number(node, "markPrice"),
                    number(node, "unRealizedProfit"),
                    node.path("leverage").asDouble(1.0)));
        }
        return positions;
    }

    private JsonNode parse(String body) {
        if (body == null || body.isBlank()) {
            throw new ExchangeApiException("Empty exchange response");
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ExchangeApiException("Unparseable exchange response", e);
        }
    }

    // Exchange sends numbers as strings
    private double number(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isNumber()) {
            return value.asDouble();
        }
        String text = value.asText("");
        if (text.isBlank()) {
            return 0.0;
        }
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            log.warn("Non-numeric {} in exchange response: {}", field, text);
            return 0.0;
        }
    }

    private String plain(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}

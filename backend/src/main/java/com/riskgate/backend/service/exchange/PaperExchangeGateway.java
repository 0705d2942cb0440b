package com.riskgate.backend.service.exchange;

import com.riskgate.backend.config.ExchangeProperties;
import com.riskgate.backend.exception.ExchangeApiException;
import com.riskgate.backend.model.AccountBalance;
import com.riskgate.backend.model.ExchangeOrder;
import com.riskgate.backend.model.OrderAck;
import com.riskgate.backend.model.OrderSide;
import com.riskgate.backend.model.OrderType;
import com.riskgate.backend.model.PositionRisk;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory simulated futures account. Market orders fill immediately at their
 * reference price; limit orders rest until cancelled.
 */
@Slf4j
public class PaperExchangeGateway implements ExchangeGateway {

    private final ExchangeProperties.Paper config;
    private final AtomicLong orderSequence = new AtomicLong();

    private final Object lock = new Object();
    private final Map<String, PaperPosition> positions = new LinkedHashMap<>();
    private final Map<String, Double> markPrices = new LinkedHashMap<>();
    private final Map<String, List<ExchangeOrder>> restingOrders = new LinkedHashMap<>();
    private double walletBalance;

    public PaperExchangeGateway(ExchangeProperties properties) {
        this.config = properties.getPaper();
        this.walletBalance = config.getInitialBalance();
    }

    @Override
    public OrderAck placeOrder(ExchangeOrder order) {
        double price = order.price() != null && order.price() > 0
                ? order.price()
                : order.quantity() > 0 ? order.notional() / order.quantity() : 0.0;
        if (!(price > 0) || !(order.quantity() > 0)) {
            throw new ExchangeApiException("Paper order for " + order.symbol() + " has no usable price or quantity");
        }
        String exchangeOrderId = "paper-" + orderSequence.incrementAndGet();
        synchronized (lock) {
            if (order.type() == OrderType.LIMIT) {
                restingOrders.computeIfAbsent(order.symbol(), key -> new ArrayList<>()).add(order);
                return new OrderAck(exchangeOrderId, order.clientOrderId(), "NEW");
            }
            markPrices.put(order.symbol(), price);
            double signedQty = order.side() == OrderSide.BUY ? order.quantity() : -order.quantity();
            positions.computeIfAbsent(order.symbol(), key -> new PaperPosition()).apply(signedQty, price, order.leverage());
        }
        log.info("Paper fill {} {} {} @ {}", order.side(), order.quantity(), order.symbol(), price);
        return new OrderAck(exchangeOrderId, order.clientOrderId(), "FILLED");
    }

    @Override
    public void cancelAllOrders(String symbol) {
        List<ExchangeOrder> cancelled;
        synchronized (lock) {
            cancelled = restingOrders.remove(symbol);
        }
        log.info("Paper cancel-all {}: {} resting orders", symbol, cancelled == null ? 0 : cancelled.size());
    }

    @Override
    public List<AccountBalance> accountBalance() {
        synchronized (lock) {
            double unrealized = unrealizedLocked();
            return List.of(new AccountBalance(config.getAsset(), walletBalance, walletBalance + unrealized, unrealized));
        }
    }

    @Override
    public List<PositionRisk> positionRisk() {
        synchronized (lock) {
            List<PositionRisk> result = new ArrayList<>();
            positions.forEach((symbol, position) -> {
                double mark = markPrices.getOrDefault(symbol, position.entryPrice);
                result.add(new PositionRisk(symbol, position.amount, position.entryPrice, mark,
                        (mark - position.entryPrice) * position.amount, position.leverage));
            });
            return result;
        }
    }

    public void updateMarkPrice(String symbol, double price) {
        synchronized (lock) {
            markPrices.put(symbol, price);
        }
    }

    public int restingOrderCount(String symbol) {
        synchronized (lock) {
            List<ExchangeOrder> orders = restingOrders.get(symbol);
            return orders == null ? 0 : orders.size();
        }
    }

    private double unrealizedLocked() {
        return positions.entrySet().stream()
                .mapToDouble(entry -> {
                    PaperPosition position = entry.getValue();
                    double mark = markPrices.getOrDefault(entry.getKey(), position.entryPrice);
                    return (mark - position.entryPrice) * position.amount;
                })
                .sum();
    }

    private final class PaperPosition {
        private double amount;
        private double entryPrice;
        private double leverage = 1.0;

        void apply(double signedQty, double price, double orderLeverage) {
            double newAmount = amount + signedQty;
            if (amount == 0 || Math.signum(amount) == Math.signum(signedQty)) {
                entryPrice = (entryPrice * Math.abs(amount) + price * Math.abs(signedQty)) / Math.abs(newAmount);
            } else {
                double closed = Math.min(Math.abs(amount), Math.abs(signedQty));
                walletBalance += (price - entryPrice) * closed * Math.signum(amount);
                if (Math.signum(newAmount) != Math.signum(amount) && newAmount != 0) {
                    entryPrice = price;
                }
            }
            amount = newAmount;
            leverage = orderLeverage > 0 ? orderLeverage : leverage;
            if (amount == 0) {
                entryPrice = 0.0;
            }
        }
    }
}

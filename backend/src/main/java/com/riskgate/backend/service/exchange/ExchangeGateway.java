package com.riskgate.backend.service.exchange;

import com.riskgate.backend.model.AccountBalance;
import com.riskgate.backend.model.ExchangeOrder;
import com.riskgate.backend.model.OrderAck;
import com.riskgate.backend.model.PositionRisk;

import java.util.List;

/**
 * The only path to an exchange. Failures surface as
 * {@link com.riskgate.backend.exception.ExchangeApiException}; retries are the
 * implementation's concern.
 */
public interface ExchangeGateway {

    OrderAck placeOrder(ExchangeOrder order);

    void cancelAllOrders(String symbol);

    List<AccountBalance> accountBalance();

    List<PositionRisk> positionRisk();
}

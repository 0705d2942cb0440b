package com.riskgate.backend.service.risk;

import com.riskgate.backend.model.OrderIntent;
import com.riskgate.backend.model.PortfolioSnapshot;
import com.riskgate.backend.model.RiskCheckResult;

/**
 * Stateless evaluation of one order intent against a portfolio snapshot.
 * Implementations must not mutate either argument and must short-circuit on the
 * first failed check.
 */
public interface RiskEngine {

    RiskCheckResult evaluate(PortfolioSnapshot snapshot, OrderIntent intent, double agentAllocationUsd);
}

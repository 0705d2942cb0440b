package com.riskgate.backend.service.risk;

import com.riskgate.backend.config.RiskProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Capital sub-allocation per agent: explicit override, else the configured default,
 * else an equal split of the current balance.
 */
@Component
@RequiredArgsConstructor
public class AgentAllocationPolicy {

    private final RiskProperties riskProperties;

    public double allocationFor(String agentId, double balance) {
        RiskProperties.Allocation allocation = riskProperties.getAllocation();
        Double override = agentId != null ? allocation.getOverrides().get(agentId) : null;
        if (override != null && override >= 0) {
            return override;
        }
        if (allocation.getDefaultAllocationUsd() > 0) {
            return allocation.getDefaultAllocationUsd();
        }
        return Math.max(0.0, balance) / allocation.getEqualSplitAgents();
    }
}

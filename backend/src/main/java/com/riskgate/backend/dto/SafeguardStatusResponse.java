package com.riskgate.backend.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.riskgate.backend.model.BreakerSnapshot;
import com.riskgate.backend.model.HeatMetrics;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SafeguardStatusResponse {

    @JsonProperty("trading_allowed")
    private boolean tradingAllowed;

    @JsonProperty("blocked_reason")
    private String blockedReason;

    @JsonProperty("kill_switch_active")
    private boolean killSwitchActive;

    @JsonProperty("kill_switch_reason")
    private String killSwitchReason;

    @JsonProperty("orders_last_minute")
    private int ordersLastMinute;

    @JsonProperty("daily_pnl")
    private double dailyPnl;

    @JsonProperty("loss_guard_halted")
    private boolean lossGuardHalted;

    @JsonProperty("loss_guard_reason")
    private String lossGuardReason;

    private HeatMetrics heat;

    private List<BreakerSnapshot> breakers;
}

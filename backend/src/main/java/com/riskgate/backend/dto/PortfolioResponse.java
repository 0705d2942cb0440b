package com.riskgate.backend.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.riskgate.backend.model.PortfolioSnapshot;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PortfolioResponse {

    private double balance;

    private double equity;

    @JsonProperty("total_exposure")
    private double totalExposure;

    private Map<String, Double> positions;

    @JsonProperty("unrealized_pnl")
    private double unrealizedPnl;

    @JsonProperty("peak_balance")
    private double peakBalance;

    private Instant timestamp;

    public static PortfolioResponse from(PortfolioSnapshot snapshot) {
        return PortfolioResponse.builder()
                .balance(snapshot.balance())
                .equity(snapshot.equity())
                .totalExposure(snapshot.totalExposure())
                .positions(snapshot.positions())
                .unrealizedPnl(snapshot.unrealizedPnl())
                .peakBalance(snapshot.peakBalance())
                .timestamp(snapshot.timestamp())
                .build();
    }
}

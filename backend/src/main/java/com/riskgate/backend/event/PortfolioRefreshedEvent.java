package com.riskgate.backend.event;

import com.riskgate.backend.model.PortfolioSnapshot;

public record PortfolioRefreshedEvent(PortfolioSnapshot snapshot) {
}

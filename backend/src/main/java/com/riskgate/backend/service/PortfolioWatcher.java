package com.riskgate.backend.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "portfolio", name = "watcher-enabled", havingValue = "true", matchIfMissing = true)
public class PortfolioWatcher {

    private final PortfolioStateStore portfolioStateStore;

    @Scheduled(fixedDelayString = "${portfolio.refresh-interval-ms:180000}", initialDelay = 0)
    public void refresh() {
        try {
            portfolioStateStore.refresh();
        } catch (RuntimeException e) {
            log.warn("Scheduled portfolio refresh failed, retrying next tick: {}", e.getMessage());
        }
    }
}

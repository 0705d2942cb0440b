package com.riskgate.backend.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.riskgate.backend.config.TpslProperties;
import com.riskgate.backend.model.AdaptiveTpsl;
import com.riskgate.backend.model.MarketAnalysis;
import com.riskgate.backend.model.MarketTrend;
import com.riskgate.backend.model.OrderSide;
import com.riskgate.backend.model.SymbolStats;
import com.riskgate.backend.model.TrailingStopUpdate;
import com.riskgate.backend.util.RiskMath;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Exit planning from volatility, agent history, confidence and regime. Stateless
 * apart from a per-symbol ATR cache.
 */
@Service
@Slf4j
public class AdaptiveTpslCalculator {

    static final double BASE_TP_PCT = 0.025;
    static final double BASE_SL_PCT = 0.015;
    static final double MIN_TP_PCT = 0.015;
    static final double MAX_TP_PCT = 0.08;
    static final double MIN_SL_PCT = 0.008;
    static final double MAX_SL_PCT = 0.04;
    static final double MIN_REWARD_TO_RISK = 1.5;
    public static final double TRAILING_ACTIVATION_DEFAULT = 0.02;
    public static final double TRAILING_DISTANCE_DEFAULT = 0.012;

    private final PerformanceTracker performanceTracker;
    private final TpslProperties properties;
    private final Cache<String, Double> atrCache;

    public AdaptiveTpslCalculator(PerformanceTracker performanceTracker, TpslProperties properties, Clock clock) {
        this.performanceTracker = performanceTracker;
        this.properties = properties;
        this.atrCache = Caffeine.newBuilder()
                .expireAfterWrite(properties.getAtrCacheTtl().toMillis(), TimeUnit.MILLISECONDS)
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .maximumSize(1_000)
                .build();
    }

    public AdaptiveTpsl calculate(String symbol, OrderSide side, double entryPrice, String agentId,
                                  double confidence, MarketAnalysis marketAnalysis) {
        if (!(entryPrice > 0)) {
            throw new IllegalArgumentException("entry price must be positive");
        }
        MarketAnalysis analysis = marketAnalysis != null ? marketAnalysis : MarketAnalysis.none();
        List<String> reasons = new ArrayList<>();
        double tpPct = BASE_TP_PCT;
        double slPct = BASE_SL_PCT;

        double atrMultiplier = 1.0;
        Optional<Double> atr = resolveAtr(symbol, analysis);
        if (atr.isPresent()) {
            double atrPct = atr.get() / entryPrice;
            if (atrPct > 0.02) {
                atrMultiplier = 1.5;
                reasons.add(String.format(Locale.ROOT, "High vol (ATR %.2f%%)", atrPct * 100));
            } else if (atrPct > 0.01) {
                atrMultiplier = 1.0 + (atrPct - 0.01) * 25;
                reasons.add(String.format(Locale.ROOT, "Normal vol (ATR %.2f%%)", atrPct * 100));
            } else {
                atrMultiplier = 0.8;
                reasons.add(String.format(Locale.ROOT, "Low vol (ATR %.2f%%)", atrPct * 100));
            }
        }
        tpPct *= atrMultiplier;
        slPct *= atrMultiplier;

        double winRate = 0.5;
        if (agentId != null) {
            SymbolStats stats = performanceTracker.getSymbolStats(agentId, symbol);
            winRate = performanceTracker.getSymbolWinRate(agentId, symbol);
            if (stats.totalTrades() >= properties.getMinTradesForWinRate()) {
                if (winRate > 0.65) {
                    tpPct *= 0.85;
                    slPct *= 1.1;
                    reasons.add(String.format(Locale.ROOT, "High WR (%.0f%%): tighter TP", winRate * 100));
                } else if (winRate < 0.45) {
                    tpPct *= 1.2;
                    slPct *= 0.85;
                    reasons.add(String.format(Locale.ROOT, "Low WR (%.0f%%): wider TP, tight SL", winRate * 100));
                } else {
                    reasons.add(String.format(Locale.ROOT, "WR %.0f%% (balanced)", winRate * 100));
                }
            } else {
                reasons.add("History: " + stats.totalTrades() + " trades (learning)");
                winRate = 0.5;
            }
        }

        if (confidence >= 0.85) {
            tpPct *= 1.15;
            reasons.add(String.format(Locale.ROOT, "High conf (%.0f%%): aggressive TP", confidence * 100));
        } else if (confidence < 0.65) {
            tpPct *= 0.9;
            slPct *= 0.9;
            reasons.add(String.format(Locale.ROOT, "Low conf (%.0f%%): conservative", confidence * 100));
        }

        MarketTrend trend = analysis.trend() != null ? analysis.trend() : MarketTrend.NEUTRAL;
        if ((side == OrderSide.BUY && trend == MarketTrend.BULLISH) || (side == OrderSide.SELL && trend == MarketTrend.BEARISH)) {
            tpPct *= 1.1;
            reasons.add("Trend aligned");
        } else if ((side == OrderSide.BUY && trend == MarketTrend.BEARISH) || (side == OrderSide.SELL && trend == MarketTrend.BULLISH)) {
            slPct *= 0.85;
            reasons.add("Counter-trend");
        }
        if (analysis.rsi() != null) {
            double rsi = analysis.rsi();
            if ((side == OrderSide.BUY && rsi < 30) || (side == OrderSide.SELL && rsi > 70)) {
                tpPct *= 1.2;
                reasons.add(String.format(Locale.ROOT, "RSI extreme (%.0f)", rsi));
            }
        }

        tpPct = RiskMath.clamp(tpPct, MIN_TP_PCT, MAX_TP_PCT);
        slPct = RiskMath.clamp(slPct, MIN_SL_PCT, MAX_SL_PCT);
        if (tpPct / slPct < MIN_REWARD_TO_RISK) {
            slPct = tpPct / MIN_REWARD_TO_RISK;
            while (tpPct / slPct < MIN_REWARD_TO_RISK) {
                slPct = Math.nextDown(slPct);
            }
            reasons.add("R:R enforced (>=1.5)");
        }

        double tpPrice = side == OrderSide.BUY ? entryPrice * (1 + tpPct) : entryPrice * (1 - tpPct);
        double slPrice = side == OrderSide.BUY ? entryPrice * (1 - slPct) : entryPrice * (1 + slPct);

        double trailingActivation = TRAILING_ACTIVATION_DEFAULT;
        double trailingDistance = TRAILING_DISTANCE_DEFAULT;
        if (atrMultiplier > 1.2) {
            trailingActivation *= 1.3;
            trailingDistance *= 1.3;
        }
        if (winRate > 0.6) {
            trailingDistance *= 0.85;
        }

        String reasoning = String.format(Locale.ROOT, "TP: %.1f%% | SL: %.1f%% | R:R: %.1f. ",
                tpPct * 100, slPct * 100, tpPct / slPct)
                + (reasons.isEmpty() ? "Default settings" : String.join(" | ", reasons));
        log.info("Adaptive TP/SL for {} {}: {}", symbol, side, reasoning);
        return new AdaptiveTpsl(tpPct, slPct, tpPrice, slPrice, trailingActivation, trailingDistance, reasoning);
    }

    /**
     * Candidate stop once profit passes {@code activation}. For shorts
     * {@code highWaterMark} is the lowest price seen. Only returns a stop that is
     * strictly tighter than the current one.
     */
    public Optional<TrailingStopUpdate> adjustForTrailing(double pnlPct, double currentSlPct, double entryPrice,
                                                          double highWaterMark, OrderSide side,
                                                          double activation, double distance) {
        if (pnlPct < activation) {
            return Optional.empty();
        }
        if (side == OrderSide.BUY) {
            double newStop = highWaterMark * (1 - distance);
            double currentStop = entryPrice * (1 - currentSlPct);
            if (newStop > currentStop) {
                double locked = (newStop - entryPrice) / entryPrice;
                return Optional.of(new TrailingStopUpdate(newStop, locked,
                        String.format(Locale.ROOT, "Trailing: locked %.1f%% profit", locked * 100)));
            }
        } else {
            double newStop = highWaterMark * (1 + distance);
            double currentStop = entryPrice * (1 + currentSlPct);
            if (newStop < currentStop) {
                double locked = (entryPrice - newStop) / entryPrice;
                return Optional.of(new TrailingStopUpdate(newStop, locked,
                        String.format(Locale.ROOT, "Trailing: locked %.1f%% profit", locked * 100)));
            }
        }
        return Optional.empty();
    }

    private Optional<Double> resolveAtr(String symbol, MarketAnalysis analysis) {
        if (analysis.atr() != null && analysis.atr() > 0) {
            atrCache.put(symbol, analysis.atr());
            return Optional.of(analysis.atr());
        }
        return Optional.ofNullable(atrCache.getIfPresent(symbol));
    }
}

package com.riskgate.backend.model;

public record TrailingStopUpdate(double stopPrice, double lockedInPct, String reason) {}

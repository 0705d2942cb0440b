package com.riskgate.backend.model;

public record AccountBalance(String asset, double walletBalance, double availableBalance, double unrealizedPnl) {}

package com.riskgate.backend.model;

public record OrderAck(String exchangeOrderId, String clientOrderId, String status) {}

package com.riskgate.backend.model;

import java.time.Instant;

public record Vote(String agentId, boolean approved, double confidence, Instant castAt) {}

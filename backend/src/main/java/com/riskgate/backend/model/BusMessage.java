package com.riskgate.backend.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record BusMessage(
        @JsonProperty("session_id") String sessionId,
        @JsonProperty("sender_id") String senderId,
        @JsonProperty("sender_role") SenderRole senderRole,
        @JsonProperty("message_type") BusMessageType messageType,
        @JsonProperty("payload") Map<String, Object> payload,
        @JsonProperty("timestamp") Instant timestamp,
        @JsonProperty("schema_version") String schemaVersion
) {

    public static final String SCHEMA_VERSION = "1.0.0";

    public BusMessage {
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        schemaVersion = schemaVersion == null ? SCHEMA_VERSION : schemaVersion;
    }

    public static BusMessage of(String sessionId, String senderId, SenderRole role, BusMessageType type,
                                Map<String, Object> payload, Instant timestamp) {
        return new BusMessage(sessionId, senderId, role, type, payload, timestamp, SCHEMA_VERSION);
    }

    public BusMessage inSession(String targetSession, Instant receivedAt) {
        return new BusMessage(targetSession, senderId, senderRole == null ? SenderRole.AGENT : senderRole,
                messageType, payload, timestamp == null ? receivedAt : timestamp, schemaVersion);
    }
}

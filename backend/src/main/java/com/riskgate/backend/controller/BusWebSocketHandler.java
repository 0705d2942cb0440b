package com.riskgate.backend.controller;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.riskgate.backend.model.BusMessage;
import com.riskgate.backend.service.bus.MessageBus;
import com.riskgate.backend.service.bus.WebSocketBusConnection;
import com.riskgate.backend.service.consensus.ConsensusCoordinator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.net.URI;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Raw WebSocket transport for the agent bus, mounted at {@code /mcp/ws/{sessionId}}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class BusWebSocketHandler extends TextWebSocketHandler {

    public static final String PATH_PREFIX = "/mcp/ws/";

    private final MessageBus messageBus;
    private final ConsensusCoordinator consensusCoordinator;
    private final ObjectMapper objectMapper;

    private final Map<String, WebSocketBusConnection> connections = new ConcurrentHashMap<>();

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        String busSession = busSessionId(session);
        WebSocketBusConnection connection = new WebSocketBusConnection(session, objectMapper);
        if (!messageBus.register(busSession, connection)) {
            session.close(CloseStatus.SERVER_ERROR);
            return;
        }
        connections.put(session.getId(), connection);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage text) throws Exception {
        String busSession = busSessionId(session);
        BusMessage message;
        try {
            message = objectMapper.readValue(text.getPayload(), BusMessage.class);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable bus message on {}: {}", session.getId(), e.getOriginalMessage());
            return;
        }
        try {
            consensusCoordinator.onMessage(busSession, message);
        } catch (IllegalArgumentException e) {
            log.warn("Rejected bus message on {}: {}", session.getId(), e.getMessage());
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) throws Exception {
        WebSocketBusConnection connection = connections.remove(session.getId());
        if (connection != null) {
            messageBus.unregister(busSessionId(session), connection);
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) throws Exception {
        log.warn("Bus socket {} transport error: {}", session.getId(), exception.getMessage());
        afterConnectionClosed(session, CloseStatus.SERVER_ERROR);
    }

    static String busSessionId(WebSocketSession session) {
        URI uri = session.getUri();
        if (uri == null) {
            throw new IllegalStateException("WebSocket session without URI");
        }
        String path = uri.getPath();
        int index = path.indexOf(PATH_PREFIX);
        String id = index >= 0 ? path.substring(index + PATH_PREFIX.length()) : "";
        if (id.isBlank() || id.contains("/")) {
            throw new IllegalStateException("Bus session id missing in " + path);
        }
        return id;
    }
}

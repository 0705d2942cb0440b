package com.riskgate.backend.service.bus;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.riskgate.backend.model.BusMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;
import java.util.Objects;

/**
 * Bus participant behind a raw WebSocket. Sends are serialized by the decorator.
 */
public class WebSocketBusConnection implements BusConnection {

    private static final int SEND_TIME_LIMIT_MS = 5_000;
    private static final int BUFFER_SIZE_LIMIT = 512 * 1024;

    private final WebSocketSession session;
    private final ObjectMapper objectMapper;

    public WebSocketBusConnection(WebSocketSession session, ObjectMapper objectMapper) {
        this.session = new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT);
        this.objectMapper = objectMapper;
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public void send(BusMessage message) throws IOException {
        if (!session.isOpen()) {
            throw new IOException("socket " + session.getId() + " is closed");
        }
        session.sendMessage(new TextMessage(objectMapper.writeValueAsString(message)));
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof WebSocketBusConnection that && Objects.equals(id(), that.id());
    }

    @Override
    public int hashCode() {
        return Objects.hash(id());
    }
}

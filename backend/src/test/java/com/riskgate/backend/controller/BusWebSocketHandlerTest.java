package com.riskgate.backend.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.riskgate.backend.config.BusProperties;
import com.riskgate.backend.model.BusMessage;
import com.riskgate.backend.model.BusMessageType;
import com.riskgate.backend.model.SenderRole;
import com.riskgate.backend.service.bus.MessageBus;
import com.riskgate.backend.service.consensus.ConsensusCoordinator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.net.URI;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class BusWebSocketHandlerTest {

    private final ConsensusCoordinator coordinator = mock(ConsensusCoordinator.class);
    private final ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
    private MessageBus messageBus;
    private BusWebSocketHandler handler;

    @BeforeEach
    void setUp() {
        messageBus = new MessageBus(new BusProperties());
        handler = new BusWebSocketHandler(messageBus, coordinator, objectMapper);
    }

    private static WebSocketSession socket(String id, String path) {
        WebSocketSession session = mock(WebSocketSession.class);
        when(session.getId()).thenReturn(id);
        when(session.getUri()).thenReturn(URI.create("ws://localhost:8080" + path));
        when(session.isOpen()).thenReturn(true);
        return session;
    }

    @Test
    void sessionIdComesFromPath() {
        assertThat(BusWebSocketHandler.busSessionId(socket("s", "/mcp/ws/desk"))).isEqualTo("desk");
        assertThatThrownBy(() -> BusWebSocketHandler.busSessionId(socket("s", "/mcp/ws/")))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void joiningReplaysHistoryAndLeavingCollectsSession() throws Exception {
        messageBus.openSession("desk");
        messageBus.broadcast("desk", BusMessage.of("desk", "scout", SenderRole.AGENT, BusMessageType.OBSERVATION,
                Map.of("symbol", "BTCUSDT"), Instant.parse("2024-01-01T00:00:00Z")));
        WebSocketSession session = socket("ws-1", "/mcp/ws/desk");

        handler.afterConnectionEstablished(session);

        ArgumentCaptor<TextMessage> sent = ArgumentCaptor.forClass(TextMessage.class);
        verify(session).sendMessage(sent.capture());
        assertThat(sent.getValue().getPayload()).contains("\"message_type\":\"observation\"");
        assertThat(messageBus.connectionCount("desk")).isEqualTo(1);

        handler.afterConnectionClosed(session, CloseStatus.NORMAL);

        assertThat(messageBus.hasSession("desk")).isFalse();
    }

    @Test
    void inboundTextIsHandedToCoordinator() throws Exception {
        WebSocketSession session = socket("ws-2", "/mcp/ws/desk");

        handler.handleTextMessage(session, new TextMessage(
                "{\"sender_id\":\"alpha\",\"message_type\":\"vote\",\"payload\":{\"proposal_id\":\"p-1\",\"approved\":true}}"));

        ArgumentCaptor<BusMessage> message = ArgumentCaptor.forClass(BusMessage.class);
        verify(coordinator).onMessage(eq("desk"), message.capture());
        assertThat(message.getValue().messageType()).isEqualTo(BusMessageType.VOTE);
        assertThat(message.getValue().payload()).containsEntry("proposal_id", "p-1");
    }

    @Test
    void unreadableTextIsDropped() throws Exception {
        handler.handleTextMessage(socket("ws-3", "/mcp/ws/desk"), new TextMessage("not json"));

        verify(coordinator, never()).onMessage(any(), any());
    }
}

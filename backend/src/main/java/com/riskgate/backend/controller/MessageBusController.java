package com.riskgate.backend.controller;

import com.riskgate.backend.dto.StatusResponse;
import com.riskgate.backend.exception.NotFoundException;
import com.riskgate.backend.model.BusMessage;
import com.riskgate.backend.service.bus.MessageBus;
import com.riskgate.backend.service.consensus.ConsensusCoordinator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/mcp/sessions")
@RequiredArgsConstructor
@Tag(name = "Agent bus")
public class MessageBusController {

    private final MessageBus messageBus;
    private final ConsensusCoordinator consensusCoordinator;

    @GetMapping
    @Operation(summary = "List open bus sessions")
    public ResponseEntity<Map<String, List<String>>> sessions() {
        return ResponseEntity.ok(Map.of("sessions", messageBus.listSessions()));
    }

    @PostMapping
    @Operation(summary = "Open a new bus session")
    public ResponseEntity<Map<String, String>> create() {
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("session_id", messageBus.createSession()));
    }

    @PostMapping("/{sessionId}/messages")
    @Operation(summary = "Publish a message to a session")
    public ResponseEntity<StatusResponse> publish(@PathVariable String sessionId, @RequestBody BusMessage message) {
        if (!messageBus.hasSession(sessionId)) {
            throw new NotFoundException("Bus session not found: " + sessionId);
        }
        consensusCoordinator.onMessage(sessionId, message);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(StatusResponse.of("accepted"));
    }

    @GetMapping("/{sessionId}/messages")
    @Operation(summary = "Buffered history of a session")
    public ResponseEntity<List<BusMessage>> history(@PathVariable String sessionId) {
        return ResponseEntity.ok(messageBus.history(sessionId));
    }
}

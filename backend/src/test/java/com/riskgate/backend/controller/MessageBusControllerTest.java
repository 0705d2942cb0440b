package com.riskgate.backend.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.not;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class MessageBusControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    void publishedMessageLandsInSessionHistory() throws Exception {
        String body = mockMvc.perform(post("/mcp/sessions"))
                .andExpect(status().isCreated())
                .andReturn().getResponse().getContentAsString();
        JsonNode created = objectMapper.readTree(body);
        String sessionId = created.get("session_id").asText();

        mockMvc.perform(get("/mcp/sessions"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.sessions", hasItem(sessionId)));

        mockMvc.perform(post("/mcp/sessions/{id}/messages", sessionId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"sender_id": "scout", "message_type": "observation",
                                 "payload": {"symbol": "BTCUSDT", "funding": -0.01}}
                                """))
                .andExpect(status().isAccepted());

        mockMvc.perform(get("/mcp/sessions/{id}/messages", sessionId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].session_id").value(sessionId))
                .andExpect(jsonPath("$[0].sender_role").value("agent"))
                .andExpect(jsonPath("$[0].message_type").value("observation"))
                .andExpect(jsonPath("$[0].schema_version").value("1.0.0"));
    }

    @Test
    void publishingToUnknownSessionIsNotFound() throws Exception {
        mockMvc.perform(post("/mcp/sessions/{id}/messages", "no-such-session")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sender_id\":\"scout\",\"message_type\":\"observation\"}"))
                .andExpect(status().isNotFound());

        mockMvc.perform(get("/mcp/sessions"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.sessions", not(hasItem("no-such-session"))));
    }

    @Test
    void unknownMessageTypeIsRejected() throws Exception {
        mockMvc.perform(post("/mcp/sessions/{id}/messages", "default")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sender_id\":\"scout\",\"message_type\":\"gossip\"}"))
                .andExpect(status().isBadRequest());
    }
}

package com.riskgate.backend.controller;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class OrderControllerTest {

    @Autowired
    private MockMvc mockMvc;

    private static String order(double notional) {
        return """
                {
                  "symbol": "btcusdt",
                  "side": "BUY",
                  "notional": %s,
                  "client_metadata": {"entry_price": 50000}
                }
                """.formatted(notional);
    }

    @Test
    void orderIsSubmittedThenDeduplicated() throws Exception {
        mockMvc.perform(post("/order/momentum")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(order(100)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("submitted"))
                .andExpect(jsonPath("$.order_id", startsWith("momentum:BTCUSDT:")))
                .andExpect(jsonPath("$.adjusted_size").value(100.0));

        mockMvc.perform(post("/order/momentum")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(order(100)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("duplicate"));
    }

    @Test
    void oversizedOrderIsRejectedWithCode() throws Exception {
        mockMvc.perform(post("/order/swing")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(order(600)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value("rejected"))
                .andExpect(jsonPath("$.code").value("risk_check_failed"));
    }

    @Test
    void missingSideFailsValidation() throws Exception {
        mockMvc.perform(post("/order/momentum")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"symbol\":\"BTCUSDT\",\"notional\":100}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Validation failed"))
                .andExpect(jsonPath("$.details[0].field").value("side"));
    }

    @Test
    void portfolioIsServed() throws Exception {
        mockMvc.perform(get("/portfolio"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.balance").isNumber())
                .andExpect(jsonPath("$.total_exposure").isNumber());
    }

    @Test
    void decisionIsAccepted() throws Exception {
        mockMvc.perform(post("/register_decision")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"bot_id": "momentum", "symbol": "BTCUSDT", "decision": "hold", "confidence": 0.4}
                                """))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("accepted"));
    }

    @Test
    void tradeResultUpdatesStats() throws Exception {
        mockMvc.perform(post("/trade_result")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"agent_id\":\"scalper\",\"symbol\":\"solusdt\",\"pnl\":12.5}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.trading_halted").value(false))
                .andExpect(jsonPath("$.symbol_stats.wins").value(1))
                .andExpect(jsonPath("$.symbol_stats.total_pnl").value(12.5));
    }
}

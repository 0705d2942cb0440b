package com.riskgate.backend.service.consensus;

import com.riskgate.backend.config.BusProperties;
import com.riskgate.backend.config.ConsensusProperties;
import com.riskgate.backend.event.ConsensusResolvedEvent;
import com.riskgate.backend.event.PortfolioRefreshedEvent;
import com.riskgate.backend.exception.NotFoundException;
import com.riskgate.backend.model.BusMessage;
import com.riskgate.backend.model.BusMessageType;
import com.riskgate.backend.model.ConsensusResult;
import com.riskgate.backend.model.OrderIntent;
import com.riskgate.backend.model.OrderSide;
import com.riskgate.backend.model.OrderSubmissionResult;
import com.riskgate.backend.model.OrderType;
import com.riskgate.backend.model.PortfolioSnapshot;
import com.riskgate.backend.model.ProposalPayload;
import com.riskgate.backend.model.ProposalStatus;
import com.riskgate.backend.model.SenderRole;
import com.riskgate.backend.service.RiskOrchestrator;
import com.riskgate.backend.service.bus.MessageBus;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Glues the message bus to the consensus engine and the orchestrator: proposals and
 * votes arrive as bus messages, resolutions go back out as CONSENSUS messages and
 * approved proposals are submitted as orders on behalf of their proposer.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ConsensusCoordinator {

    private static final String[] INTENT_HINTS = {"price", "entry_price", "stop_loss", "take_profit", "leverage", "atr_pct"};

    private final MessageBus messageBus;
    private final ConsensusEngine consensusEngine;
    private final RiskOrchestrator riskOrchestrator;
    private final BusProperties busProperties;
    private final ConsensusProperties consensusProperties;
    private final Clock clock;

    private final Map<String, String> proposalSessions = new ConcurrentHashMap<>();

    @PostConstruct
    void openDefaultSession() {
        messageBus.pinSession(busProperties.getDefaultSession());
    }

    /**
     * Entry point for messages published by agents, over WebSocket or HTTP. The message
     * is broadcast to the session first, then acted upon.
     */
    public void onMessage(String sessionId, BusMessage inbound) {
        BusMessage message = inbound.inSession(sessionId, clock.instant());
        if (message.messageType() == null) {
            throw new IllegalArgumentException("message_type is required");
        }
        messageBus.broadcast(sessionId, message);
        switch (message.messageType()) {
            case PROPOSAL -> handleProposal(sessionId, message);
            case VOTE -> handleVote(message);
            default -> log.debug("Bus {} message from {} relayed", message.messageType().value(), message.senderId());
        }
    }

    public ProposalStatus propose(String sessionId, String proposalId, String proposerId, ProposalPayload proposal) {
        String session = sessionId != null ? sessionId : busProperties.getDefaultSession();
        ProposalStatus status = consensusEngine.registerProposal(proposalId, proposal, proposerId);
        proposalSessions.put(status.proposalId(), session);
        return status;
    }

    @EventListener
    public void onConsensusResolved(ConsensusResolvedEvent event) {
        ConsensusResult result = event.result();
        String sessionId = proposalSessions.getOrDefault(result.proposalId(), busProperties.getDefaultSession());
        proposalSessions.remove(result.proposalId());

        Map<String, Object> consensus = new LinkedHashMap<>();
        consensus.put("proposal_id", result.proposalId());
        consensus.put("approved", result.approved());
        consensus.put("consensus_score", result.consensusScore());
        consensus.put("participants", result.participants());
        consensus.put("timed_out", result.timedOut());
        consensus.put("notes", result.notes());
        publish(sessionId, BusMessageType.CONSENSUS, consensus);

        if (result.approved() && consensusProperties.isAutoExecute()) {
            execute(sessionId, result);
        }
    }

    @EventListener
    public void onPortfolioRefreshed(PortfolioRefreshedEvent event) {
        PortfolioSnapshot snapshot = event.snapshot();
        Map<String, Object> observation = new LinkedHashMap<>();
        observation.put("kind", "portfolio");
        observation.put("balance", snapshot.balance());
        observation.put("total_exposure", snapshot.totalExposure());
        observation.put("unrealized_pnl", snapshot.unrealizedPnl());
        observation.put("positions", snapshot.positions());
        publish(busProperties.getDefaultSession(), BusMessageType.OBSERVATION, observation);
    }

    private void handleProposal(String sessionId, BusMessage message) {
        Map<String, Object> payload = message.payload();
        try {
            ProposalPayload proposal = new ProposalPayload(
                    string(payload, "symbol"),
                    OrderSide.from(string(payload, "side")),
                    number(payload, "notional", 0.0),
                    number(payload, "confidence", 0.5),
                    string(payload, "rationale"),
                    constraints(payload));
            propose(sessionId, string(payload, "proposal_id"), message.senderId(), proposal);
        } catch (IllegalArgumentException e) {
            log.warn("Invalid proposal from {} in session {}: {}", message.senderId(), sessionId, e.getMessage());
        }
    }

    private void handleVote(BusMessage message) {
        Map<String, Object> payload = message.payload();
        String proposalId = string(payload, "proposal_id");
        if (proposalId == null) {
            log.warn("Vote from {} without proposal_id ignored", message.senderId());
            return;
        }
        Boolean approved = approval(payload.get("approved"));
        if (approved == null) {
            log.warn("Vote from {} on {} without a valid approved flag ignored: {}", message.senderId(), proposalId,
                    payload.get("approved"));
            return;
        }
        try {
            consensusEngine.castVote(proposalId, message.senderId(), approved, number(payload, "confidence", 0.5));
        } catch (NotFoundException e) {
            log.warn("Vote from {} for unknown proposal {}", message.senderId(), proposalId);
        }
    }

    private void execute(String sessionId, ConsensusResult result) {
        ProposalPayload proposal = result.proposal();
        Map<String, Object> constraints = proposal.constraints();
        Map<String, Object> metadata = new LinkedHashMap<>(constraints);
        metadata.put("proposal_id", result.proposalId());
        metadata.put("consensus_score", result.consensusScore());
        metadata.put("participants", result.participants());
        if (proposal.rationale() != null) {
            metadata.put("rationale", proposal.rationale());
        }

        Map<String, Object> execution = new LinkedHashMap<>();
        execution.put("proposal_id", result.proposalId());
        try {
            OrderIntent intent = OrderIntent.builder()
                    .symbol(proposal.symbol())
                    .side(proposal.side())
                    .orderType(constraints.containsKey("price") ? OrderType.LIMIT : OrderType.MARKET)
                    .notional(proposal.notional())
                    .price(optionalNumber(constraints, "price"))
                    .stopLoss(optionalNumber(constraints, "stop_loss"))
                    .takeProfit(optionalNumber(constraints, "take_profit"))
                    .leverage(optionalNumber(constraints, "leverage"))
                    .expectedWinRate(number(constraints, "expected_win_rate", OrderIntent.DEFAULT_WIN_RATE))
                    .rewardToRisk(number(constraints, "reward_to_risk", OrderIntent.DEFAULT_REWARD_TO_RISK))
                    .clientMetadata(metadata)
                    .build();
            OrderSubmissionResult submission = riskOrchestrator.submitOrder(result.proposerId(), intent);
            execution.put("status", submission.status().value());
            execution.put("order_id", submission.orderId());
            if (submission.code() != null) {
                execution.put("code", submission.code().code());
                execution.put("reason", submission.reason());
            }
        } catch (RuntimeException e) {
            log.error("Execution of proposal {} failed", result.proposalId(), e);
            execution.put("status", "error");
            execution.put("reason", e.getMessage());
        }
        publish(sessionId, BusMessageType.EXECUTION, execution);
    }

    private void publish(String sessionId, BusMessageType type, Map<String, Object> payload) {
        messageBus.broadcast(sessionId, BusMessage.of(sessionId, busProperties.getCoordinatorId(),
                SenderRole.COORDINATOR, type, payload, clock.instant()));
    }

    private static Boolean approval(Object value) {
        if (value instanceof Boolean flag) {
            return flag;
        }
        if (value instanceof String text) {
            if ("true".equalsIgnoreCase(text.trim())) {
                return Boolean.TRUE;
            }
            if ("false".equalsIgnoreCase(text.trim())) {
                return Boolean.FALSE;
            }
        }
        return null;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> constraints(Map<String, Object> payload) {
        Map<String, Object> merged = new LinkedHashMap<>();
        Object nested = payload.get("constraints");
        if (nested instanceof Map<?, ?> map) {
            merged.putAll((Map<String, Object>) map);
        }
        for (String hint : INTENT_HINTS) {
            if (payload.containsKey(hint) && !merged.containsKey(hint)) {
                merged.put(hint, payload.get(hint));
            }
        }
        return merged;
    }

    private static String string(Map<String, Object> payload, String key) {
        Object value = payload.get(key);
        return value == null ? null : value.toString();
    }

    private static double number(Map<String, Object> payload, String key, double fallback) {
        Double value = optionalNumber(payload, key);
        return value != null ? value : fallback;
    }

    private static Double optionalNumber(Map<String, Object> payload, String key) {
        Object value = payload.get(key);
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return Double.parseDouble(text.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(key + " is not a number: " + text);
            }
        }
        return null;
    }
}

package com.riskgate.backend.service.consensus;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.riskgate.backend.config.ConsensusProperties;
import com.riskgate.backend.event.ConsensusResolvedEvent;
import com.riskgate.backend.exception.NotFoundException;
import com.riskgate.backend.model.ConsensusResult;
import com.riskgate.backend.model.ProposalPayload;
import com.riskgate.backend.model.ProposalStatus;
import com.riskgate.backend.model.Vote;
import com.riskgate.backend.service.MetricsService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Collects votes on multi-agent proposals and resolves each proposal exactly once,
 * either when the approval threshold is met or when its timeout has passed.
 * Resolutions are published as {@link ConsensusResolvedEvent}s after the engine
 * lock is released.
 */
@Service
@Slf4j
public class ConsensusEngine {

    private static final Duration RESULT_RETENTION = Duration.ofMinutes(10);

    private final ConsensusProperties properties;
    private final ApplicationEventPublisher eventPublisher;
    private final MetricsService metricsService;
    private final Clock clock;

    private final Object lock = new Object();
    private final Map<String, ProposalState> proposals = new HashMap<>();
    private final Cache<String, ProposalStatus> resolved;

    public ConsensusEngine(ConsensusProperties properties, ApplicationEventPublisher eventPublisher,
                           MetricsService metricsService, Clock clock) {
        this.properties = properties;
        this.eventPublisher = eventPublisher;
        this.metricsService = metricsService;
        this.clock = clock;
        this.resolved = Caffeine.newBuilder()
                .expireAfterWrite(RESULT_RETENTION.toMillis(), TimeUnit.MILLISECONDS)
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .maximumSize(10_000)
                .build();
    }

    public ProposalStatus registerProposal(String proposalId, ProposalPayload proposal, String proposerId) {
        if (proposal == null) {
            throw new IllegalArgumentException("proposal is required");
        }
        if (proposerId == null || proposerId.isBlank()) {
            throw new IllegalArgumentException("proposer id is required");
        }
        String id = proposalId == null || proposalId.isBlank() ? UUID.randomUUID().toString() : proposalId;
        Instant now = clock.instant();
        synchronized (lock) {
            if (proposals.containsKey(id) || resolved.getIfPresent(id) != null) {
                throw new IllegalArgumentException("Proposal " + id + " already registered");
            }
            ProposalState state = new ProposalState(id, proposerId, proposal, now,
                    properties.getMinVotes(), properties.getThreshold(), properties.getTimeout());
            proposals.put(id, state);
            log.info("🗳️ Proposal {} registered by {}: {} {} notional={}", id, proposerId,
                    proposal.side(), proposal.symbol(), proposal.notional());
            return status(state, now);
        }
    }

    /**
     * Records a vote and checks for resolution. The proposer's own vote and votes on
     * already-resolved proposals are ignored; a repeated vote replaces the earlier one.
     *
     * @return the resolution, when this vote resolved the proposal
     */
    public Optional<ConsensusResult> castVote(String proposalId, String agentId, boolean approved, double confidence) {
        if (agentId == null || agentId.isBlank()) {
            throw new IllegalArgumentException("agent id is required");
        }
        Instant now = clock.instant();
        ConsensusResult result;
        synchronized (lock) {
            ProposalState state = proposals.get(proposalId);
            if (state == null) {
                if (resolved.getIfPresent(proposalId) != null) {
                    log.debug("Late vote from {} on resolved proposal {}", agentId, proposalId);
                    return Optional.empty();
                }
                throw new NotFoundException("Proposal " + proposalId + " not found");
            }
            if (agentId.equals(state.proposerId())) {
                log.debug("Ignoring self-vote by {} on {}", agentId, proposalId);
                return Optional.empty();
            }
            state.putVote(new Vote(agentId, approved, confidence, now));
            result = checkResolution(state, now);
        }
        return publish(result);
    }

    /**
     * Status of an open or recently resolved proposal. An open proposal past its
     * timeout is resolved by this call.
     */
    public ProposalStatus getStatus(String proposalId) {
        Instant now = clock.instant();
        ConsensusResult result = null;
        ProposalStatus status;
        synchronized (lock) {
            ProposalState state = proposals.get(proposalId);
            if (state == null) {
                ProposalStatus done = resolved.getIfPresent(proposalId);
                if (done == null) {
                    throw new NotFoundException("Proposal " + proposalId + " not found");
                }
                return done;
            }
            if (state.isExpired(now)) {
                result = resolve(state, now, true);
                status = resolved.getIfPresent(proposalId);
            } else {
                status = status(state, now);
            }
        }
        publish(result);
        return status;
    }

    public int openProposalCount() {
        synchronized (lock) {
            return proposals.size();
        }
    }

    /**
     * Resolves every proposal whose timeout has passed without a deciding vote.
     */
    @Scheduled(fixedDelayString = "${consensus.sweep-interval-ms:5000}")
    public List<ConsensusResult> cleanupExpired() {
        Instant now = clock.instant();
        List<ConsensusResult> results = new ArrayList<>();
        synchronized (lock) {
            for (ProposalState state : new ArrayList<>(proposals.values())) {
                if (state.isExpired(now)) {
                    results.add(resolve(state, now, true));
                }
            }
        }
        if (!results.isEmpty()) {
            log.info("Consensus sweep resolved {} expired proposal(s)", results.size());
        }
        results.forEach(this::publish);
        return results;
    }

    private ConsensusResult checkResolution(ProposalState state, Instant now) {
        if (state.quorumApproved()) {
            return resolve(state, now, false);
        }
        if (state.isExpired(now)) {
            return resolve(state, now, true);
        }
        return null;
    }

    private ConsensusResult resolve(ProposalState state, Instant now, boolean timedOut) {
        boolean approved = state.quorumApproved();
        double score = state.approvalRate();
        String notes = timedOut
                ? String.format(Locale.ROOT, "Consensus %s after timeout (%d votes, %.1f%% approval)",
                        approved ? "reached" : "not reached", state.totalVotes(), score * 100)
                : String.format(Locale.ROOT, "Consensus reached with %d votes (%.1f%% approval)",
                        state.totalVotes(), score * 100);
        ConsensusResult result = new ConsensusResult(state.proposalId(), state.proposerId(), state.proposal(),
                approved, score, state.totalVotes(), state.participants(), timedOut, notes);
        proposals.remove(state.proposalId());
        resolved.put(state.proposalId(), new ProposalStatus(state.proposalId(), state.proposerId(), state.proposal(),
                state.totalVotes(), state.approvedVotes(), state.ageMillis(now), true, result));
        return result;
    }

    private Optional<ConsensusResult> publish(ConsensusResult result) {
        if (result == null) {
            return Optional.empty();
        }
        metricsService.recordConsensus(result.approved(), result.timedOut());
        if (result.approved()) {
            log.info("✅ Proposal {} approved: {}", result.proposalId(), result.notes());
        } else {
            log.warn("❌ Proposal {} rejected: {}", result.proposalId(), result.notes());
        }
        eventPublisher.publishEvent(new ConsensusResolvedEvent(result));
        return Optional.of(result);
    }

    private ProposalStatus status(ProposalState state, Instant now) {
        return new ProposalStatus(state.proposalId(), state.proposerId(), state.proposal(),
                state.totalVotes(), state.approvedVotes(), state.ageMillis(now), false, null);
    }
}

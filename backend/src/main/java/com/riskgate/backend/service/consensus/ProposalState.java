package com.riskgate.backend.service.consensus;

import com.riskgate.backend.model.ProposalPayload;
import com.riskgate.backend.model.Vote;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable voting state of one open proposal. Only touched under the engine lock.
 */
class ProposalState {

    private final String proposalId;
    private final String proposerId;
    private final ProposalPayload proposal;
    private final Instant createdAt;
    private final int minVotes;
    private final double threshold;
    private final Duration timeout;
    private final Map<String, Vote> votes = new LinkedHashMap<>();

    ProposalState(String proposalId, String proposerId, ProposalPayload proposal, Instant createdAt,
                  int minVotes, double threshold, Duration timeout) {
        this.proposalId = proposalId;
        this.proposerId = proposerId;
        this.proposal = proposal;
        this.createdAt = createdAt;
        this.minVotes = minVotes;
        this.threshold = threshold;
        this.timeout = timeout;
    }

    void putVote(Vote vote) {
        votes.put(vote.agentId(), vote);
    }

    int totalVotes() {
        return votes.size();
    }

    int approvedVotes() {
        return (int) votes.values().stream().filter(Vote::approved).count();
    }

    // Rounded to two decimals so 2 of 3 meets a 0.67 threshold
    double approvalRate() {
        int total = totalVotes();
        if (total == 0) {
            return 0.0;
        }
        return Math.round((double) approvedVotes() / total * 100.0) / 100.0;
    }

    boolean quorumApproved() {
        return totalVotes() >= minVotes && approvalRate() >= threshold;
    }

    boolean isExpired(Instant now) {
        return !now.isBefore(createdAt.plus(timeout));
    }

    long ageMillis(Instant now) {
        return Duration.between(createdAt, now).toMillis();
    }

    List<String> participants() {
        return new ArrayList<>(votes.keySet());
    }

    String proposalId() {
        return proposalId;
    }

    String proposerId() {
        return proposerId;
    }

    ProposalPayload proposal() {
        return proposal;
    }
}

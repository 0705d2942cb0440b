package com.riskgate.backend.model;

import java.util.List;

public record ConsensusResult(
        String proposalId,
        String proposerId,
        ProposalPayload proposal,
        boolean approved,
        double consensusScore,
        int totalVotes,
        List<String> participants,
        boolean timedOut,
        String notes
) {

    public ConsensusResult {
        participants = participants == null ? List.of() : List.copyOf(participants);
    }
}

package com.riskgate.backend.model;

public record ProposalStatus(
        String proposalId,
        String proposerId,
        ProposalPayload proposal,
        int totalVotes,
        int approvedVotes,
        long ageMillis,
        boolean resolved,
        ConsensusResult result
) {}

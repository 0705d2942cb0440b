package com.riskgate.backend.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.riskgate.backend.model.ConsensusResult;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record VoteResponse(
        @JsonProperty("proposal_id") String proposalId,
        boolean resolved,
        ConsensusResult result
) {}

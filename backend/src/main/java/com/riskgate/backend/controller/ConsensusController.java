package com.riskgate.backend.controller;

import com.riskgate.backend.dto.ProposalRequest;
import com.riskgate.backend.dto.VoteRequest;
import com.riskgate.backend.dto.VoteResponse;
import com.riskgate.backend.model.ConsensusResult;
import com.riskgate.backend.model.ProposalStatus;
import com.riskgate.backend.service.consensus.ConsensusCoordinator;
import com.riskgate.backend.service.consensus.ConsensusEngine;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Optional;

@RestController
@RequestMapping("/consensus/proposals")
@RequiredArgsConstructor
@Tag(name = "Consensus")
public class ConsensusController {

    private final ConsensusCoordinator consensusCoordinator;
    private final ConsensusEngine consensusEngine;

    @PostMapping
    @Operation(summary = "Register a proposal for multi-agent voting")
    public ResponseEntity<ProposalStatus> propose(@Valid @RequestBody ProposalRequest request) {
        ProposalStatus status = consensusCoordinator.propose(request.getSessionId(), request.getProposalId(),
                request.getProposerId(), request.toPayload());
        return ResponseEntity.status(HttpStatus.CREATED).body(status);
    }

    @PostMapping("/{proposalId}/votes")
    @Operation(summary = "Cast or replace a vote")
    public ResponseEntity<VoteResponse> vote(@PathVariable String proposalId, @Valid @RequestBody VoteRequest request) {
        Optional<ConsensusResult> result = consensusEngine.castVote(proposalId, request.getAgentId(),
                request.getApproved(), request.getConfidence() != null ? request.getConfidence() : 0.5);
        return ResponseEntity.ok(new VoteResponse(proposalId, result.isPresent(), result.orElse(null)));
    }

    @GetMapping("/{proposalId}")
    @Operation(summary = "Proposal state; resolves it if its timeout has passed")
    public ResponseEntity<ProposalStatus> status(@PathVariable String proposalId) {
        return ResponseEntity.ok(consensusEngine.getStatus(proposalId));
    }
}

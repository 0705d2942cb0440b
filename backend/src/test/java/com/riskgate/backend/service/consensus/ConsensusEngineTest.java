package com.riskgate.backend.service.consensus;

import com.riskgate.backend.config.ConsensusProperties;
import com.riskgate.backend.event.ConsensusResolvedEvent;
import com.riskgate.backend.exception.NotFoundException;
import com.riskgate.backend.model.ConsensusResult;
import com.riskgate.backend.model.OrderSide;
import com.riskgate.backend.model.ProposalPayload;
import com.riskgate.backend.model.ProposalStatus;
import com.riskgate.backend.service.MetricsService;
import com.riskgate.backend.util.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class ConsensusEngineTest {

    private final MutableClock clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
    private final ApplicationEventPublisher publisher = mock(ApplicationEventPublisher.class);
    private final MetricsService metricsService = mock(MetricsService.class);
    private ConsensusEngine engine;

    @BeforeEach
    void setUp() {
        engine = new ConsensusEngine(new ConsensusProperties(), publisher, metricsService, clock);
    }

    private static ProposalPayload proposal() {
        return new ProposalPayload("BTCUSDT", OrderSide.BUY, 250, 0.8, "breakout", Map.of("price", 50_000));
    }

    @Test
    void twoApprovalsAndOneRejectionResolveApproved() {
        engine.registerProposal("p-1", proposal(), "alpha");

        assertThat(engine.castVote("p-1", "beta", true, 0.9)).isEmpty();
        assertThat(engine.castVote("p-1", "gamma", true, 0.7)).isEmpty();
        Optional<ConsensusResult> result = engine.castVote("p-1", "delta", false, 0.6);

        assertThat(result).isPresent();
        assertThat(result.get().approved()).isTrue();
        assertThat(result.get().consensusScore()).isEqualTo(0.67);
        assertThat(result.get().totalVotes()).isEqualTo(3);
        assertThat(result.get().participants()).containsExactly("beta", "gamma", "delta");
        assertThat(result.get().timedOut()).isFalse();
        assertThat(result.get().notes()).isEqualTo("Consensus reached with 3 votes (67.0% approval)");

        ArgumentCaptor<ConsensusResolvedEvent> event = ArgumentCaptor.forClass(ConsensusResolvedEvent.class);
        verify(publisher).publishEvent(event.capture());
        assertThat(event.getValue().result()).isEqualTo(result.get());
        verify(metricsService).recordConsensus(true, false);
        assertThat(engine.openProposalCount()).isZero();
    }

    @Test
    void belowQuorumWaitsThenTimesOutRejected() {
        engine.registerProposal("p-2", proposal(), "alpha");
        engine.castVote("p-2", "beta", true, 0.9);
        engine.castVote("p-2", "gamma", true, 0.9);

        ProposalStatus open = engine.getStatus("p-2");
        assertThat(open.resolved()).isFalse();
        assertThat(open.approvedVotes()).isEqualTo(2);

        clock.advance(Duration.ofSeconds(31));
        ProposalStatus status = engine.getStatus("p-2");

        assertThat(status.resolved()).isTrue();
        assertThat(status.result().approved()).isFalse();
        assertThat(status.result().timedOut()).isTrue();
        assertThat(status.result().notes()).startsWith("Consensus not reached after timeout");
        verify(metricsService).recordConsensus(false, true);
    }

    @Test
    void evenSplitStaysOpenUntilTimeoutThenRejects() {
        engine.registerProposal("p-split", proposal(), "alpha");
        engine.castVote("p-split", "beta", true, 0.9);
        engine.castVote("p-split", "gamma", false, 0.8);
        engine.castVote("p-split", "delta", false, 0.7);

        assertThat(engine.castVote("p-split", "epsilon", true, 0.6)).isEmpty();
        ProposalStatus open = engine.getStatus("p-split");
        assertThat(open.resolved()).isFalse();
        assertThat(open.totalVotes()).isEqualTo(4);
        assertThat(open.approvedVotes()).isEqualTo(2);
        verify(publisher, never()).publishEvent(any(Object.class));

        clock.advance(Duration.ofSeconds(31));
        List<ConsensusResult> swept = engine.cleanupExpired();

        assertThat(swept).hasSize(1);
        ConsensusResult result = swept.get(0);
        assertThat(result.approved()).isFalse();
        assertThat(result.timedOut()).isTrue();
        assertThat(result.consensusScore()).isEqualTo(0.5);
        assertThat(result.totalVotes()).isEqualTo(4);
        assertThat(engine.getStatus("p-split").result()).isEqualTo(result);
        verify(publisher).publishEvent(any(ConsensusResolvedEvent.class));
    }

    @Test
    void proposerCannotVoteOnOwnProposal() {
        engine.registerProposal("p-3", proposal(), "alpha");

        assertThat(engine.castVote("p-3", "alpha", true, 1.0)).isEmpty();

        assertThat(engine.getStatus("p-3").totalVotes()).isZero();
    }

    @Test
    void repeatedVoteReplacesEarlierOne() {
        engine.registerProposal("p-4", proposal(), "alpha");
        engine.castVote("p-4", "beta", true, 0.9);
        engine.castVote("p-4", "beta", false, 0.4);

        ProposalStatus status = engine.getStatus("p-4");
        assertThat(status.totalVotes()).isEqualTo(1);
        assertThat(status.approvedVotes()).isZero();
    }

    @Test
    void lateVotesAreIgnoredAndUnknownProposalsFail() {
        engine.registerProposal("p-5", proposal(), "alpha");
        engine.castVote("p-5", "beta", true, 0.9);
        engine.castVote("p-5", "gamma", true, 0.9);
        engine.castVote("p-5", "delta", true, 0.9);

        assertThat(engine.castVote("p-5", "epsilon", false, 0.9)).isEmpty();
        verify(publisher, times(1)).publishEvent(any(ConsensusResolvedEvent.class));
        assertThatThrownBy(() -> engine.castVote("missing", "beta", true, 0.9))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void duplicateProposalIdIsRejected() {
        engine.registerProposal("p-6", proposal(), "alpha");

        assertThatThrownBy(() -> engine.registerProposal("p-6", proposal(), "beta"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void generatedIdWhenNoneGiven() {
        ProposalStatus status = engine.registerProposal(null, proposal(), "alpha");

        assertThat(status.proposalId()).isNotBlank();
        assertThat(status.resolved()).isFalse();
    }

    @Test
    void sweepResolvesOnlyExpiredProposals() {
        engine.registerProposal("old", proposal(), "alpha");
        clock.advance(Duration.ofSeconds(20));
        engine.registerProposal("fresh", proposal(), "alpha");
        clock.advance(Duration.ofSeconds(15));

        List<ConsensusResult> results = engine.cleanupExpired();

        assertThat(results).extracting(ConsensusResult::proposalId).containsExactly("old");
        assertThat(engine.openProposalCount()).isEqualTo(1);
        assertThat(engine.getStatus("old").resolved()).isTrue();
    }

    @Test
    void nothingPublishedWhileOpen() {
        engine.registerProposal("p-7", proposal(), "alpha");
        engine.castVote("p-7", "beta", true, 0.9);

        assertThat(engine.cleanupExpired()).isEmpty();
        verify(publisher, never()).publishEvent(any(Object.class));
    }
}

package io.conclave.core.voting;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.conclave.core.agent.Agent;
import io.conclave.core.agent.AgentType;
import io.conclave.core.agent.InMemoryAgentRegistry;
import io.conclave.core.event.EventBus;
import io.conclave.core.event.EventPayload;
import io.conclave.core.exception.ValidationException;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class VotingEngineTest {

    private static final List<VoteOption> ABC =
            List.of(VoteOption.of("a"), VoteOption.of("b"), VoteOption.of("c"));

    private EventBus bus;
    private InMemoryAgentRegistry registry;
    private VotingEngine engine;

    @BeforeEach
    void setUp() {
        bus = new EventBus();
        registry = new InMemoryAgentRegistry(bus);
        engine = new VotingEngine(registry, bus);
    }

    private void registerAgents(int count) {
        for (int i = 1; i <= count; i++) {
            engine.registerAgent(Agent.of("agent-" + i, AgentType.REVIEWER, 5));
        }
    }

    private void castVotes(String sessionId, String optionId, int count, int offset) {
        for (int i = 0; i < count; i++) {
            engine.castVote(sessionId, "voter-" + (offset + i), optionId);
        }
    }

    @Nested
    class CreateSessionTest {

        @Test
        void shouldDefaultQuorumToStrictMajorityOfRegisteredAgents() {
            // Given
            registerAgents(5);

            // When
            String sessionId = engine.createVotingSession("Merge PR?", ABC);

            // Then
            VotingSession session = engine.getVotingSession(sessionId).orElseThrow();
            assertThat(session.quorum()).isEqualTo(3);
            assertThat(session.status()).isEqualTo(SessionStatus.OPEN);
            assertThat(sessionId).startsWith("vote_merge_pr_");
        }

        @Test
        void shouldRejectEmptyOptions() {
            assertThatThrownBy(() -> engine.createVotingSession("topic", List.of()))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        void shouldRejectDuplicateOptionIds() {
            assertThatThrownBy(
                            () ->
                                    engine.createVotingSession(
                                            "topic", List.of(
                                                    VoteOption.of("a"), VoteOption.of("a"))))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("Duplicate");
        }

        @Test
        void shouldRejectNonPositiveQuorum() {
            assertThatThrownBy(() -> engine.createVotingSession("topic", ABC, 0))
                    .isInstanceOf(ValidationException.class);
        }
    }

    @Nested
    class CastVoteTest {

        @Test
        void shouldRejectVoteForUnknownSession() {
            assertThat(engine.castVote("missing", "agent-1", "a")).isFalse();
        }

        @Test
        void shouldRejectVoteForUnknownOption() {
            String sessionId = engine.createVotingSession("topic", ABC, 1);

            assertThat(engine.castVote(sessionId, "agent-1", "z")).isFalse();
            assertThat(engine.getVotingSession(sessionId).orElseThrow().votes()).isEmpty();
        }

        @Test
        void shouldRejectVoteAfterClose() {
            // Given
            String sessionId = engine.createVotingSession("topic", ABC, 1);
            engine.castVote(sessionId, "agent-1", "a");
            engine.closeVotingSession(sessionId);

            // When
            boolean accepted = engine.castVote(sessionId, "agent-2", "b");

            // Then
            assertThat(accepted).isFalse();
            assertThat(engine.getVotingSession(sessionId).orElseThrow().votes()).hasSize(1);
        }

        @Test
        void shouldKeepOnlyLastVotePerAgent() {
            // Given
            String sessionId = engine.createVotingSession("topic", ABC, 1);

            // When
            engine.castVote(sessionId, "agent-1", "a");
            engine.castVote(sessionId, "agent-1", "b");
            VoteResult result = engine.closeVotingSession(sessionId);

            // Then
            assertThat(result.votesCast()).isEqualTo(1);
            assertThat(result.tally()).containsEntry("a", 0.0).containsEntry("b", 1.0);
        }
    }

    @Nested
    class CloseSessionTest {

        @Test
        void shouldFailConsensusWhenQuorumNotMet() {
            // Given
            registerAgents(5);
            String sessionId = engine.createVotingSession("topic", ABC, 3);
            engine.castVote(sessionId, "agent-1", "a");
            engine.castVote(sessionId, "agent-2", "a");

            // When
            VoteResult result = engine.closeVotingSession(sessionId);

            // Then
            assertThat(result.consensusReached()).isFalse();
            assertThat(result.hasWinner()).isFalse();
            assertThat(result.details()).startsWith("Quorum not met");
        }

        @Test
        void shouldPickPluralityWinnerBySimpleMajority() {
            // Given
            String sessionId = engine.createVotingSession("topic", ABC);
            castVotes(sessionId, "a", 6, 0);
            castVotes(sessionId, "b", 3, 6);
            castVotes(sessionId, "c", 1, 9);

            // When
            VoteResult result =
                    engine.closeVotingSession(sessionId, VotingAlgorithm.SIMPLE_MAJORITY, 0.5);

            // Then
            assertThat(result.consensusReached()).isTrue();
            assertThat(result.winningOption().id()).isEqualTo("a");
            assertThat(result.votesCast()).isEqualTo(10);
            assertThat(result.confidence()).isEqualTo(0.6);
        }

        @Test
        void shouldReturnSameResultOnRepeatedClose() {
            // Given
            List<EventPayload.VoteSessionClosed> closed = new ArrayList<>();
            bus.subscribe(
                    EventPayload.VoteSessionClosed.class, event -> closed.add(event.payload()));
            String sessionId = engine.createVotingSession("topic", ABC, 1);
            engine.castVote(sessionId, "agent-1", "b");

            // When
            VoteResult first = engine.closeVotingSession(sessionId);
            VoteResult second =
                    engine.closeVotingSession(sessionId, VotingAlgorithm.UNANIMOUS, 1.0);

            // Then
            assertThat(second).isSameAs(first);
            assertThat(closed).hasSize(1);
            assertThat(closed.get(0).winningOptionId()).isEqualTo("b");
            assertThat(engine.getVotingSession(sessionId).orElseThrow().status())
                    .isEqualTo(SessionStatus.CLOSED);
        }

        @Test
        void shouldRejectUnknownSession() {
            assertThatThrownBy(() -> engine.closeVotingSession("missing"))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("missing");
        }

        @Test
        void shouldRejectThresholdOutOfRange() {
            String sessionId = engine.createVotingSession("topic", ABC, 1);

            assertThatThrownBy(
                            () ->
                                    engine.closeVotingSession(
                                            sessionId, VotingAlgorithm.SUPERMAJORITY, 1.5))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        void shouldWeighVotesByExpertise() {
            // Given
            engine.registerAgent(
                    Agent.of("expert", AgentType.REVIEWER, 5, "java", "sql", "kafka", "k8s"));
            engine.registerAgent(Agent.of("n1", AgentType.REVIEWER, 5));
            String sessionId =
                    engine.createVotingSession(
                            "topic", List.of(VoteOption.of("a"), VoteOption.of("b")), 1);
            engine.castVote(sessionId, "expert", "a");
            engine.castVote(sessionId, "n1", "b");
            engine.castVote(sessionId, "outsider", "b");

            // When
            VoteResult result =
                    engine.closeVotingSession(sessionId, VotingAlgorithm.WEIGHTED_MAJORITY, null);

            // Then
            assertThat(engine.weightOf("expert")).isEqualTo(2.0);
            assertThat(engine.weightOf("outsider")).isEqualTo(1.0);
            assertThat(result.tally()).containsEntry("a", 2.0).containsEntry("b", 2.0);
            assertThat(result.consensusReached()).isFalse();
            assertThat(result.details()).startsWith("Tie between");
        }

        @Test
        void shouldKeepWeightRecordedWhenVoteWasCast() {
            // Given
            engine.registerAgent(
                    Agent.of("expert", AgentType.REVIEWER, 5, "java", "sql", "kafka", "k8s"));
            String sessionId =
                    engine.createVotingSession(
                            "topic", List.of(VoteOption.of("a"), VoteOption.of("b")), 1);
            engine.castVote(sessionId, "expert", "a");
            engine.castVote(sessionId, "outsider", "b");
            registry.unregister("expert");

            // When
            VoteResult result =
                    engine.closeVotingSession(sessionId, VotingAlgorithm.WEIGHTED_MAJORITY, null);

            // Then
            assertThat(engine.weightOf("expert")).isEqualTo(1.0);
            assertThat(result.tally()).containsEntry("a", 2.0).containsEntry("b", 1.0);
            assertThat(result.winningOption().id()).isEqualTo("a");
        }

        @Test
        void shouldListAllSessions() {
            engine.createVotingSession("first", ABC, 1);
            engine.createVotingSession("second", ABC, 1);

            assertThat(engine.getAllVotingSessions())
                    .extracting(VotingSession::topic)
                    .containsExactlyInAnyOrder("first", "second");
        }
    }
}

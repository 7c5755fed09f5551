package io.conclave.core.voting;

import io.conclave.core.agent.Agent;
import io.conclave.core.agent.AgentRegistry;
import io.conclave.core.capability.DecisionEvaluator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// {@link DecisionEvaluator} that puts each decision to a vote among the registered agents.
///
/// Opens a session with the options `positive` and `negative`, collects one ballot per
/// registered agent from a {@link VoteProvider}, and closes with the configured algorithm.
/// Without consensus the outcome is `negative`.
public class VotingDecisionEvaluator implements DecisionEvaluator {

    private static final Logger logger = Logger.getLogger(VotingDecisionEvaluator.class.getName());

    public static final String POSITIVE = "positive";
    public static final String NEGATIVE = "negative";

    private final VotingEngine engine;
    private final AgentRegistry registry;
    private final VoteProvider voteProvider;
    private final VotingAlgorithm algorithm;

    public VotingDecisionEvaluator(
            VotingEngine engine,
            AgentRegistry registry,
            VoteProvider voteProvider,
            VotingAlgorithm algorithm) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.voteProvider = Objects.requireNonNull(voteProvider, "voteProvider must not be null");
        this.algorithm = Objects.requireNonNull(algorithm, "algorithm must not be null");
    }

    @Override
    public String decide(String nodeId, String question, Map<String, Object> context) {
        String sessionId =
                engine.createVotingSession(
                        question,
                        List.of(VoteOption.of(POSITIVE, "Yes"), VoteOption.of(NEGATIVE, "No")));
        for (Agent agent : registry.getAgents()) {
            String ballot = voteProvider.vote(agent, question, context);
            if (ballot != null) {
                engine.castVote(sessionId, agent.id(), ballot);
            }
        }
        VoteResult result = engine.closeVotingSession(sessionId, algorithm, null);
        String outcome = result.winner().map(VoteOption::id).orElse(NEGATIVE);
        logger.info("Decision " + nodeId + " resolved " + outcome + " (" + result.details() + ")");
        return outcome;
    }
}

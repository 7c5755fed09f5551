package io.conclave.core.voting;

import io.conclave.core.agent.Agent;
import java.util.Map;

/// Supplies an agent's ballot for a question put to a vote.
@FunctionalInterface
public interface VoteProvider {

    /// @return chosen option id, or null to abstain
    String vote(Agent agent, String question, Map<String, Object> context);
}

package io.conclave.core.capability;

import java.util.Map;

/// Computes the outcome of a decision step.
///
/// Implementations may consult the context directly or put the question to a vote.
@FunctionalInterface
public interface DecisionEvaluator {

    /// @param nodeId decision node id, not null
    /// @param question the node's label, not null
    /// @param context workflow context, never null
    /// @return outcome label such as `positive` or `negative`, never null
    String decide(String nodeId, String question, Map<String, Object> context);
}

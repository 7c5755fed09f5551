package io.conclave.core.workflow.processor;

import io.conclave.core.capability.AgentInvoker;
import io.conclave.core.capability.DecisionEvaluator;
import java.util.Map;
import java.util.Optional;

/// Services and state available to a {@link NodeProcessor}.
///
/// Processors should access only what they need.
///
/// @param executionId identifier of the running execution
/// @param step one-based position of the node in the execution path
/// @param context unmodifiable view of the workflow context
/// @param agentInvoker agent capability, may be null when the graph has no agent nodes
/// @param decisionEvaluator decision capability, not null
/// @param processSteps named transforms for process nodes, never null
public record NodeContext(
        String executionId,
        int step,
        Map<String, Object> context,
        AgentInvoker agentInvoker,
        DecisionEvaluator decisionEvaluator,
        Map<String, ProcessStep> processSteps) {

    public Optional<AgentInvoker> invoker() {
        return Optional.ofNullable(agentInvoker);
    }
}

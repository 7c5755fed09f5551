package io.conclave.core.capability;

import java.util.Map;

/// Runs an agent step on behalf of a workflow.
///
/// The workflow orchestrator depends on this interface only. Routing-backed
/// implementations live beside the router and never reference the orchestrator.
@FunctionalInterface
public interface AgentInvoker {

    /// Executes the step.
    ///
    /// @param invocation step description, not null
    /// @return output entries to merge into the workflow context, never null
    /// @throws io.conclave.core.exception.CoordinationException if no agent can run the step
    ///     or the agent reports failure
    Map<String, Object> invoke(AgentInvocation invocation);
}

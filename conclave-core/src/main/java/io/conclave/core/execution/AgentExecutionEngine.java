package io.conclave.core.execution;

import io.conclave.core.agent.Agent;
import io.conclave.core.agent.Task;

/// External collaborator that actually runs a task on an agent.
///
/// The coordination core never invokes a model itself. Timeouts are the engine's
/// responsibility.
///
/// @see StubAgentExecutionEngine for a local stand-in
@FunctionalInterface
public interface AgentExecutionEngine {

    /// Runs a task.
    ///
    /// @param task task to execute, not null
    /// @param agent agent selected to run it, not null
    /// @return execution outcome, never null
    AgentExecution executeTask(Task task, Agent agent);
}

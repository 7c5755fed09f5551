package io.conclave.core.execution;

/// Outcome reported by an {@link AgentExecutionEngine}.
///
/// @param success whether the agent finished the task
/// @param result agent output, may be null on failure
/// @param executionTimeMs wall-clock duration in milliseconds
/// @param error failure description, null on success
public record AgentExecution(boolean success, Object result, long executionTimeMs, String error) {

    public static AgentExecution success(Object result, long executionTimeMs) {
        return new AgentExecution(true, result, executionTimeMs, null);
    }

    public static AgentExecution failure(String error, long executionTimeMs) {
        return new AgentExecution(false, null, executionTimeMs, error);
    }
}

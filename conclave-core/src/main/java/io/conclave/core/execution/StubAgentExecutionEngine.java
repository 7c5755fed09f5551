package io.conclave.core.execution;

import io.conclave.core.agent.Agent;
import io.conclave.core.agent.AgentType;
import io.conclave.core.agent.Task;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/// Execution engine that returns canned responses without calling any model.
///
/// Useful for running workflow graphs locally and in tests.
///
/// ### Response Resolution Order
/// 1. Response registered for the task id
/// 2. Response registered for the agent type
/// 3. Generated text naming the agent and the task description
///
/// A task id registered with {@link #failTask} produces a failed execution instead.
///
/// @implNote Thread-safe. Responses are held in {@link ConcurrentHashMap}s.
public class StubAgentExecutionEngine implements AgentExecutionEngine {

    private static final Logger logger =
            Logger.getLogger(StubAgentExecutionEngine.class.getName());

    private final Map<String, String> taskResponses = new ConcurrentHashMap<>();
    private final Map<AgentType, String> typeResponses = new ConcurrentHashMap<>();
    private final Map<String, String> failures = new ConcurrentHashMap<>();

    /// Registers the response returned for one task id.
    public StubAgentExecutionEngine respondToTask(String taskId, String response) {
        taskResponses.put(
                Objects.requireNonNull(taskId, "taskId must not be null"),
                Objects.requireNonNull(response, "response must not be null"));
        return this;
    }

    /// Registers the response returned by every agent of a type.
    public StubAgentExecutionEngine respondAs(AgentType type, String response) {
        typeResponses.put(
                Objects.requireNonNull(type, "type must not be null"),
                Objects.requireNonNull(response, "response must not be null"));
        return this;
    }

    /// Makes executions of a task id fail with the given error.
    public StubAgentExecutionEngine failTask(String taskId, String error) {
        failures.put(
                Objects.requireNonNull(taskId, "taskId must not be null"),
                Objects.requireNonNull(error, "error must not be null"));
        return this;
    }

    @Override
    public AgentExecution executeTask(Task task, Agent agent) {
        long start = System.nanoTime();
        logger.info("[STUB] Agent '" + agent.id() + "' received task " + task.id());

        String error = failures.get(task.id());
        if (error != null) {
            return AgentExecution.failure(error, elapsedMillis(start));
        }

        String response = taskResponses.get(task.id());
        if (response == null) {
            response = typeResponses.get(agent.type());
        }
        if (response == null) {
            response = "[STUB " + agent.type() + " " + agent.id() + "] " + task.description();
        }
        return AgentExecution.success(response, elapsedMillis(start));
    }

    private static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}

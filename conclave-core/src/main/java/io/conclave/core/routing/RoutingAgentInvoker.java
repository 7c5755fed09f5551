package io.conclave.core.routing;

import io.conclave.core.agent.Agent;
import io.conclave.core.agent.AgentRegistry;
import io.conclave.core.agent.AgentType;
import io.conclave.core.agent.Task;
import io.conclave.core.agent.TaskPriority;
import io.conclave.core.capability.AgentInvocation;
import io.conclave.core.capability.AgentInvoker;
import io.conclave.core.capability.ContextTransfer;
import io.conclave.core.exception.InternalException;
import io.conclave.core.execution.AgentExecution;
import io.conclave.core.execution.AgentExecutionEngine;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

/// {@link AgentInvoker} that routes each step through a {@link TaskRouter} and runs it on
/// an {@link AgentExecutionEngine}.
///
/// ### Per Step
/// 1. Build a task whose type maps to the requested agent type
/// 2. Route it and take one unit of the selected agent's workload
/// 3. When the previous step was processed by another registered agent and a
///    {@link ContextTransfer} is configured, move the context through it before running
/// 4. Execute, release the workload unit, and return the output entries
///
/// Output keys: {@value #PROCESSED_BY}, {@value #RESULT}, {@value #TIMESTAMP},
/// {@value #EXECUTION_TIME}, {@value #CONFIDENCE} and, after a transfer,
/// {@value #HANDOFF_ID}.
public class RoutingAgentInvoker implements AgentInvoker {

    private static final Logger logger = Logger.getLogger(RoutingAgentInvoker.class.getName());

    public static final String PROCESSED_BY = "processedBy";
    public static final String RESULT = "result";
    public static final String TIMESTAMP = "timestamp";
    public static final String EXECUTION_TIME = "executionTime";
    public static final String CONFIDENCE = "routingConfidence";
    public static final String HANDOFF_ID = "handoffId";
    public static final String DESCRIPTION = "description";
    public static final String PRIORITY = "priority";

    private final TaskRouter router;
    private final AgentRegistry registry;
    private final AgentExecutionEngine engine;
    private final CompatibilityTable compatibility;
    private final ContextTransfer contextTransfer;
    private final AtomicLong sequence = new AtomicLong();

    public RoutingAgentInvoker(
            TaskRouter router, AgentRegistry registry, AgentExecutionEngine engine) {
        this(router, registry, engine, CompatibilityTable.defaults(), null);
    }

    /// Creates an invoker.
    ///
    /// @param router router used to pick agents, not null
    /// @param registry registry whose workloads are adjusted, not null
    /// @param engine execution collaborator, not null
    /// @param compatibility table used to derive a task type from an agent type, not null
    /// @param contextTransfer transfer used when responsibility moves, may be null
    public RoutingAgentInvoker(
            TaskRouter router,
            AgentRegistry registry,
            AgentExecutionEngine engine,
            CompatibilityTable compatibility,
            ContextTransfer contextTransfer) {
        this.router = Objects.requireNonNull(router, "router must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.compatibility =
                Objects.requireNonNull(compatibility, "compatibility must not be null");
        this.contextTransfer = contextTransfer;
    }

    @Override
    public Map<String, Object> invoke(AgentInvocation invocation) {
        Task task = toTask(invocation);
        RoutingResult routing = router.routeTask(task);
        Agent agent = routing.agent();

        Map<String, Object> output = new LinkedHashMap<>();
        Object previous = invocation.context().get(PROCESSED_BY);
        if (contextTransfer != null
                && previous instanceof String from
                && !from.equals(agent.id())
                && registry.hasAgent(from)) {
            String transferId = contextTransfer.send(from, agent.id(), task.id(), task.context());
            task = task.withContext(contextTransfer.receive(transferId, agent.id()));
            output.put(HANDOFF_ID, transferId);
        }

        registry.adjustWorkload(agent.id(), 1);
        AgentExecution execution;
        try {
            execution = engine.executeTask(task, agent);
        } finally {
            registry.adjustWorkload(agent.id(), -1);
        }

        if (!execution.success()) {
            throw new InternalException(
                    "Agent " + agent.id() + " failed task " + task.id() + ": " + execution.error());
        }
        logger.fine("Agent " + agent.id() + " finished " + task.id() + " in "
                + execution.executionTimeMs() + "ms");

        output.put(PROCESSED_BY, agent.id());
        output.put(RESULT, execution.result());
        output.put(TIMESTAMP, System.currentTimeMillis());
        output.put(EXECUTION_TIME, execution.executionTimeMs());
        output.put(CONFIDENCE, routing.confidence());
        return output;
    }

    private Task toTask(AgentInvocation invocation) {
        AgentType type = invocation.agentType();
        String taskType = compatibility.taskTypeFor(type).orElse(type.wireName());
        Object description = invocation.context().get(DESCRIPTION);
        TaskPriority priority = TaskPriority.MEDIUM;
        if (invocation.context().get(PRIORITY) instanceof String p) {
            priority =
                    Arrays.stream(TaskPriority.values())
                            .filter(candidate -> candidate.name().equalsIgnoreCase(p))
                            .findFirst()
                            .orElse(TaskPriority.MEDIUM);
        }
        return new Task(
                invocation.nodeId() + "_" + sequence.incrementAndGet(),
                description != null ? invocation.label() + ": " + description : invocation.label(),
                taskType,
                priority,
                invocation.context());
    }
}

package io.conclave.core.routing;

import io.conclave.core.agent.Agent;
import io.conclave.core.agent.AgentRegistry;
import io.conclave.core.agent.Task;
import io.conclave.core.event.EventBus;
import io.conclave.core.event.EventPayload;
import io.conclave.core.exception.CapacityException;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.logging.Logger;

/// Workload-aware selection of an agent for a task.
///
/// ### Algorithm
/// 1. Keep agents whose type is compatible with the task type ({@link CompatibilityTable})
/// 2. Drop candidates at or over capacity
/// 3. Score the rest: weighted sum of expertise match, spare capacity ratio
///    `(capacity - workload) / capacity`, and priority alignment
/// 4. Pick the highest score; break ties by lowest workload, then by agent id
///
/// Confidence is `0.3 + 0.7 * score`, which lies in (0.3, 1.0] for any agent with spare
/// capacity. When every compatible agent is saturated the router still assigns the task:
/// it picks the least overloaded candidate and reports {@link #DEGRADED_CONFIDENCE}.
///
/// ### Contracts
/// - **Postcondition**: the returned agent was registered when the snapshot was taken
/// - **Invariant**: selection is deterministic for a given registry state
///
/// @implNote Thread-safe. Reads a consistent snapshot of the {@link AgentRegistry} per call;
/// the routing history is guarded by its own monitor.
///
/// @see CompatibilityTable
/// @see RoutingWeights
public class TaskRouter {

    private static final Logger logger = Logger.getLogger(TaskRouter.class.getName());
    private static final String SOURCE = "task-router";

    /// Confidence reported when every compatible agent is at or over capacity.
    public static final double DEGRADED_CONFIDENCE = 0.3;

    public static final double OVERLOAD_THRESHOLD = 0.9;
    public static final double UNDERUTILIZED_THRESHOLD = 0.3;
    public static final int DEFAULT_HISTORY_LIMIT = 100;

    private static final Comparator<Scored> BY_SCORE =
            Comparator.comparingDouble(Scored::score)
                    .reversed()
                    .thenComparingInt(s -> s.agent().workload())
                    .thenComparing(s -> s.agent().id());

    private static final Comparator<Agent> LEAST_OVERLOADED =
            Comparator.comparingDouble(Agent::utilization)
                    .thenComparingInt(Agent::workload)
                    .thenComparing(Agent::id);

    private final AgentRegistry registry;
    private final EventBus eventBus;
    private final RoutingWeights weights;
    private final CompatibilityTable compatibility;
    private final int historyLimit;
    private final Deque<RoutingDecision> history = new ArrayDeque<>();

    public TaskRouter(AgentRegistry registry, EventBus eventBus) {
        this(
                registry,
                eventBus,
                RoutingWeights.DEFAULT,
                CompatibilityTable.defaults(),
                DEFAULT_HISTORY_LIMIT);
    }

    /// Creates a router.
    ///
    /// @param registry shared agent registry, not null
    /// @param eventBus bus for `task.routed` events, not null
    /// @param weights scoring weights, not null
    /// @param compatibility task-type to agent-type table, not null
    /// @param historyLimit maximum routing decisions kept, must be positive
    public TaskRouter(
            AgentRegistry registry,
            EventBus eventBus,
            RoutingWeights weights,
            CompatibilityTable compatibility,
            int historyLimit) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus must not be null");
        this.weights = Objects.requireNonNull(weights, "weights must not be null");
        this.compatibility =
                Objects.requireNonNull(compatibility, "compatibility must not be null");
        if (historyLimit <= 0) {
            throw new IllegalArgumentException("historyLimit must be positive");
        }
        this.historyLimit = historyLimit;
    }

    public Agent registerAgent(Agent agent) {
        return registry.register(agent);
    }

    public boolean unregisterAgent(String agentId) {
        return registry.unregister(agentId);
    }

    /// Sets an agent's current workload.
    ///
    /// @throws io.conclave.core.exception.ValidationException if the agent is unknown
    public Agent updateAgentWorkload(String agentId, int workload) {
        return registry.updateWorkload(agentId, workload);
    }

    /// Selects an agent for a task.
    ///
    /// @apiNote **Side effects**:
    /// - Appends to the routing history
    /// - Publishes `task.routed`
    ///
    /// The router does not increase the selected agent's workload; callers that dispatch
    /// the task do so through {@link AgentRegistry#adjustWorkload}.
    ///
    /// @param task task to route, not null
    /// @return selected agent with confidence, never null
    /// @throws CapacityException if no agent is registered or none is compatible with the
    ///     task type
    public RoutingResult routeTask(Task task) {
        Objects.requireNonNull(task, "task must not be null");

        List<Agent> agents = registry.getAgents();
        if (agents.isEmpty()) {
            throw new CapacityException("No agents registered");
        }

        List<Agent> candidates =
                agents.stream()
                        .filter(a -> compatibility.isCompatible(task.type(), a.type()))
                        .toList();
        if (candidates.isEmpty()) {
            throw new CapacityException(
                    "No registered agent is compatible with task type: " + task.type());
        }

        List<Agent> available = candidates.stream().filter(a -> !a.isAtCapacity()).toList();
        RoutingResult result =
                available.isEmpty() ? selectDegraded(candidates) : selectBest(task, available);

        record(task, result);
        logger.info(
                "Routed task "
                        + task.id()
                        + " to "
                        + result.agentId()
                        + " (confidence "
                        + String.format(Locale.ROOT, "%.2f", result.confidence())
                        + ")");
        eventBus.publish(
                SOURCE,
                new EventPayload.TaskRouted(
                        task.id(), result.agentId(), result.confidence(), result.degraded()));
        return result;
    }

    /// Scores one agent for a task without routing.
    ///
    /// @return score in [0, 1]
    public double score(Task task, Agent agent) {
        double expertise = expertiseMatch(task.description(), agent);
        double spare =
                Math.max(0.0, (double) (agent.capacity() - agent.workload()) / agent.capacity());
        double alignment =
                1.0 - Math.min(1.0, agent.utilization()) * task.priority().loadSensitivity();

        double raw =
                weights.expertise() * expertise
                        + weights.capacity() * spare
                        + weights.priority() * alignment;
        return raw / weights.total();
    }

    /// Returns routing decisions, oldest first.
    public List<RoutingDecision> getRoutingHistory() {
        synchronized (history) {
            return List.copyOf(history);
        }
    }

    /// Returns routing decisions for one agent, oldest first.
    public List<RoutingDecision> getRoutingHistory(String agentId) {
        synchronized (history) {
            return history.stream().filter(d -> d.agentId().equals(agentId)).toList();
        }
    }

    /// Summarizes current load across all registered agents.
    ///
    /// @return load snapshot, never null
    public LoadReport loadReport() {
        List<Agent> agents = registry.getAgents();
        double average =
                agents.stream().mapToDouble(Agent::utilization).average().orElse(0.0);
        List<String> overloaded =
                agents.stream()
                        .filter(a -> a.utilization() > OVERLOAD_THRESHOLD)
                        .map(Agent::id)
                        .toList();
        List<String> underutilized =
                agents.stream()
                        .filter(a -> a.utilization() < UNDERUTILIZED_THRESHOLD)
                        .map(Agent::id)
                        .toList();
        return new LoadReport(agents.size(), average, overloaded, underutilized);
    }

    private RoutingResult selectBest(Task task, List<Agent> available) {
        Scored best =
                available.stream()
                        .map(a -> new Scored(a, score(task, a)))
                        .min(BY_SCORE)
                        .orElseThrow();
        double confidence = DEGRADED_CONFIDENCE + (1.0 - DEGRADED_CONFIDENCE) * best.score();
        String reasoning =
                String.format(
                        Locale.ROOT,
                        "%s agent %s scored %.2f among %d candidates (workload %d/%d)",
                        best.agent().type(),
                        best.agent().id(),
                        best.score(),
                        available.size(),
                        best.agent().workload(),
                        best.agent().capacity());
        return new RoutingResult(best.agent(), confidence, false, reasoning);
    }

    private RoutingResult selectDegraded(List<Agent> candidates) {
        Agent least = candidates.stream().min(LEAST_OVERLOADED).orElseThrow();
        logger.warning(
                "All "
                        + candidates.size()
                        + " compatible agents are at capacity; assigning least loaded "
                        + least.id());
        String reasoning =
                "All compatible agents at capacity; selected least loaded "
                        + least.id()
                        + " ("
                        + least.workload()
                        + "/"
                        + least.capacity()
                        + ")";
        return new RoutingResult(least, DEGRADED_CONFIDENCE, true, reasoning);
    }

    /// Fraction of the agent's expertise keywords that occur in the description.
    static double expertiseMatch(String description, Agent agent) {
        if (agent.expertise().isEmpty() || description.isEmpty()) {
            return 0.0;
        }
        String text = description.toLowerCase(Locale.ROOT);
        long matches =
                agent.expertise().stream()
                        .filter(e -> text.contains(e.toLowerCase(Locale.ROOT)))
                        .count();
        return (double) matches / agent.expertise().size();
    }

    private void record(Task task, RoutingResult result) {
        RoutingDecision decision =
                new RoutingDecision(
                        task.id(),
                        task.type(),
                        result.agentId(),
                        result.confidence(),
                        result.degraded(),
                        Instant.now());
        synchronized (history) {
            history.addLast(decision);
            while (history.size() > historyLimit) {
                history.removeFirst();
            }
        }
    }

    private record Scored(Agent agent, double score) {}
}

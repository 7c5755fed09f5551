package io.conclave.core.agent;

import io.conclave.core.event.EventBus;
import io.conclave.core.event.EventPayload;
import io.conclave.core.exception.ValidationException;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;
import java.util.logging.Logger;

/// Thread-safe {@link AgentRegistry} backed by a {@link ConcurrentHashMap}.
///
/// Every per-agent mutation goes through {@link ConcurrentHashMap#compute}, which runs
/// the update while holding the bin lock for that key. This gives single-writer-per-id
/// semantics without a global lock.
///
/// @implNote Thread-safe. Events are published after the map update completes, outside
/// the bin lock.
///
/// @see AgentRegistry for the interface contract
public class InMemoryAgentRegistry implements AgentRegistry {

    private static final Logger logger = Logger.getLogger(InMemoryAgentRegistry.class.getName());
    private static final String SOURCE = "agent-registry";

    private final Map<String, Agent> agents = new ConcurrentHashMap<>();
    private final EventBus eventBus;

    /// Creates a registry that does not publish events.
    public InMemoryAgentRegistry() {
        this(null);
    }

    /// Creates a registry that announces changes on the given bus.
    ///
    /// @param eventBus bus for registry events, may be null
    public InMemoryAgentRegistry(EventBus eventBus) {
        this.eventBus = eventBus;
    }

    /// Registers an agent, replacing any agent with the same id.
    ///
    /// @apiNote **Side effects**:
    /// - Overwrites an existing agent with the same id, logging a warning
    /// - Publishes `agent.registered`
    @Override
    public Agent register(Agent agent) {
        Objects.requireNonNull(agent, "agent must not be null");
        Agent previous = agents.put(agent.id(), agent);
        if (previous != null) {
            logger.warning("Agent already exists: " + agent.id() + ". Replacing...");
        }
        logger.info("Registered agent: " + agent.id() + " (" + agent.type() + ")");
        publish(
                new EventPayload.AgentRegistered(
                        agent.id(), agent.type().wireName(), agent.capacity()));
        return agent;
    }

    @Override
    public boolean unregister(String agentId) {
        Objects.requireNonNull(agentId, "agentId must not be null");
        Agent removed = agents.remove(agentId);
        if (removed == null) {
            return false;
        }
        logger.info("Unregistered agent: " + agentId);
        publish(new EventPayload.AgentUnregistered(agentId));
        return true;
    }

    @Override
    public Optional<Agent> getAgent(String agentId) {
        Objects.requireNonNull(agentId, "agentId must not be null");
        return Optional.ofNullable(agents.get(agentId));
    }

    @Override
    public Agent updateWorkload(String agentId, int workload) {
        Objects.requireNonNull(agentId, "agentId must not be null");
        if (workload < 0) {
            throw new ValidationException("Workload must be >= 0, got " + workload);
        }
        return mutate(agentId, current -> current.withWorkload(workload));
    }

    @Override
    public Agent adjustWorkload(String agentId, int delta) {
        Objects.requireNonNull(agentId, "agentId must not be null");
        return mutate(
                agentId,
                current -> current.withWorkload(Math.max(0, current.workload() + delta)));
    }

    @Override
    public List<Agent> getAgents() {
        return agents.values().stream().sorted(Comparator.comparing(Agent::id)).toList();
    }

    @Override
    public int size() {
        return agents.size();
    }

    /// Removes all agents without publishing events.
    public void clear() {
        int count = agents.size();
        agents.clear();
        logger.info("Cleared " + count + " agents from registry");
    }

    private Agent mutate(String agentId, UnaryOperator<Agent> update) {
        Agent updated = agents.computeIfPresent(agentId, (id, current) -> update.apply(current));
        if (updated == null) {
            throw new ValidationException("Agent not found: " + agentId);
        }
        logger.fine(
                "Workload of " + agentId + " is now " + updated.workload() + "/"
                        + updated.capacity());
        publish(
                new EventPayload.AgentWorkloadUpdated(
                        agentId, updated.workload(), updated.capacity()));
        return updated;
    }

    private void publish(EventPayload payload) {
        if (eventBus != null) {
            eventBus.publish(SOURCE, payload);
        }
    }
}

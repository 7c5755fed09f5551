package io.conclave.core.agent;

import java.util.List;
import java.util.Optional;

/// Shared store of agents read by routing and voting.
///
/// Mutations are atomic per agent id: two concurrent workload updates for the same
/// agent never lose one another.
///
/// @see InMemoryAgentRegistry for the default implementation
public interface AgentRegistry {

    /// Registers an agent, replacing any agent with the same id.
    ///
    /// @param agent agent to register, not null
    /// @return the registered agent, never null
    Agent register(Agent agent);

    /// Removes an agent.
    ///
    /// @param agentId agent identifier, not null
    /// @return `true` if an agent was removed
    boolean unregister(String agentId);

    /// Looks up an agent.
    ///
    /// @param agentId agent identifier, not null
    /// @return the agent, or empty if not registered
    Optional<Agent> getAgent(String agentId);

    /// Checks whether an agent is registered.
    default boolean hasAgent(String agentId) {
        return getAgent(agentId).isPresent();
    }

    /// Sets an agent's workload.
    ///
    /// @param agentId agent identifier, not null
    /// @param workload new workload, must be >= 0
    /// @return the updated agent, never null
    /// @throws io.conclave.core.exception.ValidationException if the agent is unknown or
    ///     the workload is negative
    Agent updateWorkload(String agentId, int workload);

    /// Adds a delta to an agent's workload, clamping the result at zero.
    ///
    /// @param agentId agent identifier, not null
    /// @param delta amount to add, may be negative
    /// @return the updated agent, never null
    /// @throws io.conclave.core.exception.ValidationException if the agent is unknown
    Agent adjustWorkload(String agentId, int delta);

    /// Returns all agents ordered by id.
    ///
    /// @return immutable snapshot, never null (may be empty)
    List<Agent> getAgents();

    /// Returns the number of registered agents.
    int size();
}

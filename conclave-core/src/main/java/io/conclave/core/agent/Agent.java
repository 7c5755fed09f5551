package io.conclave.core.agent;

import java.util.Objects;
import java.util.Set;

/// Worker that can be assigned tasks.
///
/// Immutable snapshot: registries replace the whole record when workload or
/// capacity changes, the id never changes.
///
/// ### Contracts
/// - **Invariant**: `workload >= 0`
/// - **Invariant**: `capacity > 0`
///
/// @param id unique identifier, not null
/// @param type role tag, not null
/// @param name display name, defaults to the id
/// @param expertise declared expertise keywords, never null
/// @param workload number of tasks currently held
/// @param capacity maximum number of tasks the agent is expected to hold
public record Agent(
        String id, AgentType type, String name, Set<String> expertise, int workload, int capacity) {

    public Agent {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(type, "type must not be null");
        if (id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        if (workload < 0) {
            throw new IllegalArgumentException("workload must be >= 0, got " + workload);
        }
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0, got " + capacity);
        }
        name = name != null ? name : id;
        expertise = expertise != null ? Set.copyOf(expertise) : Set.of();
    }

    /// Creates an idle agent.
    public static Agent of(String id, AgentType type, int capacity, String... expertise) {
        return new Agent(id, type, id, Set.of(expertise), 0, capacity);
    }

    /// Returns a copy with a different workload.
    ///
    /// @param newWorkload workload, must be >= 0
    /// @return updated agent, never null
    public Agent withWorkload(int newWorkload) {
        return new Agent(id, type, name, expertise, newWorkload, capacity);
    }

    /// Returns a copy with a different capacity.
    public Agent withCapacity(int newCapacity) {
        return new Agent(id, type, name, expertise, workload, newCapacity);
    }

    /// Returns `workload / capacity`. Values above 1.0 mean the agent is overloaded.
    public double utilization() {
        return (double) workload / capacity;
    }

    /// Returns whether the agent has no spare capacity.
    public boolean isAtCapacity() {
        return workload >= capacity;
    }
}

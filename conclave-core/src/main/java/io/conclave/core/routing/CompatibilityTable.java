package io.conclave.core.routing;

import io.conclave.core.agent.AgentType;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/// Fixed mapping from task type to the agent types allowed to take it.
///
/// Task types missing from the table are unrestricted: every agent type is compatible.
///
/// @implNote Immutable once built. Safe to share across threads.
public final class CompatibilityTable {

    private final Map<String, Set<AgentType>> entries;

    private CompatibilityTable(Map<String, Set<AgentType>> entries) {
        this.entries = Map.copyOf(entries);
    }

    /// Returns the built-in table.
    ///
    /// | task type         | agent type   |
    /// |-------------------|--------------|
    /// | `code_generation` | `coder`      |
    /// | `code_review`     | `reviewer`   |
    /// | `testing`         | `tester`     |
    /// | `debugging`       | `debugger`   |
    /// | `optimization`    | `optimizer`  |
    /// | `planning`        | `planner`    |
    /// | `research`        | `researcher` |
    ///
    /// @return default table, never null
    public static CompatibilityTable defaults() {
        return builder()
                .allow("code_generation", AgentType.CODER)
                .allow("code_review", AgentType.REVIEWER)
                .allow("testing", AgentType.TESTER)
                .allow("debugging", AgentType.DEBUGGER)
                .allow("optimization", AgentType.OPTIMIZER)
                .allow("planning", AgentType.PLANNER)
                .allow("research", AgentType.RESEARCHER)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Returns the agent types allowed for a task type.
    ///
    /// @param taskType task type, not null
    /// @return allowed types, or empty when the task type is unrestricted
    public Optional<Set<AgentType>> compatibleTypes(String taskType) {
        return Optional.ofNullable(entries.get(taskType));
    }

    /// Returns a task type that the given agent type may take, preferring the alphabetically
    /// first when several exist.
    ///
    /// @param agentType agent type, not null
    /// @return a compatible task type, or empty if the table names none
    public Optional<String> taskTypeFor(AgentType agentType) {
        return entries.entrySet().stream()
                .filter(e -> e.getValue().contains(agentType))
                .map(Map.Entry::getKey)
                .sorted()
                .findFirst();
    }

    /// Checks whether an agent type may take a task type.
    public boolean isCompatible(String taskType, AgentType agentType) {
        return compatibleTypes(taskType).map(types -> types.contains(agentType)).orElse(true);
    }

    public static final class Builder {
        private final Map<String, Set<AgentType>> entries = new HashMap<>();

        private Builder() {}

        public Builder allow(String taskType, AgentType first, AgentType... rest) {
            Objects.requireNonNull(taskType, "taskType must not be null");
            entries.computeIfAbsent(taskType, k -> EnumSet.noneOf(AgentType.class))
                    .addAll(EnumSet.of(first, rest));
            return this;
        }

        public CompatibilityTable build() {
            Map<String, Set<AgentType>> frozen = new HashMap<>();
            entries.forEach((k, v) -> frozen.put(k, Set.copyOf(v)));
            return new CompatibilityTable(frozen);
        }
    }
}

package io.conclave.core.agent;

import java.util.Arrays;
import java.util.Locale;

/// Role tag of an agent.
public enum AgentType {
    PLANNER("planner"),
    CODER("coder"),
    REVIEWER("reviewer"),
    DEBUGGER("debugger"),
    OPTIMIZER("optimizer"),
    TESTER("tester"),
    RESEARCHER("researcher");

    private final String wireName;

    AgentType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /// Resolves a type from its wire name, case-insensitively.
    ///
    /// @param value wire name such as `coder`, not null
    /// @return matching type, never null
    /// @throws IllegalArgumentException if no type matches
    public static AgentType fromWireName(String value) {
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(t -> t.wireName.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown agent type: " + value));
    }

    @Override
    public String toString() {
        return wireName;
    }
}

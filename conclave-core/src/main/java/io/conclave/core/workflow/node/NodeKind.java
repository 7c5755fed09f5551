package io.conclave.core.workflow.node;

import io.conclave.core.exception.ValidationException;
import java.util.Arrays;
import java.util.Locale;

/// Discriminator of the {@link WorkflowNode} variants.
public enum NodeKind {
    AGENT("agent"),
    PROCESS("process"),
    DECISION("decision");

    private final String wireName;

    NodeKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /// Resolves a kind from its wire name.
    ///
    /// @param value wire name such as `agent`
    /// @return matching kind, never null
    /// @throws ValidationException with "Unknown node type" if no kind matches
    public static NodeKind fromWireName(String value) {
        String normalized = value != null ? value.trim().toLowerCase(Locale.ROOT) : "";
        return Arrays.stream(values())
                .filter(k -> k.wireName.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new ValidationException("Unknown node type: " + value));
    }

    @Override
    public String toString() {
        return wireName;
    }
}

package io.conclave.core.workflow.node;

import java.util.Objects;

/// Node that evaluates a branch outcome.
///
/// The outcome is recorded in the context under `decision`. Execution continues along the
/// first outbound edge in insertion order regardless of the outcome.
///
/// @param id node id, not null
/// @param label the question being decided, defaults to the id
public record DecisionNode(String id, String label) implements WorkflowNode {

    public DecisionNode {
        Objects.requireNonNull(id, "id must not be null");
        label = label != null ? label : id;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.DECISION;
    }
}

package io.conclave.core.workflow.node;

import java.util.Objects;

/// Node that applies a transform step without involving an agent.
///
/// @param id node id, not null
/// @param label description of the step, defaults to the id
/// @param processType key of a registered process step, or null for the generic transform
public record ProcessNode(String id, String label, String processType) implements WorkflowNode {

    public ProcessNode {
        Objects.requireNonNull(id, "id must not be null");
        label = label != null ? label : id;
    }

    public static ProcessNode of(String id, String label) {
        return new ProcessNode(id, label, null);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.PROCESS;
    }
}

package io.conclave.core.workflow;

import io.conclave.core.workflow.node.WorkflowNode;
import java.util.List;
import java.util.Objects;

/// Whole workflow graph as loaded from a file or built in code.
///
/// @param id workflow identifier, not null
/// @param initialNodeId node where execution starts, not null
/// @param nodes nodes in insertion order, never null
/// @param edges edges in insertion order, never null
public record WorkflowDefinition(
        String id, String initialNodeId, List<WorkflowNode> nodes, List<GraphEdge> edges) {

    public WorkflowDefinition {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(initialNodeId, "initialNodeId must not be null");
        nodes = nodes != null ? List.copyOf(nodes) : List.of();
        edges = edges != null ? List.copyOf(edges) : List.of();
    }
}

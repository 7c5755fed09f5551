package io.conclave.core.workflow.node;

/// Step of a workflow graph.
///
/// Closed set of variants, each carrying only the fields its kind needs:
/// - {@link AgentNode}: delegated to an agent of a given type
/// - {@link ProcessNode}: a deterministic transform step
/// - {@link DecisionNode}: evaluates a branch outcome
///
/// @see NodeKind for the discriminator used on the wire
public sealed interface WorkflowNode permits AgentNode, ProcessNode, DecisionNode {

    /// Returns the node id, unique within its graph.
    ///
    /// @return node id, never null
    String id();

    /// Returns the human-readable label.
    ///
    /// @return label, never null
    String label();

    /// Returns the variant discriminator.
    ///
    /// @return kind, never null
    NodeKind kind();
}

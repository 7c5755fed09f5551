package io.conclave.core.workflow.processor;

import io.conclave.core.workflow.node.WorkflowNode;

/// Strategy for processing one node variant.
///
/// Implementations are stateless and thread-safe; all execution state arrives through the
/// {@link NodeContext}.
///
/// @param <T> the node variant this processor handles
public interface NodeProcessor<T extends WorkflowNode> {

    /// Returns the node variant this processor handles. Used for registry lookups.
    Class<T> getNodeType();

    /// Processes a node.
    ///
    /// @param node node to process, not null
    /// @param context execution services and state, not null
    /// @return output to merge, never null
    /// @throws Exception if processing fails; the orchestrator captures it into the result
    NodeOutput process(T node, NodeContext context) throws Exception;
}

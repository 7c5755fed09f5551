package io.conclave.core.workflow;

import io.conclave.core.workflow.node.WorkflowNode;
import io.conclave.core.workflow.processor.NodeOutput;
import java.util.Map;

/// Listener for workflow execution lifecycle callbacks.
///
/// All methods have default no-op implementations.
///
/// ### Callback Lifecycle
/// ```
/// onStart(executionId, initialNodeId)
/// onNodeStart(executionId, node)         about to process node
/// onNodeComplete(executionId, node, out) output produced, not yet merged
/// onCheckpoint(executionId, nodeId, ctx) output merged, safe to persist
/// ...
/// onComplete(result)
/// ```
///
/// @implNote With asynchronous execution, callbacks for one execution arrive on executor
/// threads but never concurrently with each other.
public interface WorkflowListener {

    WorkflowListener NOOP = new WorkflowListener() {};

    default void onStart(String executionId, String initialNodeId) {}

    default void onNodeStart(String executionId, WorkflowNode node) {}

    default void onNodeComplete(String executionId, WorkflowNode node, NodeOutput output) {}

    /// Called after a node's output has been merged into the context.
    ///
    /// @param context unmodifiable view of the context, valid only during the call
    default void onCheckpoint(String executionId, String nodeId, Map<String, Object> context) {}

    default void onComplete(WorkflowResult result) {}
}

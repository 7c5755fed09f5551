package io.conclave.core.workflow.processor;

import io.conclave.core.workflow.node.WorkflowNode;
import java.util.Optional;

/// Type-keyed lookup of {@link NodeProcessor}s.
public interface NodeProcessorRegistry {

    <T extends WorkflowNode> Optional<NodeProcessor<T>> getProcessor(Class<T> nodeType);

    <T extends WorkflowNode> void register(NodeProcessor<T> processor);

    boolean hasProcessor(Class<? extends WorkflowNode> nodeType);
}

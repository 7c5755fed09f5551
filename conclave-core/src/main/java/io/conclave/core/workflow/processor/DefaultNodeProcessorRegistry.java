package io.conclave.core.workflow.processor;

import io.conclave.core.workflow.node.WorkflowNode;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/// Default {@link NodeProcessorRegistry} with the built-in processors pre-registered.
///
/// Registering a processor for a node type replaces the built-in one.
public class DefaultNodeProcessorRegistry implements NodeProcessorRegistry {

    private final Map<Class<? extends WorkflowNode>, NodeProcessor<?>> registry =
            new ConcurrentHashMap<>();

    /// Creates a registry with all built-in processors registered.
    public DefaultNodeProcessorRegistry() {
        register(new AgentNodeProcessor());
        register(new ProcessNodeProcessor());
        register(new DecisionNodeProcessor());
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T extends WorkflowNode> Optional<NodeProcessor<T>> getProcessor(Class<T> nodeType) {
        return Optional.ofNullable((NodeProcessor<T>) registry.get(nodeType));
    }

    @Override
    public <T extends WorkflowNode> void register(NodeProcessor<T> processor) {
        registry.put(processor.getNodeType(), processor);
    }

    @Override
    public boolean hasProcessor(Class<? extends WorkflowNode> nodeType) {
        return registry.containsKey(nodeType);
    }
}

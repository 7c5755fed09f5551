package io.conclave.core.workflow.processor;

import io.conclave.core.capability.AgentInvocation;
import io.conclave.core.exception.InternalException;
import io.conclave.core.workflow.node.AgentNode;

/// Delegates an {@link AgentNode} to the configured agent capability.
public class AgentNodeProcessor implements NodeProcessor<AgentNode> {

    @Override
    public Class<AgentNode> getNodeType() {
        return AgentNode.class;
    }

    @Override
    public NodeOutput process(AgentNode node, NodeContext context) {
        var invoker =
                context.invoker()
                        .orElseThrow(
                                () ->
                                        new InternalException(
                                                "No agent invoker configured for node "
                                                        + node.id()));
        return NodeOutput.of(
                invoker.invoke(
                        new AgentInvocation(
                                node.id(), node.label(), node.agentType(), context.context())));
    }
}

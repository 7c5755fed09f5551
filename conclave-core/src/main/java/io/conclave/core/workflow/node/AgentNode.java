package io.conclave.core.workflow.node;

import io.conclave.core.agent.AgentType;
import java.util.Objects;

/// Node run by an agent of the given type.
///
/// @param id node id, not null
/// @param label description of the work, defaults to the id
/// @param agentType role the step needs, not null
public record AgentNode(String id, String label, AgentType agentType) implements WorkflowNode {

    public AgentNode {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(agentType, "agentType must not be null");
        label = label != null ? label : id;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.AGENT;
    }
}

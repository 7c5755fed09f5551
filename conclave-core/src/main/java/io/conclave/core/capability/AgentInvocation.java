package io.conclave.core.capability;

import io.conclave.core.agent.AgentType;
import java.util.Map;
import java.util.Objects;

/// Request to run one agent step of a workflow.
///
/// @param nodeId workflow node requesting the step, not null
/// @param label human-readable description of the step, never null
/// @param agentType role the step needs, not null
/// @param context workflow context at the time of the call, never null
public record AgentInvocation(
        String nodeId, String label, AgentType agentType, Map<String, Object> context) {

    public AgentInvocation {
        Objects.requireNonNull(nodeId, "nodeId must not be null");
        Objects.requireNonNull(agentType, "agentType must not be null");
        label = label != null ? label : nodeId;
        context = context != null ? context : Map.of();
    }
}

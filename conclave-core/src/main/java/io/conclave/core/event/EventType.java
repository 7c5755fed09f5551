package io.conclave.core.event;

import java.util.Arrays;
import java.util.Optional;

/// Closed set of event types announced on the {@link EventBus}.
///
/// Each constant carries its dot-namespaced wire name and the payload record it
/// pairs with. The pairing is fixed: a {@link CoordinationEvent}'s type is always
/// derived from its payload, never supplied separately.
public enum EventType {
    AGENT_REGISTERED("agent.registered", EventPayload.AgentRegistered.class),
    AGENT_UNREGISTERED("agent.unregistered", EventPayload.AgentUnregistered.class),
    AGENT_WORKLOAD_UPDATED("agent.workload.updated", EventPayload.AgentWorkloadUpdated.class),
    TASK_ROUTED("task.routed", EventPayload.TaskRouted.class),
    VOTE_SESSION_CREATED("vote.session.created", EventPayload.VoteSessionCreated.class),
    VOTE_CAST("vote.cast", EventPayload.VoteCast.class),
    VOTE_SESSION_CLOSED("vote.session.closed", EventPayload.VoteSessionClosed.class),
    HANDOFF_INITIATED("handoff.initiated", EventPayload.HandoffInitiated.class),
    HANDOFF_COMPLETED("handoff.completed", EventPayload.HandoffCompleted.class),
    HANDOFF_FAILED("handoff.failed", EventPayload.HandoffFailed.class),
    HANDSHAKE_COMPLETED("a2a.handshake.completed", EventPayload.HandshakeCompleted.class),
    STATE_SYNCED("a2a.state.synced", EventPayload.StateSynced.class),
    TASK_NEGOTIATED("a2a.task.negotiated", EventPayload.TaskNegotiated.class),
    WORKFLOW_STARTED("workflow.started", EventPayload.WorkflowStarted.class),
    WORKFLOW_NODE_COMPLETED("workflow.node.completed", EventPayload.WorkflowNodeCompleted.class),
    WORKFLOW_COMPLETED("workflow.completed", EventPayload.WorkflowCompleted.class),
    WORKFLOW_FAILED("workflow.failed", EventPayload.WorkflowFailed.class);

    private final String wireName;
    private final Class<? extends EventPayload> payloadType;

    EventType(String wireName, Class<? extends EventPayload> payloadType) {
        this.wireName = wireName;
        this.payloadType = payloadType;
    }

    /// Returns the dot-namespaced name used in serialized envelopes.
    ///
    /// @return wire name, never null
    public String wireName() {
        return wireName;
    }

    /// Returns the payload record paired with this type.
    ///
    /// @return payload class, never null
    public Class<? extends EventPayload> payloadType() {
        return payloadType;
    }

    /// Resolves a type from its wire name.
    ///
    /// @param wireName dot-namespaced name, may be null
    /// @return matching type, or empty if none matches
    public static Optional<EventType> fromWireName(String wireName) {
        return Arrays.stream(values()).filter(t -> t.wireName.equals(wireName)).findFirst();
    }

    @Override
    public String toString() {
        return wireName;
    }
}

package io.conclave.core.event;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Type-specific content of a {@link CoordinationEvent}.
///
/// The set of payloads is closed. Subscribers either register for one payload record
/// class or switch over {@link #type()} exhaustively; no payload is ever a loose map.
///
/// ### Event Flow
/// ```
/// agent.registered → task.routed → handoff.initiated → handoff.completed
/// vote.session.created → vote.cast* → vote.session.closed
/// workflow.started → workflow.node.completed* → workflow.completed | workflow.failed
/// ```
///
/// @see EventType for the wire name of each payload
public sealed interface EventPayload {

    /// Returns the event type this payload belongs to.
    ///
    /// @return event type, never null
    EventType type();

    /// Emitted when an agent joins a registry.
    record AgentRegistered(String agentId, String agentType, int capacity)
            implements EventPayload {
        public AgentRegistered {
            Objects.requireNonNull(agentId, "agentId must not be null");
        }

        @Override
        public EventType type() {
            return EventType.AGENT_REGISTERED;
        }
    }

    /// Emitted when an agent leaves a registry.
    record AgentUnregistered(String agentId) implements EventPayload {
        public AgentUnregistered {
            Objects.requireNonNull(agentId, "agentId must not be null");
        }

        @Override
        public EventType type() {
            return EventType.AGENT_UNREGISTERED;
        }
    }

    /// Emitted when an agent's workload changes.
    record AgentWorkloadUpdated(String agentId, int workload, int capacity)
            implements EventPayload {
        public AgentWorkloadUpdated {
            Objects.requireNonNull(agentId, "agentId must not be null");
        }

        @Override
        public EventType type() {
            return EventType.AGENT_WORKLOAD_UPDATED;
        }
    }

    /// Emitted when a task has been assigned to an agent.
    ///
    /// @param degraded true when every candidate was at or over capacity
    record TaskRouted(String taskId, String agentId, double confidence, boolean degraded)
            implements EventPayload {
        public TaskRouted {
            Objects.requireNonNull(taskId, "taskId must not be null");
            Objects.requireNonNull(agentId, "agentId must not be null");
        }

        @Override
        public EventType type() {
            return EventType.TASK_ROUTED;
        }
    }

    record VoteSessionCreated(String sessionId, String topic, List<String> optionIds, int quorum)
            implements EventPayload {
        public VoteSessionCreated {
            Objects.requireNonNull(sessionId, "sessionId must not be null");
            optionIds = optionIds != null ? List.copyOf(optionIds) : List.of();
        }

        @Override
        public EventType type() {
            return EventType.VOTE_SESSION_CREATED;
        }
    }

    /// Emitted for every accepted vote.
    ///
    /// @param replaced true when the vote overwrote an earlier one from the same agent
    record VoteCast(String sessionId, String agentId, String optionId, boolean replaced)
            implements EventPayload {
        public VoteCast {
            Objects.requireNonNull(sessionId, "sessionId must not be null");
            Objects.requireNonNull(agentId, "agentId must not be null");
            Objects.requireNonNull(optionId, "optionId must not be null");
        }

        @Override
        public EventType type() {
            return EventType.VOTE_CAST;
        }
    }

    /// Emitted once per session, on the first close.
    ///
    /// @param winningOptionId winner, or null when there is none
    record VoteSessionClosed(
            String sessionId,
            String winningOptionId,
            boolean consensusReached,
            Map<String, Double> tally)
            implements EventPayload {
        public VoteSessionClosed {
            Objects.requireNonNull(sessionId, "sessionId must not be null");
            tally = tally != null ? Map.copyOf(tally) : Map.of();
        }

        @Override
        public EventType type() {
            return EventType.VOTE_SESSION_CLOSED;
        }
    }

    record HandoffInitiated(
            String handoffId,
            String sourceAgentId,
            String targetAgentId,
            String taskId,
            int originalSize,
            int compressedSize)
            implements EventPayload {
        public HandoffInitiated {
            Objects.requireNonNull(handoffId, "handoffId must not be null");
        }

        @Override
        public EventType type() {
            return EventType.HANDOFF_INITIATED;
        }
    }

    record HandoffCompleted(String handoffId, String targetAgentId) implements EventPayload {
        public HandoffCompleted {
            Objects.requireNonNull(handoffId, "handoffId must not be null");
        }

        @Override
        public EventType type() {
            return EventType.HANDOFF_COMPLETED;
        }
    }

    /// Emitted when a handoff cannot be created or cannot be consumed.
    ///
    /// @param handoffId id of the failed record, or null when initiation was aborted
    record HandoffFailed(
            String handoffId, String sourceAgentId, String targetAgentId, String reason)
            implements EventPayload {
        public HandoffFailed {
            Objects.requireNonNull(reason, "reason must not be null");
        }

        @Override
        public EventType type() {
            return EventType.HANDOFF_FAILED;
        }
    }

    record HandshakeCompleted(
            String handshakeId,
            String sourceAgentId,
            String targetAgentId,
            String protocolVersion,
            boolean accepted)
            implements EventPayload {
        public HandshakeCompleted {
            Objects.requireNonNull(handshakeId, "handshakeId must not be null");
        }

        @Override
        public EventType type() {
            return EventType.HANDSHAKE_COMPLETED;
        }
    }

    record StateSynced(String syncId, String handshakeId, String syncType, List<String> keys)
            implements EventPayload {
        public StateSynced {
            Objects.requireNonNull(syncId, "syncId must not be null");
            keys = keys != null ? List.copyOf(keys) : List.of();
        }

        @Override
        public EventType type() {
            return EventType.STATE_SYNCED;
        }
    }

    record TaskNegotiated(
            String negotiationId,
            String handshakeId,
            String taskId,
            boolean accepted,
            long estimatedLatencyMs)
            implements EventPayload {
        public TaskNegotiated {
            Objects.requireNonNull(negotiationId, "negotiationId must not be null");
        }

        @Override
        public EventType type() {
            return EventType.TASK_NEGOTIATED;
        }
    }

    record WorkflowStarted(String executionId, String initialNodeId) implements EventPayload {
        public WorkflowStarted {
            Objects.requireNonNull(executionId, "executionId must not be null");
        }

        @Override
        public EventType type() {
            return EventType.WORKFLOW_STARTED;
        }
    }

    /// Emitted after each processed node.
    ///
    /// @param nodeKind wire name of the node kind
    /// @param step one-based position of the node in the execution path
    record WorkflowNodeCompleted(String executionId, String nodeId, String nodeKind, int step)
            implements EventPayload {
        public WorkflowNodeCompleted {
            Objects.requireNonNull(executionId, "executionId must not be null");
            Objects.requireNonNull(nodeId, "nodeId must not be null");
        }

        @Override
        public EventType type() {
            return EventType.WORKFLOW_NODE_COMPLETED;
        }
    }

    record WorkflowCompleted(String executionId, List<String> executionPath)
            implements EventPayload {
        public WorkflowCompleted {
            Objects.requireNonNull(executionId, "executionId must not be null");
            executionPath = executionPath != null ? List.copyOf(executionPath) : List.of();
        }

        @Override
        public EventType type() {
            return EventType.WORKFLOW_COMPLETED;
        }
    }

    record WorkflowFailed(
            String executionId, List<String> executionPath, String errorKind, String message)
            implements EventPayload {
        public WorkflowFailed {
            Objects.requireNonNull(executionId, "executionId must not be null");
            executionPath = executionPath != null ? List.copyOf(executionPath) : List.of();
        }

        @Override
        public EventType type() {
            return EventType.WORKFLOW_FAILED;
        }
    }
}

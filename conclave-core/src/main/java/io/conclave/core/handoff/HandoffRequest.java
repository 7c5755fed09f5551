package io.conclave.core.handoff;

import java.util.Map;
import java.util.Objects;

/// Request to move a task's context from one agent to another.
///
/// @param sourceAgentId agent giving up the task, not null
/// @param targetAgentId agent taking over, not null
/// @param taskId task whose context moves, not null
/// @param context accumulated task state, never null
/// @param reason optional free-text reason recorded with the handoff
public record HandoffRequest(
        String sourceAgentId,
        String targetAgentId,
        String taskId,
        Map<String, Object> context,
        String reason) {

    public HandoffRequest {
        Objects.requireNonNull(sourceAgentId, "sourceAgentId must not be null");
        Objects.requireNonNull(targetAgentId, "targetAgentId must not be null");
        Objects.requireNonNull(taskId, "taskId must not be null");
        context = context != null ? context : Map.of();
    }

    public static HandoffRequest of(
            String sourceAgentId,
            String targetAgentId,
            String taskId,
            Map<String, Object> context) {
        return new HandoffRequest(sourceAgentId, targetAgentId, taskId, context, null);
    }
}

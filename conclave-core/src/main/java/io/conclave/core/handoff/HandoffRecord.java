package io.conclave.core.handoff;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/// Stored state of one handoff.
///
/// Immutable. A status change produces a new record; the repository replaces the old one.
///
/// ### Contracts
/// - **Invariant**: transitions only `PENDING -> COMPLETED` or `PENDING -> FAILED`
/// - **Invariant**: `completedAt` is set exactly when the status is terminal
///
/// @param handoffId unique identifier, not null
/// @param sourceAgentId agent giving up the task, not null
/// @param targetAgentId only agent allowed to complete the handoff, not null
/// @param taskId task whose context moves, not null
/// @param compressedPayload compressed serialized context, copied on access
/// @param originalSize serialized context size in bytes
/// @param status lifecycle state, not null
/// @param reason request reason, may be null
/// @param failureReason why the handoff failed, null unless failed
/// @param createdAt initiation time, not null
/// @param completedAt terminal transition time, null while pending
public record HandoffRecord(
        String handoffId,
        String sourceAgentId,
        String targetAgentId,
        String taskId,
        byte[] compressedPayload,
        int originalSize,
        HandoffStatus status,
        String reason,
        String failureReason,
        Instant createdAt,
        Instant completedAt) {

    public HandoffRecord {
        Objects.requireNonNull(handoffId, "handoffId must not be null");
        Objects.requireNonNull(sourceAgentId, "sourceAgentId must not be null");
        Objects.requireNonNull(targetAgentId, "targetAgentId must not be null");
        Objects.requireNonNull(taskId, "taskId must not be null");
        Objects.requireNonNull(compressedPayload, "compressedPayload must not be null");
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
        compressedPayload = compressedPayload.clone();
    }

    static HandoffRecord pending(
            String handoffId, HandoffRequest request, byte[] payload, int originalSize) {
        return new HandoffRecord(
                handoffId,
                request.sourceAgentId(),
                request.targetAgentId(),
                request.taskId(),
                payload,
                originalSize,
                HandoffStatus.PENDING,
                request.reason(),
                null,
                Instant.now(),
                null);
    }

    @Override
    public byte[] compressedPayload() {
        return compressedPayload.clone();
    }

    public int compressedSize() {
        return compressedPayload.length;
    }

    HandoffRecord completed() {
        return new HandoffRecord(
                handoffId, sourceAgentId, targetAgentId, taskId, compressedPayload, originalSize,
                HandoffStatus.COMPLETED, reason, null, createdAt, Instant.now());
    }

    HandoffRecord failed(String why) {
        return new HandoffRecord(
                handoffId, sourceAgentId, targetAgentId, taskId, compressedPayload, originalSize,
                HandoffStatus.FAILED, reason, why, createdAt, Instant.now());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof HandoffRecord other)) {
            return false;
        }
        return originalSize == other.originalSize
                && handoffId.equals(other.handoffId)
                && sourceAgentId.equals(other.sourceAgentId)
                && targetAgentId.equals(other.targetAgentId)
                && taskId.equals(other.taskId)
                && Arrays.equals(compressedPayload, other.compressedPayload)
                && status == other.status
                && Objects.equals(reason, other.reason)
                && Objects.equals(failureReason, other.failureReason)
                && createdAt.equals(other.createdAt)
                && Objects.equals(completedAt, other.completedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(handoffId, status, Arrays.hashCode(compressedPayload));
    }

    @Override
    public String toString() {
        return "HandoffRecord[" + handoffId + ", " + sourceAgentId + " -> " + targetAgentId
                + ", task=" + taskId + ", status=" + status + ", bytes=" + compressedPayload.length
                + "]";
    }
}

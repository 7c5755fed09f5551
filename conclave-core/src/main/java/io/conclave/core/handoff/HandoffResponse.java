package io.conclave.core.handoff;

import io.conclave.core.exception.CoordinationError;

/// Outcome of {@link ContextHandoffManager#initiateHandoff}.
///
/// @param success whether a pending handoff was stored
/// @param handoffId id of the stored handoff, null on failure
/// @param originalSize serialized context size in bytes, 0 on failure
/// @param compressedSize compressed payload size in bytes, 0 on failure
/// @param error failure detail, null on success
public record HandoffResponse(
        boolean success,
        String handoffId,
        int originalSize,
        int compressedSize,
        CoordinationError error) {

    static HandoffResponse ok(String handoffId, int originalSize, int compressedSize) {
        return new HandoffResponse(true, handoffId, originalSize, compressedSize, null);
    }

    static HandoffResponse failed(CoordinationError error) {
        return new HandoffResponse(false, null, 0, 0, error);
    }

    /// Returns `compressedSize / originalSize`, or 0 when nothing was stored.
    public double compressionRatio() {
        return originalSize > 0 ? (double) compressedSize / originalSize : 0.0;
    }
}

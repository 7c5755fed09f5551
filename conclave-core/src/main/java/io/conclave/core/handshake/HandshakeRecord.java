package io.conclave.core.handshake;

import java.time.Instant;
import java.util.Objects;
import java.util.Set;

/// Recorded handshake attempt. Immutable once created.
///
/// @param handshakeId unique identifier, not null
/// @param sourceAgentId initiating agent, not null
/// @param targetAgentId partner agent, not null
/// @param capabilities negotiated capabilities, empty when rejected
/// @param protocolVersion agreed version, or the target's version when rejected
/// @param accepted whether the parties agreed
/// @param createdAt creation time, not null
public record HandshakeRecord(
        String handshakeId,
        String sourceAgentId,
        String targetAgentId,
        Set<String> capabilities,
        String protocolVersion,
        boolean accepted,
        Instant createdAt) {

    public HandshakeRecord {
        Objects.requireNonNull(handshakeId, "handshakeId must not be null");
        Objects.requireNonNull(sourceAgentId, "sourceAgentId must not be null");
        Objects.requireNonNull(targetAgentId, "targetAgentId must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
        capabilities = capabilities != null ? Set.copyOf(capabilities) : Set.of();
    }

    /// Returns the other party of this handshake.
    ///
    /// @param agentId one party, not null
    /// @return the other party, or null if agentId is not a party
    public String counterpartOf(String agentId) {
        if (sourceAgentId.equals(agentId)) {
            return targetAgentId;
        }
        if (targetAgentId.equals(agentId)) {
            return sourceAgentId;
        }
        return null;
    }
}

package io.conclave.core.handshake;

import java.util.Objects;
import java.util.Set;

/// Request from one agent to collaborate with another.
///
/// @param sourceAgentId initiating agent, not null
/// @param targetAgentId requested partner, not null
/// @param protocolVersion version the source speaks, not null
/// @param capabilities capabilities the source wants to use, never null
public record HandshakeRequest(
        String sourceAgentId,
        String targetAgentId,
        String protocolVersion,
        Set<String> capabilities) {

    public HandshakeRequest {
        Objects.requireNonNull(sourceAgentId, "sourceAgentId must not be null");
        Objects.requireNonNull(targetAgentId, "targetAgentId must not be null");
        Objects.requireNonNull(protocolVersion, "protocolVersion must not be null");
        capabilities = capabilities != null ? Set.copyOf(capabilities) : Set.of();
    }
}

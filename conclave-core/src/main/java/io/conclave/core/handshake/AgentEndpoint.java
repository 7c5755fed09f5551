package io.conclave.core.handshake;

import java.util.Objects;
import java.util.Set;

/// Protocol version and capabilities an agent advertises to handshake partners.
///
/// @param agentId agent identifier, not null
/// @param protocolVersion `major.minor` version string, not null
/// @param capabilities capabilities the agent offers, never null
public record AgentEndpoint(String agentId, String protocolVersion, Set<String> capabilities) {

    public AgentEndpoint {
        Objects.requireNonNull(agentId, "agentId must not be null");
        Objects.requireNonNull(protocolVersion, "protocolVersion must not be null");
        capabilities = capabilities != null ? Set.copyOf(capabilities) : Set.of();
    }
}

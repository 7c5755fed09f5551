package io.conclave.core.handshake;

import java.util.Objects;

/// Configuration of a {@link HandshakeMediator}.
///
/// @param protocolVersion version assumed for targets that registered no endpoint
/// @param handshakeEnabled whether new handshakes are processed
/// @param stateSyncEnabled whether {@link HandshakeMediator#syncState} is processed
/// @param taskNegotiationEnabled whether {@link HandshakeMediator#negotiateTask} is processed
/// @param maxActiveHandshakes cap on handshake requests negotiated at the same time
public record HandshakeSettings(
        String protocolVersion,
        boolean handshakeEnabled,
        boolean stateSyncEnabled,
        boolean taskNegotiationEnabled,
        int maxActiveHandshakes) {

    public static final String DEFAULT_PROTOCOL_VERSION = "1.0";
    public static final int DEFAULT_MAX_ACTIVE_HANDSHAKES = 10;

    public HandshakeSettings {
        Objects.requireNonNull(protocolVersion, "protocolVersion must not be null");
        if (maxActiveHandshakes <= 0) {
            throw new IllegalArgumentException("maxActiveHandshakes must be positive");
        }
    }

    public static HandshakeSettings defaults() {
        return new HandshakeSettings(
                DEFAULT_PROTOCOL_VERSION, true, true, true, DEFAULT_MAX_ACTIVE_HANDSHAKES);
    }
}

package io.conclave.core.handshake;

import java.util.Map;
import java.util.Objects;

/// State pushed by one party of a handshake to the other.
///
/// @param handshakeId accepted handshake to sync over, not null
/// @param sourceAgentId sending party, not null
/// @param syncType full replacement or incremental merge, not null
/// @param state entries to apply, never null
public record StateSyncRequest(
        String handshakeId, String sourceAgentId, SyncType syncType, Map<String, Object> state) {

    public StateSyncRequest {
        Objects.requireNonNull(handshakeId, "handshakeId must not be null");
        Objects.requireNonNull(sourceAgentId, "sourceAgentId must not be null");
        Objects.requireNonNull(syncType, "syncType must not be null");
        state = state != null ? state : Map.of();
    }
}

package io.conclave.core.handshake;

import io.conclave.core.exception.CoordinationError;

/// Outcome of {@link HandshakeMediator#syncState}.
///
/// @param success whether the state was applied
/// @param syncId id of the applied sync, null on failure
/// @param error failure detail, null on success
public record StateSyncResponse(boolean success, String syncId, CoordinationError error) {

    static StateSyncResponse failed(CoordinationError error) {
        return new StateSyncResponse(false, null, error);
    }
}

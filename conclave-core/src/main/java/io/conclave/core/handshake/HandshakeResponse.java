package io.conclave.core.handshake;

import io.conclave.core.exception.CoordinationError;
import java.util.Set;

/// Outcome of {@link HandshakeMediator#initiateHandshake}.
///
/// `success` says whether the mediator processed the request; `accepted` says whether the
/// parties agreed. A version mismatch is `success=true, accepted=false` with a
/// {@link io.conclave.core.exception.ErrorKind#PROTOCOL} error explaining why.
///
/// @param success whether the request was processed
/// @param accepted whether the handshake was established
/// @param handshakeId id of the recorded attempt, null when not processed
/// @param protocolVersion agreed version when accepted, the target's version otherwise
/// @param capabilities negotiated capabilities, empty unless accepted
/// @param error failure or rejection detail, null when accepted
public record HandshakeResponse(
        boolean success,
        boolean accepted,
        String handshakeId,
        String protocolVersion,
        Set<String> capabilities,
        CoordinationError error) {

    public HandshakeResponse {
        capabilities = capabilities != null ? Set.copyOf(capabilities) : Set.of();
    }

    static HandshakeResponse failed(CoordinationError error) {
        return new HandshakeResponse(false, false, null, null, Set.of(), error);
    }
}

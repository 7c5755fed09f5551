package io.conclave.core.handshake;

import io.conclave.core.exception.CoordinationError;

/// Outcome of {@link HandshakeMediator#negotiateTask}.
///
/// @param success whether the proposal was processed
/// @param accepted whether the partner takes the task
/// @param negotiationId id of the negotiation, null when not processed
/// @param estimatedLatencyMs expected time to start, 0 unless accepted
/// @param handoffId transfer carrying the task context, null when nothing was transferred
/// @param error failure or rejection detail, null when accepted
public record TaskNegotiationResponse(
        boolean success,
        boolean accepted,
        String negotiationId,
        long estimatedLatencyMs,
        String handoffId,
        CoordinationError error) {

    static TaskNegotiationResponse failed(CoordinationError error) {
        return new TaskNegotiationResponse(false, false, null, 0, null, error);
    }
}

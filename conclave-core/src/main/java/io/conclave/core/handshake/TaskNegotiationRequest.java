package io.conclave.core.handshake;

import io.conclave.core.agent.Task;
import java.util.Objects;
import java.util.Set;

/// Proposal to delegate a task over an accepted handshake.
///
/// @param handshakeId accepted handshake, not null
/// @param task task to delegate, not null
/// @param requiredCapabilities capabilities the task needs, never null
public record TaskNegotiationRequest(
        String handshakeId, Task task, Set<String> requiredCapabilities) {

    public TaskNegotiationRequest {
        Objects.requireNonNull(handshakeId, "handshakeId must not be null");
        Objects.requireNonNull(task, "task must not be null");
        requiredCapabilities =
                requiredCapabilities != null ? Set.copyOf(requiredCapabilities) : Set.of();
    }
}

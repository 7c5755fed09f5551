package io.conclave.core.voting;

/// Lifecycle of a voting session. `CLOSED` is terminal.
public enum SessionStatus {
    OPEN,
    CLOSED
}

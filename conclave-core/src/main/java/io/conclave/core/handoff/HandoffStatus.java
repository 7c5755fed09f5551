package io.conclave.core.handoff;

/// Lifecycle of a handoff. `COMPLETED` and `FAILED` are terminal.
public enum HandoffStatus {
    PENDING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}

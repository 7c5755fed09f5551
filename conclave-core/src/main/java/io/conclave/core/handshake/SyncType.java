package io.conclave.core.handshake;

/// How a state sync applies to the receiver's view.
public enum SyncType {
    /// Replace the view wholesale.
    FULL,
    /// Merge key by key; a null value removes the key.
    INCREMENTAL
}

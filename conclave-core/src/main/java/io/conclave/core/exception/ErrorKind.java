package io.conclave.core.exception;

/// Failure categories shared by every coordination component.
///
/// Callers inspect the kind to decide whether a failure is worth retrying.
///
/// - **VALIDATION**: bad or unknown identifier, malformed request
/// - **CAPACITY**: no eligible agent can take the work
/// - **CONFLICT**: a terminal transition was attempted twice
/// - **PROTOCOL**: the parties of a handshake could not agree
/// - **INTERNAL**: iteration cap exceeded or unexpected state
public enum ErrorKind {
    VALIDATION,
    CAPACITY,
    CONFLICT,
    PROTOCOL,
    INTERNAL
}

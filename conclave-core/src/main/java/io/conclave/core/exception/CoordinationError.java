package io.conclave.core.exception;

import java.util.Objects;

/// Structured failure carried by result objects.
///
/// @param kind failure category, not null
/// @param message human-readable detail, not null
public record CoordinationError(ErrorKind kind, String message) {

    public CoordinationError {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    public static CoordinationError validation(String message) {
        return new CoordinationError(ErrorKind.VALIDATION, message);
    }

    public static CoordinationError capacity(String message) {
        return new CoordinationError(ErrorKind.CAPACITY, message);
    }

    public static CoordinationError conflict(String message) {
        return new CoordinationError(ErrorKind.CONFLICT, message);
    }

    public static CoordinationError protocol(String message) {
        return new CoordinationError(ErrorKind.PROTOCOL, message);
    }

    public static CoordinationError internal(String message) {
        return new CoordinationError(ErrorKind.INTERNAL, message);
    }

    @Override
    public String toString() {
        return kind + ": " + message;
    }
}

package io.conclave.core.exception;

import java.io.Serial;
import java.util.Objects;

/// Base exception for operations that fail instead of returning a result.
///
/// Each subclass fixes its {@link ErrorKind}. Use {@link #toError()} to fold the
/// exception into the structured form carried by result objects.
///
/// @see CoordinationError
public abstract class CoordinationException extends RuntimeException {
    @Serial private static final long serialVersionUID = 4127339056118230711L;

    private final ErrorKind kind;

    protected CoordinationException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    protected CoordinationException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    public ErrorKind getKind() {
        return kind;
    }

    /// Converts this exception to its structured form.
    ///
    /// @return error with the same kind and message, never null
    public CoordinationError toError() {
        return new CoordinationError(kind, getMessage() != null ? getMessage() : kind.name());
    }
}

package io.conclave.core.exception;

import java.io.Serial;

public class ConflictException extends CoordinationException {
    @Serial private static final long serialVersionUID = -830227449019554361L;

    public ConflictException(String message) {
        super(ErrorKind.CONFLICT, message);
    }

    public ConflictException(String message, Throwable cause) {
        super(ErrorKind.CONFLICT, message, cause);
    }
}

package io.conclave.core.exception;

import java.io.Serial;

public class ValidationException extends CoordinationException {
    @Serial private static final long serialVersionUID = -2269187634720571822L;

    public ValidationException(String message) {
        super(ErrorKind.VALIDATION, message);
    }

    public ValidationException(String message, Throwable cause) {
        super(ErrorKind.VALIDATION, message, cause);
    }
}

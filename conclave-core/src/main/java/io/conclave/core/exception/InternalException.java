package io.conclave.core.exception;

import java.io.Serial;

public class InternalException extends CoordinationException {
    @Serial private static final long serialVersionUID = -4470211038563019214L;

    public InternalException(String message) {
        super(ErrorKind.INTERNAL, message);
    }

    public InternalException(String message, Throwable cause) {
        super(ErrorKind.INTERNAL, message, cause);
    }
}

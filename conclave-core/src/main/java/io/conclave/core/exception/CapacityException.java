package io.conclave.core.exception;

import java.io.Serial;

public class CapacityException extends CoordinationException {
    @Serial private static final long serialVersionUID = 6653095182261357905L;

    public CapacityException(String message) {
        super(ErrorKind.CAPACITY, message);
    }

    public CapacityException(String message, Throwable cause) {
        super(ErrorKind.CAPACITY, message, cause);
    }
}

package io.conclave.core.exception;

import java.io.Serial;

/// Raised by a compression provider when a payload cannot be compressed or restored.
public class CompressionException extends Exception {
    @Serial private static final long serialVersionUID = 7310457925803664218L;

    public CompressionException(String message) {
        super(message);
    }

    public CompressionException(String message, Throwable cause) {
        super(message, cause);
    }
}

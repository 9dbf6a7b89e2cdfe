package com.evg.common;

/**
 * A backend could not be reached or an I/O call failed in a way that may succeed later.
 * Writers retry with backoff and then redirect the write to the retry buffer.
 */
public class TransientIOException extends PersistenceException {
    private static final long serialVersionUID = 1L;

    public TransientIOException(String message) {
        super(message);
    }

    public TransientIOException(String message, Throwable cause) {
        super(message, cause);
    }
}

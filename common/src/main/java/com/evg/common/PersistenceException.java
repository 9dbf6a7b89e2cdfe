package com.evg.common;

/**
 * Root of the persistence error taxonomy.
 * <p>
 * All failures raised by the key, crypto, ledger, buffer and store components
 * extend this type, so callers can separate persistence faults from programming errors.
 */
public class PersistenceException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}

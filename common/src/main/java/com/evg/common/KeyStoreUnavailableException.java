package com.evg.common;

/**
 * The key provider could not produce or load key material.
 */
public class KeyStoreUnavailableException extends TransientIOException {
    private static final long serialVersionUID = 1L;

    public KeyStoreUnavailableException(String message) {
        super(message);
    }

    public KeyStoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}

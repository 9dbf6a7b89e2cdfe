package com.evg.common;

/**
 * Bytes could not be parsed as an envelope (bad magic, truncated header, invalid key id).
 */
public class EnvelopeFormatException extends PersistenceException {
    private static final long serialVersionUID = 1L;

    public EnvelopeFormatException(String message) {
        super(message);
    }

    public EnvelopeFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}

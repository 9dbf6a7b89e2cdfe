package com.evg.common;

/**
 * The durable backend is unreachable and the retry buffer refuses further entries.
 */
public class StorageUnavailableException extends PersistenceException {
    private static final long serialVersionUID = 1L;

    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.evg.common;

/**
 * Base type for envelope decryption failures. Every subtype fails closed: no plaintext is returned.
 */
public abstract class DecryptException extends PersistenceException {
    private static final long serialVersionUID = 1L;

    private final String keyId;

    protected DecryptException(String keyId, String message) {
        super(message);
        this.keyId = keyId;
    }

    protected DecryptException(String keyId, String message, Throwable cause) {
        super(message, cause);
        this.keyId = keyId;
    }

    public String getKeyId() {
        return keyId;
    }
}

package com.evg.common;

/**
 * Authentication tag verification failed: the ciphertext, tag or nonce was altered.
 */
public class TagMismatchException extends DecryptException {
    private static final long serialVersionUID = 1L;

    public TagMismatchException(String keyId, Throwable cause) {
        super(keyId, "Authentication tag mismatch for key " + keyId, cause);
    }
}

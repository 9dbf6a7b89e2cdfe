package com.evg.common;

/**
 * No retained key handle exists for the key id embedded in an envelope.
 */
public class UnknownKeyIdException extends DecryptException {
    private static final long serialVersionUID = 1L;

    public UnknownKeyIdException(String keyId) {
        super(keyId, "Unknown key id: " + keyId);
    }
}

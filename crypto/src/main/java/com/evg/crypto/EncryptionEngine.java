package com.evg.crypto;

import com.evg.common.KeyHandle;

/**
 * Seals payloads into envelopes bound to {@code "{repoId}:{keyId}"} and opens them again.
 */
public interface EncryptionEngine {

    /** Encrypts under a fresh nonce. */
    Envelope seal(byte[] plaintext, KeyHandle handle);

    /**
     * Authenticates and decrypts. Fails closed: on any failure no plaintext is returned.
     *
     * @throws com.evg.common.AadMismatchException envelope scope does not match {@code repoId} and the handle
     * @throws com.evg.common.TagMismatchException ciphertext or tag was modified
     */
    byte[] open(Envelope envelope, KeyHandle handle, String repoId);

    default byte[] open(byte[] envelopeBytes, KeyHandle handle, String repoId) {
        return open(EnvelopeCodec.decode(envelopeBytes), handle, repoId);
    }
}

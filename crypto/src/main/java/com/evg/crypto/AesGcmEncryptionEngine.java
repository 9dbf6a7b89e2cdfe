package com.evg.crypto;

import com.evg.common.AadMismatchException;
import com.evg.common.KeyHandle;
import com.evg.common.TagMismatchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Objects;

/**
 * AES-256-GCM engine.
 *
 * AAD: "{repoId}:{keyId}"
 *
 * The 16-byte tag is stored explicitly in the envelope and re-attached before decryption.
 */
public class AesGcmEncryptionEngine implements EncryptionEngine {
    private static final Logger logger = LoggerFactory.getLogger(AesGcmEncryptionEngine.class);

    private static final String ALGO = "AES/GCM/NoPadding";
    private static final int TAG_BITS = Envelope.TAG_LEN * 8;

    private final SecureRandom random;

    public AesGcmEncryptionEngine() {
        this(new SecureRandom());
    }

    public AesGcmEncryptionEngine(SecureRandom random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    @Override
    public Envelope seal(byte[] plaintext, KeyHandle handle) {
        Objects.requireNonNull(plaintext, "plaintext");
        Objects.requireNonNull(handle, "handle");

        byte[] nonce = new byte[Envelope.NONCE_LEN];
        random.nextBytes(nonce);
        try {
            Cipher cipher = Cipher.getInstance(ALGO);
            cipher.init(Cipher.ENCRYPT_MODE, handle.getKey(), new GCMParameterSpec(TAG_BITS, nonce));
            cipher.updateAAD(aad(handle.getRepoId(), handle.getKeyId()));
            byte[] out = cipher.doFinal(plaintext);

            int ctLen = out.length - Envelope.TAG_LEN;
            return new Envelope(handle.getKeyId(), nonce,
                    Arrays.copyOfRange(out, ctLen, out.length),
                    Arrays.copyOf(out, ctLen));
        } catch (GeneralSecurityException e) {
            throw new RuntimeException("Encryption failed for key " + handle.getKeyId(), e);
        }
    }

    @Override
    public byte[] open(Envelope envelope, KeyHandle handle, String repoId) {
        Objects.requireNonNull(envelope, "envelope");
        Objects.requireNonNull(handle, "handle");
        Objects.requireNonNull(repoId, "repoId");

        String supplied = repoId + ":" + envelope.getKeyId();
        if (!envelope.getKeyId().equals(handle.getKeyId()) || !repoId.equals(handle.getRepoId())) {
            logger.error("Scope mismatch opening envelope: handle scope {}, supplied {}", handle.scope(), supplied);
            throw new AadMismatchException(envelope.getKeyId(), handle.scope(), supplied);
        }

        try {
            Cipher cipher = Cipher.getInstance(ALGO);
            cipher.init(Cipher.DECRYPT_MODE, handle.getKey(), new GCMParameterSpec(TAG_BITS, envelope.getNonce()));
            cipher.updateAAD(aad(repoId, envelope.getKeyId()));
            return cipher.doFinal(envelope.sealedBody());
        } catch (AEADBadTagException e) {
            logger.error("Authentication failed for envelope under key {}", envelope.getKeyId());
            throw new TagMismatchException(envelope.getKeyId(), e);
        } catch (GeneralSecurityException e) {
            throw new RuntimeException("Decryption failed for key " + envelope.getKeyId(), e);
        }
    }

    private static byte[] aad(String repoId, String keyId) {
        return (repoId + ":" + keyId).getBytes(StandardCharsets.UTF_8);
    }
}

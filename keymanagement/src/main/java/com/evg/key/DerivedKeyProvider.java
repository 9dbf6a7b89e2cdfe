package com.evg.key;

import com.evg.common.PersistenceUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.KeyGenerator;
import javax.crypto.Mac;
import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.io.Serializable;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Objects;

/**
 * Derives per-repository AES-256 keys from a persisted master key:
 * {@code HMAC-SHA256(master, len(repoId) || repoId || epoch)}.
 */
public class DerivedKeyProvider implements KeyProvider {
    private static final Logger logger = LoggerFactory.getLogger(DerivedKeyProvider.class);

    private static final String KEY_ALGO = "AES";
    private static final String KDF_ALGO = "HmacSHA256";
    private static final int KEY_BITS = 256;

    private final SecretKey masterKey;

    public DerivedKeyProvider(Path masterFile) throws IOException {
        Objects.requireNonNull(masterFile, "masterFile");
        Path file = masterFile.toAbsolutePath().normalize();
        Path base = (file.getParent() != null) ? file.getParent() : file;
        if (Files.exists(file)) {
            MasterKeyBlob blob;
            try {
                blob = PersistenceUtils.loadObject(file, base, MasterKeyBlob.class);
            } catch (ClassNotFoundException e) {
                throw new IOException("Failed to load master key: " + file, e);
            }
            if (blob.material == null || blob.material.length != KEY_BITS / 8) {
                throw new IOException("Invalid master key file: " + file);
            }
            this.masterKey = new SecretKeySpec(blob.material, KEY_ALGO);
            logger.info("Loaded master key from {}", file);
        } else {
            this.masterKey = generateMasterKey();
            PersistenceUtils.saveObject(new MasterKeyBlob(masterKey.getEncoded()), file, base);
            logger.info("Initialized new master key at {}", file);
        }
    }

    /** In-memory provider over the given master material; nothing is persisted. */
    public DerivedKeyProvider(byte[] masterMaterial) {
        Objects.requireNonNull(masterMaterial, "masterMaterial");
        if (masterMaterial.length != KEY_BITS / 8) {
            throw new IllegalArgumentException("master key must be " + (KEY_BITS / 8) + " bytes");
        }
        this.masterKey = new SecretKeySpec(masterMaterial.clone(), KEY_ALGO);
    }

    @Override
    public SecretKey materialFor(String repoId, long epoch) {
        Objects.requireNonNull(repoId, "repoId");
        byte[] repo = repoId.getBytes(StandardCharsets.UTF_8);
        byte[] info = ByteBuffer.allocate(4 + repo.length + 8)
                .putInt(repo.length).put(repo).putLong(epoch).array();
        try {
            Mac mac = Mac.getInstance(KDF_ALGO);
            mac.init(masterKey);
            byte[] out = mac.doFinal(info);
            byte[] keyBytes = Arrays.copyOf(out, KEY_BITS / 8);
            return new SecretKeySpec(keyBytes, KEY_ALGO);
        } catch (GeneralSecurityException e) {
            throw new RuntimeException("Key derivation failed", e);
        }
    }

    private static SecretKey generateMasterKey() throws IOException {
        try {
            KeyGenerator kg = KeyGenerator.getInstance(KEY_ALGO);
            kg.init(KEY_BITS, new SecureRandom());
            return new SecretKeySpec(kg.generateKey().getEncoded(), KEY_ALGO);
        } catch (GeneralSecurityException e) {
            throw new IOException("Failed to generate master key", e);
        }
    }

    private static class MasterKeyBlob implements Serializable {
        private static final long serialVersionUID = 1L;
        final byte[] material;

        MasterKeyBlob(byte[] material) {
            this.material = material;
        }
    }
}

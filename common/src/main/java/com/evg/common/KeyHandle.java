package com.evg.common;

import javax.crypto.SecretKey;
import java.util.Objects;

/**
 * KeyHandle: a resolved key reference for one repository epoch.
 *
 * keyId         = "{repoId}#e{epoch}", unique across the key table
 * rotationEpoch = 1 for the first key of a repository, +1 per rotation
 * expiresAt     = epoch millis after which the handle is no longer used for sealing (0 = never)
 *
 * Superseded handles stay valid for opening existing data.
 */
public final class KeyHandle {
    private final String keyId;
    private final String repoId;
    private final long rotationEpoch;
    private final long createdAt;
    private final long expiresAt;
    private final SecretKey key;

    public KeyHandle(String keyId, String repoId, long rotationEpoch,
                     long createdAt, long expiresAt, SecretKey key) {
        this.keyId = Objects.requireNonNull(keyId, "keyId cannot be null");
        this.repoId = Objects.requireNonNull(repoId, "repoId cannot be null");
        if (rotationEpoch < 1) {
            throw new IllegalArgumentException("rotationEpoch must be >= 1");
        }
        this.rotationEpoch = rotationEpoch;
        this.createdAt = createdAt;
        this.expiresAt = expiresAt;
        this.key = Objects.requireNonNull(key, "key cannot be null");
    }

    public static String keyIdFor(String repoId, long epoch) {
        return repoId + "#e" + epoch;
    }

    public String getKeyId() {
        return keyId;
    }

    public String getRepoId() {
        return repoId;
    }

    public long getRotationEpoch() {
        return rotationEpoch;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public long getExpiresAt() {
        return expiresAt;
    }

    public SecretKey getKey() {
        return key;
    }

    public boolean isExpired(long nowMillis) {
        return expiresAt > 0 && nowMillis >= expiresAt;
    }

    /** AAD scope string bound into every envelope sealed with this handle. */
    public String scope() {
        return repoId + ":" + keyId;
    }

    @Override
    public String toString() {
        // never print key material
        return String.format("KeyHandle{id=%s, repo=%s, epoch=%d, expires=%d}",
                keyId, repoId, rotationEpoch, expiresAt);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof KeyHandle that)) return false;
        return rotationEpoch == that.rotationEpoch
                && keyId.equals(that.keyId)
                && repoId.equals(that.repoId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(keyId, repoId, rotationEpoch);
    }
}

package com.evg.store;

import java.util.Objects;

/**
 * Point-in-time view of a shard. {@code keyId} is the key of the newest segment, null for an empty shard.
 */
public final class ShardDescriptor {
    private final String shardId;
    private final String repoId;
    private final String keyId;
    private final long sizeBytes;
    private final long lastCompactedAt;
    private final long commitVersion;

    public ShardDescriptor(String shardId, String repoId, String keyId,
                           long sizeBytes, long lastCompactedAt, long commitVersion) {
        this.shardId = Objects.requireNonNull(shardId, "shardId");
        this.repoId = Objects.requireNonNull(repoId, "repoId");
        this.keyId = keyId;
        this.sizeBytes = sizeBytes;
        this.lastCompactedAt = lastCompactedAt;
        this.commitVersion = commitVersion;
    }

    public String getShardId() { return shardId; }
    public String getRepoId() { return repoId; }
    public String getKeyId() { return keyId; }
    public long getSizeBytes() { return sizeBytes; }
    public long getLastCompactedAt() { return lastCompactedAt; }
    public long getCommitVersion() { return commitVersion; }

    @Override
    public String toString() {
        return String.format("ShardDescriptor{id=%s, repo=%s, key=%s, size=%d, v=%d}",
                shardId, repoId, keyId, sizeBytes, commitVersion);
    }
}

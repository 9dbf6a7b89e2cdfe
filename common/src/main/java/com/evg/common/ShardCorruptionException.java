package com.evg.common;

/**
 * A shard failed checksum or envelope validation. The shard is quarantined, never deleted.
 */
public class ShardCorruptionException extends PersistenceException {
    private static final long serialVersionUID = 1L;

    private final String repoId;

    public ShardCorruptionException(String repoId, String message) {
        super(message);
        this.repoId = repoId;
    }

    public ShardCorruptionException(String repoId, String message, Throwable cause) {
        super(message, cause);
        this.repoId = repoId;
    }

    public String getRepoId() {
        return repoId;
    }
}

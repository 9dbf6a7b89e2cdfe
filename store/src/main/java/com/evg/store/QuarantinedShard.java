package com.evg.store;

import java.util.Objects;

/** A shard marked unreadable after failing validation. Its objects are kept for inspection. */
public final class QuarantinedShard {
    private final String repoId;
    private final String shardId;
    private final String reason;

    public QuarantinedShard(String repoId, String shardId, String reason) {
        this.repoId = Objects.requireNonNull(repoId, "repoId");
        this.shardId = Objects.requireNonNull(shardId, "shardId");
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    public String getRepoId() { return repoId; }
    public String getShardId() { return shardId; }
    public String getReason() { return reason; }

    @Override
    public String toString() {
        return String.format("QuarantinedShard{repo=%s, shard=%s, reason=%s}", repoId, shardId, reason);
    }
}

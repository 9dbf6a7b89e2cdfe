package com.evg.common;

import java.util.Objects;

/**
 * Proof of a durable write: the shard commit plus the ledger entry that records it.
 * Immutable once issued.
 */
public final class StoreWriteReceipt {
    private final String shardId;
    private final String batchId;
    private final long commitTs;
    private final String checksum;
    private final String auditPointer;

    public StoreWriteReceipt(String shardId, String batchId, long commitTs,
                             String checksum, String auditPointer) {
        this.shardId = Objects.requireNonNull(shardId, "shardId");
        this.batchId = Objects.requireNonNull(batchId, "batchId");
        this.commitTs = commitTs;
        this.checksum = Objects.requireNonNull(checksum, "checksum");
        this.auditPointer = Objects.requireNonNull(auditPointer, "auditPointer");
    }

    public String getShardId() { return shardId; }
    public String getBatchId() { return batchId; }
    public long getCommitTs() { return commitTs; }
    public String getChecksum() { return checksum; }
    public String getAuditPointer() { return auditPointer; }

    @Override
    public String toString() {
        return String.format("StoreWriteReceipt{shard=%s, batch=%s, ts=%d, audit=%s}",
                shardId, batchId, commitTs, auditPointer);
    }
}

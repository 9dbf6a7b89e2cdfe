package com.evg.store;

import com.evg.common.StoreWriteReceipt;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of {@link VectorStore#put}. Both outcomes mean the write was accepted: a committed write carries
 * its receipt, a buffered one the sequence under which it waits for replay.
 */
public final class PutAcknowledgement {

    public enum Status { COMMITTED, BUFFERED }

    private final Status status;
    private final String repoId;
    private final long sequence;
    private final StoreWriteReceipt receipt;

    private PutAcknowledgement(Status status, String repoId, long sequence, StoreWriteReceipt receipt) {
        this.status = status;
        this.repoId = Objects.requireNonNull(repoId, "repoId");
        this.sequence = sequence;
        this.receipt = receipt;
    }

    public static PutAcknowledgement committed(String repoId, long sequence, StoreWriteReceipt receipt) {
        return new PutAcknowledgement(Status.COMMITTED, repoId, sequence, Objects.requireNonNull(receipt, "receipt"));
    }

    public static PutAcknowledgement buffered(String repoId, long sequence) {
        return new PutAcknowledgement(Status.BUFFERED, repoId, sequence, null);
    }

    public Status getStatus() { return status; }
    public String getRepoId() { return repoId; }
    public long getSequence() { return sequence; }
    public Optional<StoreWriteReceipt> getReceipt() { return Optional.ofNullable(receipt); }

    public boolean isCommitted() {
        return status == Status.COMMITTED;
    }

    @Override
    public String toString() {
        return String.format("PutAcknowledgement{%s, repo=%s, seq=%d%s}", status, repoId, sequence,
                receipt == null ? "" : ", " + receipt);
    }
}

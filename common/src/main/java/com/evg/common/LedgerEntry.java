package com.evg.common;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One chained audit record. Stores the value of the previous hash, never a reference
 * to the previous entry, so the chain is a flat indexed log.
 */
public final class LedgerEntry {
    private final long sequence;
    private final String repoId;
    private final String manifestPointer;
    private final long timestamp;
    private final String hashPrev;
    private final String hashSelf;

    @JsonCreator
    public LedgerEntry(@JsonProperty("sequence") long sequence,
                       @JsonProperty("repoId") String repoId,
                       @JsonProperty("manifestPointer") String manifestPointer,
                       @JsonProperty("timestamp") long timestamp,
                       @JsonProperty("hashPrev") String hashPrev,
                       @JsonProperty("hashSelf") String hashSelf) {
        this.sequence = sequence;
        this.repoId = Objects.requireNonNull(repoId, "repoId");
        this.manifestPointer = Objects.requireNonNull(manifestPointer, "manifestPointer");
        this.timestamp = timestamp;
        this.hashPrev = Objects.requireNonNull(hashPrev, "hashPrev");
        this.hashSelf = Objects.requireNonNull(hashSelf, "hashSelf");
    }

    @JsonProperty("sequence") public long getSequence() { return sequence; }
    @JsonProperty("repoId") public String getRepoId() { return repoId; }
    @JsonProperty("manifestPointer") public String getManifestPointer() { return manifestPointer; }
    @JsonProperty("timestamp") public long getTimestamp() { return timestamp; }
    @JsonProperty("hashPrev") public String getHashPrev() { return hashPrev; }
    @JsonProperty("hashSelf") public String getHashSelf() { return hashSelf; }

    /** Audit pointer handed out in write receipts. */
    public String auditPointer() {
        return repoId + "#" + sequence;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof LedgerEntry that)) return false;
        return sequence == that.sequence
                && timestamp == that.timestamp
                && repoId.equals(that.repoId)
                && manifestPointer.equals(that.manifestPointer)
                && hashPrev.equals(that.hashPrev)
                && hashSelf.equals(that.hashSelf);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sequence, repoId, manifestPointer, timestamp, hashPrev, hashSelf);
    }

    @Override
    public String toString() {
        return String.format("LedgerEntry{repo=%s, seq=%d, ptr=%s, hash=%s}",
                repoId, sequence, manifestPointer, hashSelf.substring(0, Math.min(12, hashSelf.length())));
    }
}

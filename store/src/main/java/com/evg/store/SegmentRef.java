package com.evg.store;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Catalog entry for one sealed segment object of a shard.
 */
public final class SegmentRef {
    private final String segmentId;
    private final String sha256;
    private final String keyId;
    private final long sizeBytes;
    private final List<String> batchIds;
    private final long commitVersion;

    @JsonCreator
    public SegmentRef(@JsonProperty("segmentId") String segmentId,
                      @JsonProperty("sha256") String sha256,
                      @JsonProperty("keyId") String keyId,
                      @JsonProperty("sizeBytes") long sizeBytes,
                      @JsonProperty("batchIds") List<String> batchIds,
                      @JsonProperty("commitVersion") long commitVersion) {
        this.segmentId = Objects.requireNonNull(segmentId, "segmentId");
        this.sha256 = Objects.requireNonNull(sha256, "sha256");
        this.keyId = Objects.requireNonNull(keyId, "keyId");
        this.sizeBytes = sizeBytes;
        this.batchIds = (batchIds != null) ? List.copyOf(batchIds) : List.of();
        this.commitVersion = commitVersion;
    }

    static String nameFor(long segmentNo) {
        return String.format("seg-%08d.evg", segmentNo);
    }

    public String getSegmentId() { return segmentId; }
    public String getSha256() { return sha256; }
    public String getKeyId() { return keyId; }
    public long getSizeBytes() { return sizeBytes; }
    public List<String> getBatchIds() { return batchIds; }
    public long getCommitVersion() { return commitVersion; }

    boolean containsAny(Collection<String> ids) {
        for (String b : batchIds) {
            if (ids.contains(b)) return true;
        }
        return false;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof SegmentRef that)) return false;
        return segmentId.equals(that.segmentId) && sha256.equals(that.sha256) && commitVersion == that.commitVersion;
    }

    @Override
    public int hashCode() {
        return Objects.hash(segmentId, sha256, commitVersion);
    }

    @Override
    public String toString() {
        return String.format("SegmentRef{%s, key=%s, batches=%s, v=%d}", segmentId, keyId, batchIds, commitVersion);
    }
}

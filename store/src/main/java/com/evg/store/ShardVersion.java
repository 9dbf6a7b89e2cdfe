package com.evg.store;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.*;

/**
 * Immutable committed state of a shard. Every commit produces a new instance with a higher {@code version};
 * readers hold on to the instance current when they started. Serialized as the shard's catalog.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ShardVersion {
    private final String shardId;
    private final String repoId;
    private final long version;
    private final long lastCompactedAt;
    private final long nextSegmentNo;
    private final boolean resealPending;
    private final List<SegmentRef> segments;
    private final SortedSet<String> removedBatchIds;

    @JsonCreator
    public ShardVersion(@JsonProperty("shardId") String shardId,
                        @JsonProperty("repoId") String repoId,
                        @JsonProperty("version") long version,
                        @JsonProperty("lastCompactedAt") long lastCompactedAt,
                        @JsonProperty("nextSegmentNo") long nextSegmentNo,
                        @JsonProperty("resealPending") boolean resealPending,
                        @JsonProperty("segments") List<SegmentRef> segments,
                        @JsonProperty("removedBatchIds") Collection<String> removedBatchIds) {
        this.shardId = Objects.requireNonNull(shardId, "shardId");
        this.repoId = Objects.requireNonNull(repoId, "repoId");
        if (version < 0) throw new IllegalArgumentException("version must be >= 0");
        this.version = version;
        this.lastCompactedAt = lastCompactedAt;
        this.nextSegmentNo = Math.max(1L, nextSegmentNo);
        this.resealPending = resealPending;
        this.segments = (segments != null) ? List.copyOf(segments) : List.of();
        this.removedBatchIds = Collections.unmodifiableSortedSet(
                (removedBatchIds != null) ? new TreeSet<>(removedBatchIds) : new TreeSet<>());
    }

    static ShardVersion empty(String shardId, String repoId) {
        return new ShardVersion(shardId, repoId, 0L, 0L, 1L, false, List.of(), List.of());
    }

    public String getShardId() { return shardId; }
    public String getRepoId() { return repoId; }
    public long getVersion() { return version; }
    public long getLastCompactedAt() { return lastCompactedAt; }
    public long getNextSegmentNo() { return nextSegmentNo; }
    public boolean isResealPending() { return resealPending; }
    public List<SegmentRef> getSegments() { return segments; }
    public SortedSet<String> getRemovedBatchIds() { return removedBatchIds; }

    long sizeBytes() {
        long total = 0;
        for (SegmentRef s : segments) total += s.getSizeBytes();
        return total;
    }

    ShardDescriptor descriptor() {
        String keyId = segments.isEmpty() ? null : segments.get(segments.size() - 1).getKeyId();
        return new ShardDescriptor(shardId, repoId, keyId, sizeBytes(), lastCompactedAt, version);
    }

    /** Next version with one more segment and the manifest's removals tombstoned. */
    ShardVersion withSegment(SegmentRef segment, Collection<String> removed) {
        List<SegmentRef> next = new ArrayList<>(segments);
        next.add(segment);
        Set<String> tombstones = new TreeSet<>(removedBatchIds);
        tombstones.addAll(removed);
        return new ShardVersion(shardId, repoId, version + 1, lastCompactedAt, nextSegmentNo + 1,
                resealPending, next, tombstones);
    }

    /** Next version after compaction: the given segments replace all current ones and tombstones are cleared. */
    ShardVersion compactedTo(List<SegmentRef> merged, long now) {
        return new ShardVersion(shardId, repoId, version + 1, now, nextSegmentNo + merged.size(),
                false, merged, List.of());
    }

    ShardVersion markedForReseal() {
        return new ShardVersion(shardId, repoId, version + 1, lastCompactedAt, nextSegmentNo,
                true, segments, removedBatchIds);
    }

    @Override
    public String toString() {
        return String.format("ShardVersion{repo=%s, v=%d, segments=%d, tombstones=%d, reseal=%s}",
                repoId, version, segments.size(), removedBatchIds.size(), resealPending);
    }
}

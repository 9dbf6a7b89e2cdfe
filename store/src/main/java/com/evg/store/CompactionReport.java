package com.evg.store;

import java.util.*;

/**
 * Outcome of one compaction pass. Deferred repositories had a key rotation in progress and should be retried.
 */
public final class CompactionReport {
    private final List<String> compacted;
    private final List<String> deferred;
    private final List<String> quarantined;
    private final List<String> resealed;
    private final Map<String, String> failed;
    private final int segmentsBefore;
    private final int segmentsAfter;
    private final long bytesBefore;
    private final long bytesAfter;

    public CompactionReport(List<String> compacted, List<String> deferred, List<String> quarantined,
                            List<String> resealed, Map<String, String> failed,
                            int segmentsBefore, int segmentsAfter, long bytesBefore, long bytesAfter) {
        this.compacted = List.copyOf(compacted);
        this.deferred = List.copyOf(deferred);
        this.quarantined = List.copyOf(quarantined);
        this.resealed = List.copyOf(resealed);
        this.failed = Collections.unmodifiableMap(new LinkedHashMap<>(failed));
        this.segmentsBefore = segmentsBefore;
        this.segmentsAfter = segmentsAfter;
        this.bytesBefore = bytesBefore;
        this.bytesAfter = bytesAfter;
    }

    public List<String> getCompacted() { return compacted; }
    public List<String> getDeferred() { return deferred; }
    public List<String> getQuarantined() { return quarantined; }
    public List<String> getResealed() { return resealed; }
    public Map<String, String> getFailed() { return failed; }
    public int getSegmentsBefore() { return segmentsBefore; }
    public int getSegmentsAfter() { return segmentsAfter; }
    public long getBytesBefore() { return bytesBefore; }
    public long getBytesAfter() { return bytesAfter; }

    @Override
    public String toString() {
        return String.format("CompactionReport{compacted=%s, deferred=%s, quarantined=%s, failed=%s, segments %d->%d, bytes %d->%d}",
                compacted, deferred, quarantined, failed.keySet(), segmentsBefore, segmentsAfter, bytesBefore, bytesAfter);
    }
}

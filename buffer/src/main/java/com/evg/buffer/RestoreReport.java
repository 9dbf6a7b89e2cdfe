package com.evg.buffer;

import java.util.List;

/**
 * Outcome of loading a snapshot.
 * {@code dropped} are seal-pending records whose plaintext was never persisted;
 * {@code corrupt} are records whose payload failed its checksum.
 */
public final class RestoreReport {
    private final int restored;
    private final List<Long> dropped;
    private final List<Long> corrupt;
    private final long maxSequence;

    public RestoreReport(int restored, List<Long> dropped, List<Long> corrupt, long maxSequence) {
        this.restored = restored;
        this.dropped = List.copyOf(dropped);
        this.corrupt = List.copyOf(corrupt);
        this.maxSequence = maxSequence;
    }

    public static RestoreReport empty() {
        return new RestoreReport(0, List.of(), List.of(), 0L);
    }

    public int getRestored() { return restored; }
    public List<Long> getDropped() { return dropped; }
    public List<Long> getCorrupt() { return corrupt; }
    public long getMaxSequence() { return maxSequence; }

    @Override
    public String toString() {
        return String.format("RestoreReport{restored=%d, dropped=%d, corrupt=%d, maxSeq=%d}",
                restored, dropped.size(), corrupt.size(), maxSequence);
    }
}

package com.evg.replay;

/**
 * Result of one drain pass. {@code maxSequence} is the highest sequence committed in the pass, 0 if none.
 */
public final class ReplayStats {
    public static final ReplayStats EMPTY = new ReplayStats(0, 0, 0L);

    private final int applied;
    private final int requeued;
    private final long maxSequence;

    public ReplayStats(int applied, int requeued, long maxSequence) {
        this.applied = applied;
        this.requeued = requeued;
        this.maxSequence = maxSequence;
    }

    public int getApplied() { return applied; }
    public int getRequeued() { return requeued; }
    public long getMaxSequence() { return maxSequence; }

    public boolean isEmpty() {
        return applied == 0 && requeued == 0;
    }

    @Override
    public String toString() {
        return String.format("ReplayStats{applied=%d, requeued=%d, maxSeq=%d}", applied, requeued, maxSequence);
    }
}

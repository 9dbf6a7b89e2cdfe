package com.evg.buffer;

import java.util.Objects;

/**
 * A deferred write. {@code sequence} and {@code enqueuedAt} are fixed once assigned; only
 * {@code attemptCount} changes across requeues.
 */
public final class RetryBufferEntry {
    /** Marker for an entry that has not been given a sequence yet. */
    public static final long UNASSIGNED = 0L;

    private final long sequence;
    private final String repoId;
    private final RetryPayload payload;
    private final long enqueuedAt;
    private final int attemptCount;

    public RetryBufferEntry(long sequence, String repoId, RetryPayload payload, long enqueuedAt, int attemptCount) {
        if (sequence < 0) throw new IllegalArgumentException("sequence must be >= 0");
        if (attemptCount < 0) throw new IllegalArgumentException("attemptCount must be >= 0");
        this.sequence = sequence;
        this.repoId = Objects.requireNonNull(repoId, "repoId");
        this.payload = Objects.requireNonNull(payload, "payload");
        this.enqueuedAt = enqueuedAt;
        this.attemptCount = attemptCount;
    }

    /** New entry for a write that has already been attempted {@code attempts} times. */
    public static RetryBufferEntry of(long sequence, String repoId, RetryPayload payload, int attempts) {
        return new RetryBufferEntry(sequence, repoId, payload, 0L, attempts);
    }

    public long getSequence() { return sequence; }
    public String getRepoId() { return repoId; }
    public RetryPayload getPayload() { return payload; }
    public long getEnqueuedAt() { return enqueuedAt; }
    public int getAttemptCount() { return attemptCount; }

    public boolean hasSequence() {
        return sequence != UNASSIGNED;
    }

    RetryBufferEntry assigned(long seq, long now) {
        return new RetryBufferEntry(hasSequence() ? sequence : seq, repoId, payload,
                (enqueuedAt > 0) ? enqueuedAt : now, attemptCount);
    }

    RetryBufferEntry nextAttempt() {
        return new RetryBufferEntry(sequence, repoId, payload, enqueuedAt, attemptCount + 1);
    }

    boolean isExpired(long now, long maxAgeMs) {
        return now - enqueuedAt >= maxAgeMs;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof RetryBufferEntry that)) return false;
        return sequence == that.sequence
                && enqueuedAt == that.enqueuedAt
                && attemptCount == that.attemptCount
                && repoId.equals(that.repoId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sequence, repoId, enqueuedAt, attemptCount);
    }

    @Override
    public String toString() {
        return String.format("RetryBufferEntry{seq=%d, repo=%s, attempts=%d, %s}",
                sequence, repoId, attemptCount, payload.getStage());
    }
}

package com.evg.buffer;

/**
 * Diagnostic naming the entry evicted to make room for a push.
 */
public final class BufferOverflow {
    private final String repoId;
    private final long sequence;
    private final long evictedAt;

    public BufferOverflow(String repoId, long sequence, long evictedAt) {
        this.repoId = repoId;
        this.sequence = sequence;
        this.evictedAt = evictedAt;
    }

    public String getRepoId() { return repoId; }
    public long getSequence() { return sequence; }
    public long getEvictedAt() { return evictedAt; }

    @Override
    public String toString() {
        return String.format("BufferOverflow{repo=%s, seq=%d}", repoId, sequence);
    }
}

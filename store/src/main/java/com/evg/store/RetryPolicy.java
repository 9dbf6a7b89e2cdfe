package com.evg.store;

/**
 * Bounded exponential backoff for transient backend failures.
 */
public final class RetryPolicy {
    private final int maxAttempts;
    private final long initialBackoffMs;
    private final long maxBackoffMs;

    public RetryPolicy(int maxAttempts, long initialBackoffMs, long maxBackoffMs) {
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
        if (initialBackoffMs < 0 || maxBackoffMs < initialBackoffMs) {
            throw new IllegalArgumentException("backoff bounds must satisfy 0 <= initial <= max");
        }
        this.maxAttempts = maxAttempts;
        this.initialBackoffMs = initialBackoffMs;
        this.maxBackoffMs = maxBackoffMs;
    }

    public static RetryPolicy noBackoff(int maxAttempts) {
        return new RetryPolicy(maxAttempts, 0L, 0L);
    }

    public int getMaxAttempts() { return maxAttempts; }
    public long getInitialBackoffMs() { return initialBackoffMs; }
    public long getMaxBackoffMs() { return maxBackoffMs; }

    /** Wait after the given failed attempt (1-based). */
    public long backoffAfter(int attempt) {
        if (attempt < 1 || initialBackoffMs == 0) return 0L;
        int shift = Math.min(attempt - 1, 30);
        long d = initialBackoffMs << shift;
        return (d < 0 || d > maxBackoffMs) ? maxBackoffMs : d;
    }

    /**
     * Sleeps for {@link #backoffAfter(int)}.
     *
     * @return false if interrupted; the interrupt flag is restored
     */
    boolean pause(int attempt) {
        long ms = backoffAfter(attempt);
        if (ms <= 0) return true;
        try {
            Thread.sleep(ms);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @Override
    public String toString() {
        return String.format("RetryPolicy{attempts=%d, backoff=%d..%dms}", maxAttempts, initialBackoffMs, maxBackoffMs);
    }
}

package com.evg.buffer;

public enum OverflowPolicy {
    /** Drop the lowest-sequence ready entry to make room. */
    EVICT_OLDEST,
    /** Refuse the push with {@link com.evg.common.BufferFullException}. */
    REJECT;

    public static OverflowPolicy parse(String s) {
        return "REJECT".equalsIgnoreCase(s == null ? "" : s.trim()) ? REJECT : EVICT_OLDEST;
    }
}

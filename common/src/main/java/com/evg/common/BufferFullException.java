package com.evg.common;

/**
 * Raised by the retry buffer when it is full and its overflow policy forbids eviction.
 */
public class BufferFullException extends PersistenceException {
    private static final long serialVersionUID = 1L;

    private final int capacity;

    public BufferFullException(int capacity) {
        super("Retry buffer is full (capacity=" + capacity + ")");
        this.capacity = capacity;
    }

    public int getCapacity() {
        return capacity;
    }
}

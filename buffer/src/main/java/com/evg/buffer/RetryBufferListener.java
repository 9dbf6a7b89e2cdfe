package com.evg.buffer;

/**
 * Callbacks run outside the buffer lock, on the thread that mutated the buffer.
 */
public interface RetryBufferListener {

    default void onPush(RetryBufferEntry entry) { }

    default void onOverflow(BufferOverflow overflow) { }

    default void onExpired(RetryBufferEntry entry) { }
}

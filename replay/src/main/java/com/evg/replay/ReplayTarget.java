package com.evg.replay;

import com.evg.buffer.RetryBufferEntry;
import com.evg.common.StoreWriteReceipt;

/**
 * Where buffered writes are re-applied. {@code VectorStore::replay} in production.
 */
@FunctionalInterface
public interface ReplayTarget {

    /**
     * One commit attempt. Must either commit fully or throw; an exception means nothing was recorded.
     */
    StoreWriteReceipt replay(RetryBufferEntry entry);
}

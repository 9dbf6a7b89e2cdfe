package com.evg.store.backend;

import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Capability set a shard needs from durable storage. Objects are addressed by repository and name.
 * {@link #put} must replace an object atomically: readers see the old or the new bytes, never a mix.
 */
public interface ShardBackend extends AutoCloseable {

    void put(String repoId, String name, byte[] bytes) throws IOException;

    Optional<byte[]> get(String repoId, String name) throws IOException;

    void delete(String repoId, String name) throws IOException;

    /** Object names of one repository, sorted. */
    List<String> list(String repoId) throws IOException;

    Set<String> repositories() throws IOException;

    @Override
    default void close() {
    }
}

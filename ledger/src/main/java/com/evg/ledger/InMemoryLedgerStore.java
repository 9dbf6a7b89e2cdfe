package com.evg.ledger;

import com.evg.common.LedgerEntry;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Non-durable store for tests and ephemeral runtimes.
 */
public class InMemoryLedgerStore implements LedgerStore {
    private final Map<String, NavigableMap<Long, LedgerEntry>> entries = new ConcurrentHashMap<>();
    private final Map<String, LedgerEntry> heads = new ConcurrentHashMap<>();

    @Override
    public Optional<LedgerEntry> head(String repoId) {
        return Optional.ofNullable(heads.get(repoId));
    }

    @Override
    public synchronized void append(LedgerEntry entry) {
        entries.computeIfAbsent(entry.getRepoId(), r -> new TreeMap<>()).put(entry.getSequence(), entry);
        heads.put(entry.getRepoId(), entry);
    }

    @Override
    public synchronized List<LedgerEntry> read(String repoId) {
        NavigableMap<Long, LedgerEntry> m = entries.get(repoId);
        return (m == null) ? List.of() : List.copyOf(m.values());
    }

    @Override
    public Set<String> repositories() {
        return Set.copyOf(heads.keySet());
    }

    /** Replaces a stored entry without touching the head. */
    synchronized void overwrite(LedgerEntry entry) {
        entries.computeIfAbsent(entry.getRepoId(), r -> new TreeMap<>()).put(entry.getSequence(), entry);
    }

    /** Drops a stored entry without touching the head. */
    synchronized void remove(String repoId, long sequence) {
        NavigableMap<Long, LedgerEntry> m = entries.get(repoId);
        if (m != null) m.remove(sequence);
    }

    @Override
    public void close() {
        // nothing to release
    }
}

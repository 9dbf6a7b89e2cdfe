package com.evg.store;

import java.util.Collection;
import java.util.Set;
import java.util.TreeSet;

/**
 * Which shards {@link VectorStore#compact} rewrites. A shard qualifies when it has at least
 * {@code minSegments} segments, carries tombstones, is marked for re-seal, or (with {@code keyCurrency})
 * holds a segment sealed under a superseded key.
 */
public final class CompactionPolicy {
    private final Set<String> repoIds;
    private final int minSegments;
    private final boolean keyCurrency;

    public CompactionPolicy(Collection<String> repoIds, int minSegments, boolean keyCurrency) {
        if (minSegments < 2) throw new IllegalArgumentException("minSegments must be >= 2");
        this.repoIds = (repoIds == null) ? Set.of() : Set.copyOf(new TreeSet<>(repoIds));
        this.minSegments = minSegments;
        this.keyCurrency = keyCurrency;
    }

    public static CompactionPolicy all(int minSegments) {
        return new CompactionPolicy(Set.of(), minSegments, false);
    }

    public static CompactionPolicy keyCurrency(int minSegments) {
        return new CompactionPolicy(Set.of(), minSegments, true);
    }

    /** Empty means every open shard. */
    public Set<String> getRepoIds() { return repoIds; }
    public int getMinSegments() { return minSegments; }
    public boolean isKeyCurrency() { return keyCurrency; }

    boolean targets(String repoId) {
        return repoIds.isEmpty() || repoIds.contains(repoId);
    }

    @Override
    public String toString() {
        return String.format("CompactionPolicy{repos=%s, minSegments=%d, keyCurrency=%s}",
                repoIds.isEmpty() ? "*" : repoIds, minSegments, keyCurrency);
    }
}

package com.evg.store;

import java.util.*;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Live handle for one repository's shard.
 * <p>
 * {@link #current} is swapped atomically by the single committer holding {@link #committer}. Readers pin the
 * version they start with; segment objects retired by a commit are handed out for deletion only once no
 * reader pins a version older than that commit.
 */
final class Shard {
    private final String repoId;
    private final AtomicReference<ShardVersion> current;
    private final ReentrantLock committer = new ReentrantLock();

    private final Object pinLock = new Object();
    private final TreeMap<Long, Integer> pins = new TreeMap<>();
    private final List<Garbage> garbage = new ArrayList<>();

    private volatile String quarantineReason;

    private record Garbage(long retiredAt, List<String> objects) {}

    Shard(ShardVersion initial) {
        this.repoId = initial.getRepoId();
        this.current = new AtomicReference<>(initial);
    }

    String repoId() {
        return repoId;
    }

    ShardVersion current() {
        return current.get();
    }

    ReentrantLock committer() {
        return committer;
    }

    ShardVersion pin() {
        synchronized (pinLock) {
            ShardVersion v = current.get();
            pins.merge(v.getVersion(), 1, Integer::sum);
            return v;
        }
    }

    void unpin(ShardVersion v) {
        synchronized (pinLock) {
            pins.computeIfPresent(v.getVersion(), (k, n) -> (n <= 1) ? null : n - 1);
        }
    }

    /**
     * Makes {@code next} visible to new readers. Must be called by the committer.
     *
     * @param retired objects referenced only by versions before {@code next}
     */
    void publish(ShardVersion next, List<String> retired) {
        synchronized (pinLock) {
            current.set(next);
            if (!retired.isEmpty()) {
                garbage.add(new Garbage(next.getVersion(), List.copyOf(retired)));
            }
        }
    }

    /** Retired objects no reader can still reach. Removed from the pending list. */
    List<String> reclaimable() {
        synchronized (pinLock) {
            if (garbage.isEmpty()) return List.of();
            long oldestPinned = pins.isEmpty() ? Long.MAX_VALUE : pins.firstKey();
            List<String> out = new ArrayList<>();
            Iterator<Garbage> it = garbage.iterator();
            while (it.hasNext()) {
                Garbage g = it.next();
                if (oldestPinned >= g.retiredAt()) {
                    out.addAll(g.objects());
                    it.remove();
                }
            }
            return out;
        }
    }

    int pinnedReaders() {
        synchronized (pinLock) {
            int n = 0;
            for (int c : pins.values()) n += c;
            return n;
        }
    }

    void quarantine(String reason) {
        if (quarantineReason == null) quarantineReason = reason;
    }

    boolean isQuarantined() {
        return quarantineReason != null;
    }

    String quarantineReason() {
        return quarantineReason;
    }
}

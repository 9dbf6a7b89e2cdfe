package com.evg.buffer;

import com.evg.common.BufferFullException;
import com.evg.common.Checksums;
import com.evg.common.PersistenceUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Bounded FIFO of writes that could not reach durable storage.
 * <p>
 * Entries are keyed by sequence. {@link #drainReady()} moves every ready entry to an in-flight set in one
 * step, so a concurrent push lands after the batch and is returned by the next drain. A failed in-flight
 * entry goes back through {@link #requeue(RetryBufferEntry)} at its original sequence position with its
 * original {@code enqueuedAt}.
 * <p>
 * Listener callbacks and snapshot writes happen after the lock is released.
 */
public class RetryBuffer {
    private static final Logger logger = LoggerFactory.getLogger(RetryBuffer.class);

    private final int maxItems;
    private final long maxAgeMs;
    private final OverflowPolicy policy;
    private final Clock clock;
    private final Path snapshotFile;
    private final List<RetryBufferListener> listeners = new CopyOnWriteArrayList<>();

    private final Object lock = new Object();
    private final Object snapshotLock = new Object();
    private final TreeMap<Long, RetryBufferEntry> ready = new TreeMap<>();
    private final TreeMap<Long, RetryBufferEntry> inFlight = new TreeMap<>();
    private long lastSequence = 0L;
    private long maxSequence = 0L;

    public RetryBuffer(int maxItems, long maxAgeMs, OverflowPolicy policy) {
        this(maxItems, maxAgeMs, policy, Clock.systemUTC(), null);
    }

    /**
     * @param snapshotFile rewritten after every mutation when non-null
     */
    public RetryBuffer(int maxItems, long maxAgeMs, OverflowPolicy policy, Clock clock, Path snapshotFile) {
        if (maxItems < 1) throw new IllegalArgumentException("maxItems must be >= 1");
        if (maxAgeMs < 1) throw new IllegalArgumentException("maxAgeMs must be >= 1");
        this.maxItems = maxItems;
        this.maxAgeMs = maxAgeMs;
        this.policy = Objects.requireNonNull(policy, "policy");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.snapshotFile = (snapshotFile == null) ? null : snapshotFile.toAbsolutePath().normalize();
    }

    public void addListener(RetryBufferListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    /** Hands out the next write sequence. Callers reserve it before the first commit attempt. */
    public long reserveSequence() {
        synchronized (lock) {
            return ++lastSequence;
        }
    }

    /**
     * Appends an entry, assigning a sequence if it has none.
     *
     * @return the entry as stored
     * @throws BufferFullException the buffer is full and nothing can be evicted
     */
    public RetryBufferEntry push(RetryBufferEntry entry) {
        Objects.requireNonNull(entry, "entry");
        List<RetryBufferEntry> expired;
        BufferOverflow overflow = null;
        RetryBufferEntry stored = null;

        synchronized (lock) {
            long now = clock.millis();
            expired = purgeExpired(now);
            boolean full = ready.size() + inFlight.size() >= maxItems;
            if (full && policy == OverflowPolicy.EVICT_OLDEST && !ready.isEmpty()) {
                RetryBufferEntry evicted = ready.pollFirstEntry().getValue();
                overflow = new BufferOverflow(evicted.getRepoId(), evicted.getSequence(), now);
                full = false;
            }
            if (!full) {
                stored = entry.assigned(lastSequence + 1, now);
                if (ready.containsKey(stored.getSequence()) || inFlight.containsKey(stored.getSequence())) {
                    throw new IllegalArgumentException("sequence " + stored.getSequence() + " already buffered");
                }
                lastSequence = Math.max(lastSequence, stored.getSequence());
                maxSequence = Math.max(maxSequence, stored.getSequence());
                ready.put(stored.getSequence(), stored);
            }
        }

        reportExpired(expired);
        if (stored == null) {
            if (!expired.isEmpty()) persistSnapshot();
            logger.warn("Retry buffer full (max={}), rejecting entry for {}", maxItems, entry.getRepoId());
            throw new BufferFullException(maxItems);
        }
        if (overflow != null) {
            logger.warn("Retry buffer full (max={}), evicted {}", maxItems, overflow);
            for (RetryBufferListener l : listeners) l.onOverflow(overflow);
        }
        logger.debug("Buffered {}", stored);
        persistSnapshot();
        for (RetryBufferListener l : listeners) l.onPush(stored);
        return stored;
    }

    /**
     * Every non-expired ready entry in ascending sequence order, now marked in-flight.
     */
    public List<RetryBufferEntry> drainReady() {
        List<RetryBufferEntry> expired;
        List<RetryBufferEntry> batch;
        synchronized (lock) {
            expired = purgeExpired(clock.millis());
            batch = new ArrayList<>(ready.values());
            for (RetryBufferEntry e : batch) {
                inFlight.put(e.getSequence(), e);
            }
            ready.clear();
        }
        reportExpired(expired);
        if (!expired.isEmpty()) persistSnapshot();
        return batch;
    }

    /**
     * Returns a failed in-flight entry to the ready set at its sequence position.
     *
     * @return the entry with its attempt count incremented
     */
    public RetryBufferEntry requeue(RetryBufferEntry entry) {
        Objects.requireNonNull(entry, "entry");
        RetryBufferEntry again;
        synchronized (lock) {
            RetryBufferEntry held = inFlight.remove(entry.getSequence());
            if (held == null) {
                throw new IllegalStateException("sequence " + entry.getSequence() + " is not in flight");
            }
            again = held.nextAttempt();
            ready.put(again.getSequence(), again);
        }
        logger.debug("Requeued {}", again);
        persistSnapshot();
        return again;
    }

    /** Removes a successfully replayed in-flight entry. */
    public void complete(RetryBufferEntry entry) {
        Objects.requireNonNull(entry, "entry");
        boolean removed;
        synchronized (lock) {
            removed = inFlight.remove(entry.getSequence()) != null;
        }
        if (!removed) {
            logger.warn("complete() for sequence {} which is not in flight", entry.getSequence());
            return;
        }
        persistSnapshot();
    }

    /** Ready and in-flight entries as NDJSON, ordered by sequence. */
    public byte[] snapshot() {
        List<RetryBufferEntry> all;
        synchronized (lock) {
            all = allOrdered();
        }
        return BufferSnapshotCodec.encode(all, clock.millis());
    }

    /**
     * Loads snapshot records into the ready set. Seal-pending records carry no payload and are reported as
     * dropped; records failing their checksum are reported as corrupt. Entries past {@code maxAgeMs} expire on
     * the next push or drain.
     */
    public RestoreReport restore(byte[] snapshot) throws IOException {
        Objects.requireNonNull(snapshot, "snapshot");
        List<SnapshotRecord> records = BufferSnapshotCodec.decode(snapshot);
        List<Long> dropped = new ArrayList<>();
        List<Long> corrupt = new ArrayList<>();
        int restored = 0;
        long max;

        synchronized (lock) {
            for (SnapshotRecord r : records) {
                if (r.sequence <= 0 || r.repoId == null || r.batchId == null || r.manifestId == null) {
                    corrupt.add(r.sequence);
                    continue;
                }
                RetryPayload.Stage stage;
                try {
                    stage = RetryPayload.Stage.valueOf(String.valueOf(r.stage));
                } catch (IllegalArgumentException e) {
                    corrupt.add(r.sequence);
                    continue;
                }
                lastSequence = Math.max(lastSequence, r.sequence);
                if (stage == RetryPayload.Stage.SEAL_PENDING || r.payload == null) {
                    dropped.add(r.sequence);
                    continue;
                }
                if (r.keyId == null || !Checksums.sha256Hex(r.payload).equals(r.checksum)) {
                    corrupt.add(r.sequence);
                    continue;
                }
                if (ready.containsKey(r.sequence) || inFlight.containsKey(r.sequence)) {
                    continue;
                }
                RetryPayload payload = RetryPayload.sealed(r.batchId, r.manifestId, r.removedBatchIds, r.keyId, r.payload);
                ready.put(r.sequence, new RetryBufferEntry(r.sequence, r.repoId, payload, r.enqueuedAt, r.attemptCount));
                maxSequence = Math.max(maxSequence, r.sequence);
                restored++;
            }
            max = maxSequence;
        }

        RestoreReport report = new RestoreReport(restored, dropped, corrupt, max);
        if (!dropped.isEmpty()) {
            logger.warn("Snapshot restore dropped {} seal-pending entries: {}", dropped.size(), dropped);
        }
        if (!corrupt.isEmpty()) {
            logger.error("Snapshot restore rejected {} corrupt entries: {}", corrupt.size(), corrupt);
        }
        logger.info("Restored retry buffer: {}", report);
        return report;
    }

    /** Restores from the configured snapshot file if it exists. */
    public RestoreReport restoreFromSnapshotFile() throws IOException {
        if (snapshotFile == null || !Files.exists(snapshotFile)) {
            return RestoreReport.empty();
        }
        return restore(Files.readAllBytes(snapshotFile));
    }

    public int size() {
        synchronized (lock) {
            return ready.size() + inFlight.size();
        }
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    public int readySize() {
        synchronized (lock) {
            return ready.size();
        }
    }

    public int inFlightSize() {
        synchronized (lock) {
            return inFlight.size();
        }
    }

    /** Highest sequence ever held by this buffer. */
    public long maxSequence() {
        synchronized (lock) {
            return maxSequence;
        }
    }

    /** Whether any ready or in-flight entry belongs to {@code repoId}. */
    public boolean hasPending(String repoId) {
        synchronized (lock) {
            for (RetryBufferEntry e : ready.values()) {
                if (e.getRepoId().equals(repoId)) return true;
            }
            for (RetryBufferEntry e : inFlight.values()) {
                if (e.getRepoId().equals(repoId)) return true;
            }
            return false;
        }
    }

    public int getMaxItems() {
        return maxItems;
    }

    private List<RetryBufferEntry> purgeExpired(long now) {
        List<RetryBufferEntry> expired = new ArrayList<>();
        Iterator<RetryBufferEntry> it = ready.values().iterator();
        while (it.hasNext()) {
            RetryBufferEntry e = it.next();
            if (e.isExpired(now, maxAgeMs)) {
                expired.add(e);
                it.remove();
            }
        }
        return expired;
    }

    private void reportExpired(List<RetryBufferEntry> expired) {
        for (RetryBufferEntry e : expired) {
            logger.warn("Retry buffer entry expired after {} attempts: repo={} seq={}",
                    e.getAttemptCount(), e.getRepoId(), e.getSequence());
            for (RetryBufferListener l : listeners) l.onExpired(e);
        }
    }

    private List<RetryBufferEntry> allOrdered() {
        TreeMap<Long, RetryBufferEntry> all = new TreeMap<>(ready);
        all.putAll(inFlight);
        return new ArrayList<>(all.values());
    }

    private void persistSnapshot() {
        if (snapshotFile == null) return;
        synchronized (snapshotLock) {
            byte[] bytes = snapshot();
            try {
                PersistenceUtils.writeAtomically(snapshotFile, bytes);
            } catch (IOException e) {
                // buffer contents stay in memory; the next mutation retries the write
                logger.warn("Failed to write retry buffer snapshot {}", snapshotFile, e);
            }
        }
    }
}

package com.evg.ledger;

import com.evg.common.LedgerEntry;
import com.evg.common.LedgerUnavailableException;
import com.evg.common.SequenceGapException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Appends hash-chained entries per repository.
 * <p>
 * Appends to one repository are serialized by that repository's lock; different repositories proceed
 * in parallel. The cached chain head only moves after the store has durably recorded the entry.
 * A repository whose verification failed is halted until {@link #reconcile(String)}.
 */
public class LedgerWriter implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(LedgerWriter.class);

    private final LedgerStore store;
    private final Clock clock;

    private final ConcurrentMap<String, LedgerEntry> heads = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Long> halted = new ConcurrentHashMap<>();

    public LedgerWriter(LedgerStore store) {
        this(store, Clock.systemUTC());
    }

    public LedgerWriter(LedgerStore store, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Records {@code manifestPointer} as the next entry of {@code repoId}.
     *
     * @throws SequenceGapException       the repository is halted after a failed verification
     * @throws LedgerUnavailableException the store could not record the entry; nothing was written
     */
    public LedgerEntry append(String manifestPointer, String repoId) {
        Objects.requireNonNull(manifestPointer, "manifestPointer");
        if (repoId == null || repoId.isBlank()) {
            throw new IllegalArgumentException("repoId cannot be null or blank");
        }
        checkNotHalted(repoId);

        ReentrantLock lock = locks.computeIfAbsent(repoId, r -> new ReentrantLock());
        lock.lock();
        try {
            checkNotHalted(repoId);
            LedgerEntry head = currentHead(repoId);
            long sequence = (head == null) ? 1L : head.getSequence() + 1;
            String hashPrev = (head == null) ? LedgerCanonicalForm.GENESIS : head.getHashSelf();
            long ts = clock.millis();
            String hashSelf = LedgerCanonicalForm.chainHash(hashPrev, sequence, repoId, manifestPointer, ts);
            LedgerEntry entry = new LedgerEntry(sequence, repoId, manifestPointer, ts, hashPrev, hashSelf);

            try {
                store.append(entry);
            } catch (IOException e) {
                throw new LedgerUnavailableException("Ledger append failed for " + repoId, e);
            }
            heads.put(repoId, entry);
            logger.debug("Appended {}", entry);
            return entry;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Walks the chain from genesis. A failure halts further appends for the repository.
     */
    public VerificationReport verify(String repoId) {
        Objects.requireNonNull(repoId, "repoId");
        List<LedgerEntry> entries;
        Optional<LedgerEntry> storedHead;
        try {
            entries = store.read(repoId);
            storedHead = store.head(repoId);
        } catch (IOException e) {
            throw new LedgerUnavailableException("Ledger read failed for " + repoId, e);
        }

        String expectedPrev = LedgerCanonicalForm.GENESIS;
        long expectedSeq = 1L;
        int checked = 0;
        for (int i = 0; i < entries.size(); i++) {
            LedgerEntry e = entries.get(i);
            VerificationReport.Reason reason = null;
            long broken = e.getSequence();

            if (e.getSequence() != expectedSeq) {
                reason = VerificationReport.Reason.SEQUENCE_GAP;
                broken = expectedSeq;
            } else if (!e.getHashPrev().equals(expectedPrev)) {
                reason = VerificationReport.Reason.HASH_PREV_MISMATCH;
            } else if (!LedgerCanonicalForm.chainHash(e.getHashPrev(), e.getSequence(), e.getRepoId(),
                    e.getManifestPointer(), e.getTimestamp()).equals(e.getHashSelf())) {
                reason = VerificationReport.Reason.HASH_SELF_MISMATCH;
            }

            if (reason != null) {
                List<Long> untrusted = new ArrayList<>();
                for (LedgerEntry later : entries.subList(i, entries.size())) {
                    if (later.getSequence() > broken) untrusted.add(later.getSequence());
                }
                return fail(VerificationReport.broken(repoId, checked, broken, untrusted, reason));
            }
            checked++;
            expectedPrev = e.getHashSelf();
            expectedSeq++;
        }

        LedgerEntry last = entries.isEmpty() ? null : entries.get(entries.size() - 1);
        boolean headMatches = (last == null)
                ? storedHead.isEmpty()
                : storedHead.isPresent() && storedHead.get().equals(last);
        if (!headMatches) {
            long broken = (last == null) ? 1L : last.getSequence() + 1;
            return fail(VerificationReport.broken(repoId, checked, broken, List.of(),
                    VerificationReport.Reason.HEAD_MISMATCH));
        }

        logger.info("Ledger verified for {}: {} entries", repoId, checked);
        return VerificationReport.intact(repoId, checked);
    }

    private VerificationReport fail(VerificationReport report) {
        halted.put(report.getRepoId(), report.getFirstBrokenSequence());
        logger.error("Ledger chain broken, halting appends: {}", report);
        return report;
    }

    /**
     * Operator action after investigating a broken chain: lifts the halt and re-reads the head from the store.
     */
    public void reconcile(String repoId) {
        ReentrantLock lock = locks.computeIfAbsent(repoId, r -> new ReentrantLock());
        lock.lock();
        try {
            Long broken = halted.remove(repoId);
            heads.remove(repoId);
            logger.warn("Ledger for {} reconciled by operator (was broken at {})", repoId, broken);
        } finally {
            lock.unlock();
        }
    }

    public boolean isHalted(String repoId) {
        return halted.containsKey(repoId);
    }

    public List<LedgerEntry> entries(String repoId) {
        try {
            return store.read(repoId);
        } catch (IOException e) {
            throw new LedgerUnavailableException("Ledger read failed for " + repoId, e);
        }
    }

    public Optional<LedgerEntry> head(String repoId) {
        try {
            return store.head(repoId);
        } catch (IOException e) {
            throw new LedgerUnavailableException("Ledger read failed for " + repoId, e);
        }
    }

    public Set<String> repositories() {
        try {
            return store.repositories();
        } catch (IOException e) {
            throw new LedgerUnavailableException("Ledger read failed", e);
        }
    }

    private LedgerEntry currentHead(String repoId) {
        LedgerEntry cached = heads.get(repoId);
        if (cached != null) return cached;
        try {
            LedgerEntry stored = store.head(repoId).orElse(null);
            if (stored != null) heads.put(repoId, stored);
            return stored;
        } catch (IOException e) {
            throw new LedgerUnavailableException("Ledger head unavailable for " + repoId, e);
        }
    }

    private void checkNotHalted(String repoId) {
        Long broken = halted.get(repoId);
        if (broken != null) {
            throw new SequenceGapException(repoId, broken,
                    "Ledger for " + repoId + " is halted at sequence " + broken + " pending reconciliation");
        }
    }

    @Override
    public void close() {
        store.close();
    }
}

package com.evg.store;

import com.evg.buffer.RetryBuffer;
import com.evg.buffer.RetryBufferEntry;
import com.evg.buffer.RetryPayload;
import com.evg.common.*;
import com.evg.crypto.EncryptionEngine;
import com.evg.crypto.Envelope;
import com.evg.crypto.EnvelopeCodec;
import com.evg.key.KeyManager;
import com.evg.key.RotationReport;
import com.evg.key.RotationSchedule;
import com.evg.ledger.LedgerWriter;
import com.evg.store.SegmentCodec.StoredBatch;
import com.evg.store.backend.ShardBackend;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Repository-scoped store of sealed embedding batches.
 * <p>
 * Each repository has one shard: a catalog ({@code shard.json}) listing sealed segment objects with their
 * SHA-256. A commit writes the segment, then the catalog, then the ledger entry, and only then publishes the
 * new {@link ShardVersion} to readers. A ledger failure rolls the catalog back. Queries and exports pin the
 * version current when they start and never wait for the committer.
 * <p>
 * Transient backend failures during {@link #put} are retried per {@link RetryPolicy} and then handed to the
 * {@link RetryBuffer}; integrity and cryptographic failures are always thrown.
 */
public class VectorStore implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(VectorStore.class);

    private final ShardBackend backend;
    private final KeyManager keys;
    private final EncryptionEngine engine;
    private final LedgerWriter ledger;
    private final RetryBuffer buffer;
    private final RetryPolicy retry;
    private final Clock clock;

    private final ConcurrentMap<String, Shard> shards = new ConcurrentHashMap<>();
    /** Held by a put from sequence reservation until it commits or is buffered. */
    private final ConcurrentMap<String, ReentrantLock> writers = new ConcurrentHashMap<>();

    private final Timer putCommitted;
    private final Timer putBuffered;
    private final Timer queryTimer;
    private final Timer compactTimer;

    public VectorStore(ShardBackend backend, KeyManager keys, EncryptionEngine engine,
                       LedgerWriter ledger, RetryBuffer buffer, RetryPolicy retry) {
        this(backend, keys, engine, ledger, buffer, retry, Clock.systemUTC(), new SimpleMeterRegistry());
    }

    public VectorStore(ShardBackend backend, KeyManager keys, EncryptionEngine engine,
                       LedgerWriter ledger, RetryBuffer buffer, RetryPolicy retry,
                       Clock clock, MeterRegistry registry) {
        this.backend = Objects.requireNonNull(backend, "backend");
        this.keys = Objects.requireNonNull(keys, "keys");
        this.engine = Objects.requireNonNull(engine, "engine");
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.buffer = Objects.requireNonNull(buffer, "buffer");
        this.retry = Objects.requireNonNull(retry, "retry");
        this.clock = Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(registry, "registry");

        this.putCommitted = Timer.builder("evg.store.put")
                .description("VectorStore.put latency")
                .tag("outcome", "committed")
                .register(registry);
        this.putBuffered = Timer.builder("evg.store.put")
                .description("VectorStore.put latency")
                .tag("outcome", "buffered")
                .register(registry);
        this.queryTimer = Timer.builder("evg.store.query")
                .description("VectorStore.query latency")
                .register(registry);
        this.compactTimer = Timer.builder("evg.store.compact")
                .description("VectorStore.compact latency")
                .register(registry);
    }

    /* --------------------------------------------------------
     * OPEN / VALIDATE
     * -------------------------------------------------------- */

    /**
     * Loads every shard the backend holds and validates each segment against its catalog checksum.
     * Unreferenced segment objects left by an interrupted commit are deleted.
     *
     * @return shards that failed validation; they stay on disk and refuse reads and writes
     */
    public List<QuarantinedShard> openShards() {
        Set<String> repos;
        try {
            repos = backend.repositories();
        } catch (IOException e) {
            throw new StorageUnavailableException("Cannot list shard repositories", e);
        }
        for (String repoId : repos) {
            Shard shard = shards.computeIfAbsent(repoId, this::loadShard);
            if (!shard.isQuarantined()) validate(shard);
        }
        List<QuarantinedShard> q = quarantined();
        if (q.isEmpty()) {
            logger.info("Opened {} shards", shards.size());
        } else {
            logger.error("Opened {} shards, {} quarantined: {}", shards.size(), q.size(), q);
        }
        return q;
    }

    private void validate(Shard shard) {
        ShardVersion v = shard.pin();
        try {
            Set<String> referenced = new HashSet<>();
            for (SegmentRef seg : v.getSegments()) {
                referenced.add(seg.getSegmentId());
                readSegment(shard, seg);
            }
            for (String name : listObjects(shard.repoId())) {
                if (name.startsWith("seg-") && !referenced.contains(name)) {
                    logger.warn("Removing unreferenced segment {} of {}", name, shard.repoId());
                    deleteQuietly(shard.repoId(), name);
                }
            }
        } catch (ShardCorruptionException e) {
            logger.debug("Validation stopped for {}: {}", shard.repoId(), e.getMessage());
        } finally {
            shard.unpin(v);
        }
    }

    private Shard shardFor(String repoId) {
        return shards.computeIfAbsent(repoId, this::loadShard);
    }

    private Shard loadShard(String repoId) {
        String shardId = shardIdFor(repoId);
        Optional<byte[]> raw;
        try {
            raw = backend.get(repoId, ShardCatalog.OBJECT_NAME);
        } catch (IOException e) {
            throw new TransientIOException("Cannot read shard catalog for " + repoId, e);
        }
        if (raw.isEmpty()) {
            Shard shard = new Shard(ShardVersion.empty(shardId, repoId));
            boolean orphaned = listObjects(repoId).stream().anyMatch(n -> n.startsWith("seg-"));
            if (orphaned) {
                quarantine(shard, "segments present but catalog missing");
            }
            return shard;
        }
        try {
            ShardVersion v = ShardCatalog.decode(raw.get());
            Shard shard = new Shard(v);
            if (!v.getRepoId().equals(repoId)) {
                quarantine(shard, "catalog belongs to repository " + v.getRepoId());
            }
            return shard;
        } catch (IOException e) {
            Shard shard = new Shard(ShardVersion.empty(shardId, repoId));
            quarantine(shard, "unreadable catalog: " + e.getMessage());
            return shard;
        }
    }

    static String shardIdFor(String repoId) {
        return "shard-" + Checksums.sha256Hex(repoId).substring(0, 16);
    }

    /* --------------------------------------------------------
     * WRITE PATH
     * -------------------------------------------------------- */

    /**
     * Seals and commits one batch. A write sequence is reserved before the first attempt and kept if the
     * write ends up buffered. While the repository has buffered writes, new writes queue behind them.
     * Puts to the same repository run one at a time, so a later put cannot commit while an earlier one is
     * still backing off.
     *
     * @throws StorageUnavailableException the backend is unreachable and the buffer refuses the write
     */
    public PutAcknowledgement put(EmbeddingBatch batch, ManifestDiff manifest) {
        Objects.requireNonNull(batch, "batch");
        Objects.requireNonNull(manifest, "manifest");
        long started = System.nanoTime();
        ReentrantLock writer = writers.computeIfAbsent(batch.getRepoId(), r -> new ReentrantLock(true));
        writer.lock();
        try {
            return putInOrder(started, batch, manifest);
        } finally {
            writer.unlock();
        }
    }

    private PutAcknowledgement putInOrder(long started, EmbeddingBatch batch, ManifestDiff manifest) {
        String repoId = batch.getRepoId();
        long sequence = buffer.reserveSequence();
        byte[] encoded = SegmentCodec.encode(batch, manifest.getManifestId());

        RetryPayload payload;
        try {
            KeyHandle handle = keys.current(repoId);
            Envelope env = engine.seal(encoded, handle);
            payload = RetryPayload.sealed(batch.getBatchId(), manifest.getManifestId(),
                    manifest.getRemovedBatchIds(), handle.getKeyId(), env.toBytes());
        } catch (KeyStoreUnavailableException e) {
            logger.warn("Key store unavailable for {}, batch {} will be sealed on replay", repoId, batch.getBatchId(), e);
            return buffered(started, sequence, repoId, RetryPayload.sealPending(batch.getBatchId(),
                    manifest.getManifestId(), manifest.getRemovedBatchIds(), encoded), 1);
        }

        if (buffer.hasPending(repoId)) {
            logger.debug("Repository {} has buffered writes, queueing batch {} behind them", repoId, batch.getBatchId());
            return buffered(started, sequence, repoId, payload, 0);
        }

        for (int attempt = 1; ; attempt++) {
            try {
                StoreWriteReceipt receipt = commit(repoId, payload.getBatchId(), payload.getManifestId(),
                        payload.getRemovedBatchIds(), payload.getKeyId(), payload.getBytes(), false);
                putCommitted.record(System.nanoTime() - started, TimeUnit.NANOSECONDS);
                logger.debug("Committed seq={} {}", sequence, receipt);
                return PutAcknowledgement.committed(repoId, sequence, receipt);
            } catch (TransientIOException e) {
                boolean exhausted = attempt >= retry.getMaxAttempts();
                if (exhausted || !retry.pause(attempt)) {
                    logger.warn("Backend unavailable for {} after {} attempts, buffering batch {} at sequence {}",
                            repoId, attempt, batch.getBatchId(), sequence, e);
                    return buffered(started, sequence, repoId, payload, attempt);
                }
                logger.warn("Commit attempt {}/{} failed for {}: {}", attempt, retry.getMaxAttempts(), repoId, e.getMessage());
            }
        }
    }

    /**
     * Single commit attempt for a buffered write. Sealed payloads are committed byte for byte; seal-pending
     * payloads are sealed under the repository's current key first.
     * <p>
     * A sealed payload whose commit already finished (restored from a snapshot taken before it was completed)
     * is not committed again: the receipt of the recorded commit is returned.
     *
     * @throws TransientIOException the backend or ledger is still unavailable
     */
    public StoreWriteReceipt replay(RetryBufferEntry entry) {
        Objects.requireNonNull(entry, "entry");
        RetryPayload p = entry.getPayload();
        String repoId = entry.getRepoId();
        byte[] envelope;
        String keyId;
        if (p.getStage() == RetryPayload.Stage.SEALED) {
            envelope = p.getBytes();
            keyId = EnvelopeCodec.peekKeyId(envelope);
        } else {
            KeyHandle handle = keys.current(repoId);
            envelope = engine.seal(p.getBytes(), handle).toBytes();
            keyId = handle.getKeyId();
        }
        boolean resumable = p.getStage() == RetryPayload.Stage.SEALED;
        StoreWriteReceipt receipt = commit(repoId, p.getBatchId(), p.getManifestId(), p.getRemovedBatchIds(),
                keyId, envelope, resumable);
        logger.debug("Replayed seq={} (attempt {}) as {}", entry.getSequence(), entry.getAttemptCount() + 1, receipt);
        return receipt;
    }

    private PutAcknowledgement buffered(long started, long sequence, String repoId, RetryPayload payload, int attempts) {
        try {
            buffer.push(RetryBufferEntry.of(sequence, repoId, payload, attempts));
        } catch (BufferFullException e) {
            throw new StorageUnavailableException("Backend unavailable and retry buffer full, write for "
                    + repoId + " at sequence " + sequence + " not accepted", e);
        }
        putBuffered.record(System.nanoTime() - started, TimeUnit.NANOSECONDS);
        return PutAcknowledgement.buffered(repoId, sequence);
    }

    private StoreWriteReceipt commit(String repoId, String batchId, String manifestId, List<String> removed,
                                     String keyId, byte[] envelope, boolean resumable) {
        Shard shard = shardFor(repoId);
        ReentrantLock lock = shard.committer();
        lock.lock();
        try {
            requireReadable(shard);
            ShardVersion base = shard.current();
            String checksum = Checksums.sha256Hex(envelope);
            String pointer = commitPointer(manifestId, batchId, checksum);
            if (resumable) {
                StoreWriteReceipt done = findCommitted(shard, base, batchId, checksum, pointer);
                if (done != null) return done;
            }
            SegmentRef seg = new SegmentRef(SegmentRef.nameFor(base.getNextSegmentNo()), checksum, keyId,
                    envelope.length, List.of(batchId), base.getVersion() + 1);
            ShardVersion next = base.withSegment(seg, removed);

            LedgerEntry entry = install(shard, base, next, Map.of(seg, envelope), pointer);
            shard.publish(next, List.of());
            return new StoreWriteReceipt(base.getShardId(), batchId, entry.getTimestamp(), checksum, entry.auditPointer());
        } finally {
            lock.unlock();
        }
    }

    static String commitPointer(String manifestId, String batchId, String checksum) {
        return "manifest:" + manifestId + "/batch:" + batchId + "/sha256:" + checksum;
    }

    /**
     * Receipt of an earlier commit of the same envelope, or null if there was none. A segment that reached
     * the catalog without its ledger entry gets the entry now.
     */
    private StoreWriteReceipt findCommitted(Shard shard, ShardVersion base, String batchId,
                                            String checksum, String pointer) {
        String repoId = shard.repoId();
        List<LedgerEntry> recorded = ledger.entries(repoId);
        for (int i = recorded.size() - 1; i >= 0; i--) {
            LedgerEntry e = recorded.get(i);
            if (e.getManifestPointer().equals(pointer)) {
                logger.info("Batch {} of {} already committed as {}, not committing it again",
                        batchId, repoId, e.auditPointer());
                return new StoreWriteReceipt(base.getShardId(), batchId, e.getTimestamp(), checksum, e.auditPointer());
            }
        }
        boolean inCatalog = base.getSegments().stream().anyMatch(s -> s.getSha256().equals(checksum));
        if (!inCatalog) return null;

        LedgerEntry e = ledger.append(pointer, repoId);
        logger.warn("Segment of batch {} in {} had no ledger entry, recorded it as {}", batchId, repoId, e.auditPointer());
        return new StoreWriteReceipt(base.getShardId(), batchId, e.getTimestamp(), checksum, e.auditPointer());
    }

    /**
     * Writes new segments and the catalog for {@code next}, then records {@code pointer} in the ledger.
     * On ledger failure the previous catalog is restored and the new segments are removed.
     */
    private LedgerEntry install(Shard shard, ShardVersion base, ShardVersion next,
                                Map<SegmentRef, byte[]> segments, String pointer) {
        String repoId = shard.repoId();
        try {
            for (Map.Entry<SegmentRef, byte[]> e : segments.entrySet()) {
                backend.put(repoId, e.getKey().getSegmentId(), e.getValue());
            }
            backend.put(repoId, ShardCatalog.OBJECT_NAME, ShardCatalog.encode(next));
        } catch (IOException e) {
            for (SegmentRef ref : segments.keySet()) deleteQuietly(repoId, ref.getSegmentId());
            throw new TransientIOException("Shard write failed for " + repoId, e);
        }

        try {
            return ledger.append(pointer, repoId);
        } catch (RuntimeException e) {
            rollback(shard, base, segments.keySet());
            throw e;
        }
    }

    private void rollback(Shard shard, ShardVersion base, Collection<SegmentRef> written) {
        String repoId = shard.repoId();
        try {
            if (base.getVersion() == 0) {
                backend.delete(repoId, ShardCatalog.OBJECT_NAME);
            } else {
                backend.put(repoId, ShardCatalog.OBJECT_NAME, ShardCatalog.encode(base));
            }
        } catch (IOException e) {
            logger.error("Catalog rollback failed for {}", repoId, e);
            quarantine(shard, "catalog rollback to version " + base.getVersion() + " failed");
            return;
        }
        for (SegmentRef ref : written) deleteQuietly(repoId, ref.getSegmentId());
        logger.warn("Rolled back shard {} of {} to version {}", base.getShardId(), repoId, base.getVersion());
    }

    /* --------------------------------------------------------
     * READ PATH
     * -------------------------------------------------------- */

    /**
     * Cosine-similarity search over the selected shards. Only segments that can contain a wanted, live batch
     * are decrypted. Ordering is deterministic: score descending, then batch id and vector index ascending.
     *
     * @throws ShardCorruptionException a selected shard is quarantined or fails its checksum now
     * @throws StorageUnavailableException reads kept failing after retries
     */
    public QueryResultSet query(QueryCriteria criteria) {
        Objects.requireNonNull(criteria, "criteria");
        long started = System.nanoTime();
        List<String> targets = criteria.getRepoIds().isEmpty()
                ? new ArrayList<>(new TreeSet<>(shards.keySet()))
                : new ArrayList<>(criteria.getRepoIds());

        List<QueryHit> hits = new ArrayList<>();
        int scanned = 0;
        int decrypted = 0;
        for (String repoId : targets) {
            Shard shard = shardForRead(repoId);
            if (shard == null) continue;
            requireReadable(shard);
            ShardVersion v = shard.pin();
            try {
                scanned++;
                for (SegmentRef seg : v.getSegments()) {
                    if (!mayContainWanted(seg, v, criteria)) continue;
                    List<StoredBatch> batches = openSegment(shard, seg);
                    decrypted++;
                    for (StoredBatch b : batches) {
                        if (v.getRemovedBatchIds().contains(b.batchId())) continue;
                        if (!criteria.getBatchIds().isEmpty() && !criteria.getBatchIds().contains(b.batchId())) continue;
                        score(repoId, b, criteria, hits);
                    }
                }
            } finally {
                shard.unpin(v);
                reclaim(shard);
            }
        }

        hits.sort(QueryHit.ORDER);
        List<QueryHit> top = (hits.size() > criteria.getK()) ? hits.subList(0, criteria.getK()) : hits;
        QueryResultSet result = new QueryResultSet(top, scanned, decrypted);
        queryTimer.record(System.nanoTime() - started, TimeUnit.NANOSECONDS);
        logger.debug("Query {} -> {}", criteria, result);
        return result;
    }

    private static boolean mayContainWanted(SegmentRef seg, ShardVersion v, QueryCriteria criteria) {
        if (!criteria.getBatchIds().isEmpty() && !seg.containsAny(criteria.getBatchIds())) return false;
        return seg.getBatchIds().isEmpty() || !v.getRemovedBatchIds().containsAll(seg.getBatchIds());
    }

    private static void score(String repoId, StoredBatch b, QueryCriteria criteria, List<QueryHit> out) {
        List<Embedding> embeddings = b.batch().getEmbeddings();
        for (int i = 0; i < embeddings.size(); i++) {
            Embedding e = embeddings.get(i);
            if (!criteria.matches(e.getAttributes())) continue;
            double score = 0.0;
            if (criteria.hasVector()) {
                if (e.getDimension() != criteria.vectorRef().length) continue;
                score = cosine(criteria.vectorRef(), e.getValues());
            }
            out.add(new QueryHit(repoId, b.batchId(), i, e.getVectorId(), score, e.getAttributes()));
        }
    }

    static double cosine(float[] a, float[] b) {
        double dot = 0.0;
        double na = 0.0;
        double nb = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
            na += (double) a[i] * a[i];
            nb += (double) b[i] * b[i];
        }
        if (na == 0.0 || nb == 0.0) return 0.0;
        return dot / (Math.sqrt(na) * Math.sqrt(nb));
    }

    /**
     * Sealed segments committed after the cursor, oldest commit first, without decrypting them.
     * The returned stream pins a shard version and must be closed.
     */
    public Stream<ExportRecord> export(ExportCursor cursor) {
        Objects.requireNonNull(cursor, "cursor");
        String repoId = cursor.getRepoId();
        Shard shard = shardForRead(repoId);
        if (shard == null) return Stream.empty();
        requireReadable(shard);
        ShardVersion v = shard.pin();
        List<SegmentRef> selected = v.getSegments().stream()
                .filter(s -> s.getCommitVersion() > cursor.getAfterVersion())
                .filter(s -> s.getBatchIds().isEmpty() || !v.getRemovedBatchIds().containsAll(s.getBatchIds()))
                .sorted(Comparator.comparingLong(SegmentRef::getCommitVersion).thenComparing(SegmentRef::getSegmentId))
                .collect(Collectors.toList());
        logger.debug("Exporting {} segments of {} after version {}", selected.size(), repoId, cursor.getAfterVersion());
        return selected.stream()
                .map(seg -> new ExportRecord(repoId, seg.getSegmentId(), seg.getCommitVersion(), seg.getKeyId(),
                        seg.getSha256(), readSegment(shard, seg)))
                .onClose(() -> {
                    shard.unpin(v);
                    reclaim(shard);
                });
    }

    /** The repository's shard, or null if the backend holds none. Never creates a shard. */
    private Shard shardForRead(String repoId) {
        Shard shard = shards.get(repoId);
        if (shard != null) return shard;
        try {
            if (!backend.repositories().contains(repoId)) return null;
            return shardFor(repoId);
        } catch (IOException | TransientIOException e) {
            throw new StorageUnavailableException("Degraded read: catalog of " + repoId + " unavailable", e);
        }
    }

    private List<StoredBatch> openSegment(Shard shard, SegmentRef seg) {
        byte[] sealed = readSegment(shard, seg);
        byte[] plain = engine.open(sealed, keys.get(seg.getKeyId()), shard.repoId());
        try {
            return SegmentCodec.decode(plain);
        } catch (IOException e) {
            throw quarantine(shard, "segment " + seg.getSegmentId() + " has an unreadable body");
        }
    }

    /** Reads a segment with retries and checks it against the catalog checksum. */
    private byte[] readSegment(Shard shard, SegmentRef seg) {
        String repoId = shard.repoId();
        Optional<byte[]> raw = Optional.empty();
        IOException last = null;
        boolean read = false;
        for (int attempt = 1; attempt <= retry.getMaxAttempts() && !read; attempt++) {
            try {
                raw = backend.get(repoId, seg.getSegmentId());
                read = true;
            } catch (IOException e) {
                last = e;
                logger.warn("Read of {}/{} failed (attempt {}/{}): {}", repoId, seg.getSegmentId(),
                        attempt, retry.getMaxAttempts(), e.getMessage());
                if (attempt < retry.getMaxAttempts() && !retry.pause(attempt)) break;
            }
        }
        if (!read) {
            throw new StorageUnavailableException("Degraded read: segment " + seg.getSegmentId() + " of " + repoId, last);
        }
        if (raw.isEmpty()) {
            throw quarantine(shard, "segment " + seg.getSegmentId() + " missing");
        }
        byte[] bytes = raw.get();
        if (!Checksums.sha256Hex(bytes).equals(seg.getSha256())) {
            throw quarantine(shard, "segment " + seg.getSegmentId() + " failed checksum validation");
        }
        return bytes;
    }

    /* --------------------------------------------------------
     * COMPACTION / ROTATION
     * -------------------------------------------------------- */

    /**
     * Merges each qualifying shard into a single segment sealed under the repository's current key,
     * dropping tombstoned batches. Repositories with a rotation in progress are deferred.
     */
    public CompactionReport compact(CompactionPolicy policy) {
        Objects.requireNonNull(policy, "policy");
        long started = System.nanoTime();
        List<String> compacted = new ArrayList<>();
        List<String> deferred = new ArrayList<>();
        List<String> quarantinedRepos = new ArrayList<>();
        List<String> resealed = new ArrayList<>();
        Map<String, String> failed = new LinkedHashMap<>();
        int segBefore = 0;
        int segAfter = 0;
        long bytesBefore = 0;
        long bytesAfter = 0;

        Set<String> targets = new TreeSet<>(policy.getRepoIds().isEmpty() ? shards.keySet() : policy.getRepoIds());
        for (String repoId : targets) {
            Shard shard;
            try {
                shard = shardForRead(repoId);
            } catch (StorageUnavailableException e) {
                failed.put(repoId, String.valueOf(e.getMessage()));
                continue;
            }
            if (shard == null) continue;
            if (shard.isQuarantined()) {
                quarantinedRepos.add(repoId);
                continue;
            }
            if (keys.isRotationInProgress(repoId)) {
                logger.info("Deferring compaction of {}: key rotation in progress", repoId);
                deferred.add(repoId);
                continue;
            }

            ReentrantLock lock = shard.committer();
            lock.lock();
            try {
                if (keys.isRotationInProgress(repoId)) {
                    logger.info("Deferring compaction of {}: key rotation in progress", repoId);
                    deferred.add(repoId);
                    continue;
                }
                ShardVersion base = shard.current();
                boolean reseal = base.isResealPending() || (policy.isKeyCurrency() && hasStaleKey(base));
                boolean due = base.getSegments().size() >= policy.getMinSegments()
                        || !base.getRemovedBatchIds().isEmpty()
                        || reseal;
                if (!due) continue;

                ShardVersion next = rewrite(shard, base);
                compacted.add(repoId);
                if (reseal) resealed.add(repoId);
                segBefore += base.getSegments().size();
                segAfter += next.getSegments().size();
                bytesBefore += base.sizeBytes();
                bytesAfter += next.sizeBytes();
            } catch (TransientIOException | StorageUnavailableException e) {
                failed.put(repoId, String.valueOf(e.getMessage()));
                logger.warn("Compaction failed for {}", repoId, e);
            } catch (ShardCorruptionException e) {
                quarantinedRepos.add(repoId);
            } finally {
                lock.unlock();
            }
            reclaim(shard);
        }

        CompactionReport report = new CompactionReport(compacted, deferred, quarantinedRepos, resealed, failed,
                segBefore, segAfter, bytesBefore, bytesAfter);
        compactTimer.record(System.nanoTime() - started, TimeUnit.NANOSECONDS);
        logger.info("Compaction finished: {}", report);
        return report;
    }

    private boolean hasStaleKey(ShardVersion v) {
        if (v.getSegments().isEmpty()) return false;
        String currentKeyId = keys.current(v.getRepoId()).getKeyId();
        for (SegmentRef s : v.getSegments()) {
            if (!s.getKeyId().equals(currentKeyId)) return true;
        }
        return false;
    }

    private ShardVersion rewrite(Shard shard, ShardVersion base) {
        String repoId = shard.repoId();
        List<StoredBatch> live = new ArrayList<>();
        for (SegmentRef seg : base.getSegments()) {
            for (StoredBatch b : openSegment(shard, seg)) {
                if (!base.getRemovedBatchIds().contains(b.batchId())) live.add(b);
            }
        }

        Map<SegmentRef, byte[]> written = new LinkedHashMap<>();
        List<SegmentRef> merged = new ArrayList<>();
        if (!live.isEmpty()) {
            KeyHandle handle = keys.current(repoId);
            byte[] envelope = engine.seal(SegmentCodec.encode(live), handle).toBytes();
            List<String> batchIds = live.stream().map(StoredBatch::batchId).collect(Collectors.toList());
            SegmentRef ref = new SegmentRef(SegmentRef.nameFor(base.getNextSegmentNo()), Checksums.sha256Hex(envelope),
                    handle.getKeyId(), envelope.length, batchIds, base.getVersion() + 1);
            merged.add(ref);
            written.put(ref, envelope);
        }

        ShardVersion next = base.compactedTo(merged, clock.millis());
        String pointer = String.format("compact:%s/version:%d/segments:%d->%d/sha256:%s",
                base.getShardId(), next.getVersion(), base.getSegments().size(), merged.size(),
                merged.isEmpty() ? "-" : merged.get(0).getSha256());
        install(shard, base, next, written, pointer);

        List<String> retired = base.getSegments().stream().map(SegmentRef::getSegmentId).collect(Collectors.toList());
        shard.publish(next, retired);
        logger.info("Compacted {}: {} segments -> {}, {} tombstoned batches dropped",
                repoId, base.getSegments().size(), merged.size(), base.getRemovedBatchIds().size());
        return next;
    }

    /**
     * Rotates keys through the {@link KeyManager} and marks the shards of rotated repositories for re-seal
     * on their next compaction. Existing segments stay readable under their original keys.
     */
    public RotationReport rotateKeys(RotationSchedule schedule) {
        RotationReport report = keys.rotate(schedule);
        for (String repoId : report.getSucceeded()) {
            Shard shard = shards.get(repoId);
            if (shard != null) markForReseal(shard);
        }
        return report;
    }

    private void markForReseal(Shard shard) {
        ReentrantLock lock = shard.committer();
        lock.lock();
        try {
            ShardVersion base = shard.current();
            if (shard.isQuarantined() || base.getSegments().isEmpty() || base.isResealPending()) return;
            ShardVersion next = base.markedForReseal();
            backend.put(shard.repoId(), ShardCatalog.OBJECT_NAME, ShardCatalog.encode(next));
            shard.publish(next, List.of());
            logger.info("Shard {} of {} marked for re-seal", base.getShardId(), shard.repoId());
        } catch (IOException e) {
            logger.warn("Could not mark shard of {} for re-seal; key-currency compaction still applies", shard.repoId(), e);
        } finally {
            lock.unlock();
        }
    }

    /* --------------------------------------------------------
     * HOUSEKEEPING
     * -------------------------------------------------------- */

    private void reclaim(Shard shard) {
        for (String name : shard.reclaimable()) {
            deleteQuietly(shard.repoId(), name);
            logger.debug("Reclaimed retired segment {} of {}", name, shard.repoId());
        }
    }

    private void deleteQuietly(String repoId, String name) {
        try {
            backend.delete(repoId, name);
        } catch (IOException e) {
            logger.warn("Could not delete {}/{}; it is removed on the next open", repoId, name, e);
        }
    }

    private List<String> listObjects(String repoId) {
        try {
            return backend.list(repoId);
        } catch (IOException e) {
            throw new TransientIOException("Cannot list objects of " + repoId, e);
        }
    }

    private ShardCorruptionException quarantine(Shard shard, String reason) {
        shard.quarantine(reason);
        logger.error("Quarantined shard of {}: {}", shard.repoId(), reason);
        return new ShardCorruptionException(shard.repoId(), "Shard of " + shard.repoId() + " is quarantined: " + reason);
    }

    private static void requireReadable(Shard shard) {
        if (shard.isQuarantined()) {
            throw new ShardCorruptionException(shard.repoId(),
                    "Shard of " + shard.repoId() + " is quarantined: " + shard.quarantineReason());
        }
    }

    public Optional<ShardDescriptor> describe(String repoId) {
        Shard shard = shards.get(repoId);
        return (shard == null) ? Optional.empty() : Optional.of(shard.current().descriptor());
    }

    /** Current version of a repository's shard, 0 if it has none. */
    public long commitVersion(String repoId) {
        Shard shard = shards.get(repoId);
        return (shard == null) ? 0L : shard.current().getVersion();
    }

    public List<QuarantinedShard> quarantined() {
        List<QuarantinedShard> out = new ArrayList<>();
        for (String repoId : new TreeSet<>(shards.keySet())) {
            Shard s = shards.get(repoId);
            if (s.isQuarantined()) {
                out.add(new QuarantinedShard(repoId, s.current().getShardId(), s.quarantineReason()));
            }
        }
        return out;
    }

    public Set<String> repositories() {
        return Collections.unmodifiableSet(new TreeSet<>(shards.keySet()));
    }

    int pinnedReaders(String repoId) {
        Shard s = shards.get(repoId);
        return (s == null) ? 0 : s.pinnedReaders();
    }

    @Override
    public void close() {
        backend.close();
        logger.info("VectorStore closed ({} shards)", shards.size());
    }
}

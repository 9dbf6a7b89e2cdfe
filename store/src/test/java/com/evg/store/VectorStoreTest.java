package com.evg.store;

import com.evg.buffer.OverflowPolicy;
import com.evg.buffer.RetryBuffer;
import com.evg.buffer.RetryBufferEntry;
import com.evg.buffer.RetryPayload;
import com.evg.common.*;
import com.evg.crypto.AesGcmEncryptionEngine;
import com.evg.crypto.EncryptionEngine;
import com.evg.crypto.EnvelopeCodec;
import com.evg.key.DerivedKeyProvider;
import com.evg.key.KeyManager;
import com.evg.key.KeyProvider;
import com.evg.key.RotationReport;
import com.evg.key.RotationSchedule;
import com.evg.ledger.InMemoryLedgerStore;
import com.evg.ledger.LedgerStore;
import com.evg.ledger.LedgerWriter;
import com.evg.store.backend.FileShardBackend;
import com.evg.store.backend.ShardBackend;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.AdditionalAnswers;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.*;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@DisplayName("VectorStore Tests")
class VectorStoreTest {

    private static final byte[] MASTER = new byte[32];

    @TempDir
    Path dir;

    private FileShardBackend files;
    private KeyManager keys;
    private EncryptionEngine engine;
    private InMemoryLedgerStore ledgerStore;
    private LedgerWriter ledger;
    private RetryBuffer buffer;
    private SimpleMeterRegistry registry;
    private VectorStore store;

    @BeforeEach
    void setUp() throws IOException {
        files = new FileShardBackend(dir.resolve("shards"));
        keys = new KeyManager(dir.resolve("keys/keystore.blob"), new DerivedKeyProvider(MASTER));
        engine = new AesGcmEncryptionEngine();
        ledgerStore = new InMemoryLedgerStore();
        ledger = new LedgerWriter(ledgerStore);
        buffer = new RetryBuffer(100, 60_000L, OverflowPolicy.EVICT_OLDEST);
        registry = new SimpleMeterRegistry();
        store = newStore(files, keys, ledger);
    }

    private VectorStore newStore(ShardBackend backend, KeyManager km, LedgerWriter lw) {
        return new VectorStore(backend, km, engine, lw, buffer, RetryPolicy.noBackoff(2), Clock.systemUTC(), registry);
    }

    private static EmbeddingBatch batch(String repo, String batchId, float[]... vectors) {
        List<Embedding> es = new ArrayList<>();
        for (int i = 0; i < vectors.length; i++) {
            es.add(new Embedding(batchId + "-v" + i, vectors[i], Map.of("lang", (i % 2 == 0) ? "en" : "de")));
        }
        return new EmbeddingBatch(repo, batchId, es);
    }

    private static float[] v(float... xs) {
        return xs;
    }

    private PutAcknowledgement put(String repo, String batchId, float[]... vectors) {
        return store.put(batch(repo, batchId, vectors), ManifestDiff.adding("m-" + batchId, batchId));
    }

    private static String segmentName(int n) {
        return SegmentRef.nameFor(n);
    }

    /* ---------------- put ---------------- */

    @Test
    @DisplayName("put commits a sealed segment and records it in the ledger")
    void putCommitsAndAppendsLedger() throws IOException {
        PutAcknowledgement ack = put("repo", "b1", v(1, 0));

        assertTrue(ack.isCommitted());
        StoreWriteReceipt receipt = ack.getReceipt().orElseThrow();
        assertEquals("b1", receipt.getBatchId());
        assertEquals("repo#1", receipt.getAuditPointer());
        assertEquals(VectorStore.shardIdFor("repo"), receipt.getShardId());

        byte[] stored = files.get("repo", segmentName(1)).orElseThrow();
        assertEquals(Checksums.sha256Hex(stored), receipt.getChecksum());
        assertEquals("repo#e1", EnvelopeCodec.peekKeyId(stored));

        List<LedgerEntry> entries = ledger.entries("repo");
        assertEquals(1, entries.size());
        assertEquals("manifest:m-b1/batch:b1/sha256:" + receipt.getChecksum(), entries.get(0).getManifestPointer());

        ShardDescriptor d = store.describe("repo").orElseThrow();
        assertEquals(1L, d.getCommitVersion());
        assertEquals("repo#e1", d.getKeyId());
        assertEquals(stored.length, d.getSizeBytes());
        assertEquals(1L, registry.get("evg.store.put").tag("outcome", "committed").timer().count());
    }

    @Test
    void plaintextNeverReachesTheBackend() throws IOException {
        put("repo", "secret-batch", v(1, 2, 3));
        byte[] stored = files.get("repo", segmentName(1)).orElseThrow();
        String asText = new String(stored, java.nio.charset.StandardCharsets.ISO_8859_1);
        assertFalse(asText.contains("secret-batch-v0"));
    }

    @Test
    @DisplayName("backend outage: retried, then buffered with the reserved sequence")
    void backendOutageBuffers() throws IOException {
        ShardBackend flaky = mock(ShardBackend.class, AdditionalAnswers.delegatesTo(files));
        doThrow(new IOException("disk gone")).when(flaky).put(eq("repo"), anyString(), any());
        store = newStore(flaky, keys, ledger);

        PutAcknowledgement ack = store.put(batch("repo", "b1", v(1, 0)), ManifestDiff.adding("m1", "b1"));

        assertEquals(PutAcknowledgement.Status.BUFFERED, ack.getStatus());
        assertEquals(1, buffer.size());
        verify(flaky, times(2)).put(eq("repo"), eq(segmentName(1)), any());
        assertTrue(ledger.entries("repo").isEmpty());

        List<RetryBufferEntry> drained = buffer.drainReady();
        assertEquals(ack.getSequence(), drained.get(0).getSequence());
        assertEquals(2, drained.get(0).getAttemptCount());
        assertEquals(RetryPayload.Stage.SEALED, drained.get(0).getPayload().getStage());
        assertEquals(1L, registry.get("evg.store.put").tag("outcome", "buffered").timer().count());
    }

    @Test
    @DisplayName("writes queue behind buffered writes of the same repository and replay in order")
    void laterWritesQueueBehindBuffered() throws IOException {
        ShardBackend flaky = mock(ShardBackend.class, AdditionalAnswers.delegatesTo(files));
        doThrow(new IOException("disk gone")).when(flaky).put(eq("repo"), anyString(), any());
        store = newStore(flaky, keys, ledger);

        PutAcknowledgement first = put("repo", "b1", v(1, 0));
        doAnswer(AdditionalAnswers.delegatesTo(files)).when(flaky).put(eq("repo"), anyString(), any());
        PutAcknowledgement second = put("repo", "b2", v(0, 1));
        PutAcknowledgement other = put("other", "x1", v(1, 1));

        assertFalse(first.isCommitted());
        assertFalse(second.isCommitted());
        assertTrue(other.isCommitted());
        assertTrue(first.getSequence() < second.getSequence());

        for (RetryBufferEntry e : buffer.drainReady()) {
            store.replay(e);
            buffer.complete(e);
        }

        List<String> pointers = ledger.entries("repo").stream()
                .map(LedgerEntry::getManifestPointer).collect(Collectors.toList());
        assertEquals(2, pointers.size());
        assertTrue(pointers.get(0).contains("batch:b1/"));
        assertTrue(pointers.get(1).contains("batch:b2/"));
        assertEquals(2, store.query(QueryCriteria.builder().repo("repo").k(10).build()).size());
    }

    @Test
    @DisplayName("a put backing off keeps a concurrent put of the same repository behind it")
    void concurrentPutsCommitInSequenceOrder() throws Exception {
        AtomicBoolean down = new AtomicBoolean(true);
        CountDownLatch firstFailure = new CountDownLatch(1);
        ShardBackend flaky = mock(ShardBackend.class, AdditionalAnswers.delegatesTo(files));
        doAnswer(inv -> {
            if (down.get()) {
                firstFailure.countDown();
                throw new IOException("disk gone");
            }
            files.put(inv.getArgument(0), inv.getArgument(1), inv.getArgument(2));
            return null;
        }).when(flaky).put(anyString(), anyString(), any());
        store = new VectorStore(flaky, keys, engine, ledger, buffer, new RetryPolicy(2, 400, 400),
                Clock.systemUTC(), registry);

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<PutAcknowledgement> first = pool.submit(() -> put("repo", "a", v(1, 0)));
            assertTrue(firstFailure.await(5, TimeUnit.SECONDS));
            // backend recovers while the first put is backing off
            down.set(false);
            Future<PutAcknowledgement> second = pool.submit(() -> put("repo", "b", v(0, 1)));

            PutAcknowledgement a = first.get(5, TimeUnit.SECONDS);
            PutAcknowledgement b = second.get(5, TimeUnit.SECONDS);
            assertTrue(a.isCommitted());
            assertTrue(b.isCommitted());
            assertTrue(a.getSequence() < b.getSequence());
        } finally {
            pool.shutdownNow();
        }

        List<String> pointers = ledger.entries("repo").stream()
                .map(LedgerEntry::getManifestPointer).collect(Collectors.toList());
        assertEquals(2, pointers.size());
        assertTrue(pointers.get(0).contains("batch:a/"));
        assertTrue(pointers.get(1).contains("batch:b/"));
    }

    @Test
    @DisplayName("a buffered write restored after its commit finished is not committed again")
    void replayAfterRestoreDoesNotRecommit() throws IOException {
        ShardBackend flaky = mock(ShardBackend.class, AdditionalAnswers.delegatesTo(files));
        doThrow(new IOException("disk gone")).when(flaky).put(eq("repo"), anyString(), any());
        store = newStore(flaky, keys, ledger);
        assertFalse(put("repo", "b1", v(1, 0)).isCommitted());
        doAnswer(AdditionalAnswers.delegatesTo(files)).when(flaky).put(eq("repo"), anyString(), any());

        RetryBufferEntry entry = buffer.drainReady().get(0);
        StoreWriteReceipt committed = store.replay(entry);
        // process stops before the entry is completed
        byte[] snapshot = buffer.snapshot();

        RetryBuffer restarted = new RetryBuffer(100, 60_000L, OverflowPolicy.EVICT_OLDEST);
        assertEquals(1, restarted.restore(snapshot).getRestored());
        VectorStore reopened = new VectorStore(files, keys, engine, ledger, restarted, RetryPolicy.noBackoff(2),
                Clock.systemUTC(), registry);
        assertTrue(reopened.openShards().isEmpty());

        RetryBufferEntry again = restarted.drainReady().get(0);
        StoreWriteReceipt replayed = reopened.replay(again);
        restarted.complete(again);

        assertEquals(committed.getAuditPointer(), replayed.getAuditPointer());
        assertEquals(committed.getChecksum(), replayed.getChecksum());
        assertEquals(1, ledger.entries("repo").size());
        assertEquals(1L, reopened.commitVersion("repo"));
        assertEquals(1, reopened.query(QueryCriteria.builder().repo("repo").k(10).build()).size());
        assertEquals(List.of(segmentName(1), ShardCatalog.OBJECT_NAME), files.list("repo"));
    }

    @Test
    void replayRecordsMissingLedgerEntryOfCatalogedSegment() throws IOException {
        ShardBackend flaky = mock(ShardBackend.class, AdditionalAnswers.delegatesTo(files));
        doThrow(new IOException("disk gone")).when(flaky).put(eq("repo"), anyString(), any());
        store = newStore(flaky, keys, ledger);
        assertFalse(put("repo", "b1", v(1, 0)).isCommitted());
        doAnswer(AdditionalAnswers.delegatesTo(files)).when(flaky).put(eq("repo"), anyString(), any());
        RetryBufferEntry entry = buffer.drainReady().get(0);
        StoreWriteReceipt committed = store.replay(entry);

        // segment and catalog survived, the ledger entry did not
        LedgerWriter emptyLedger = new LedgerWriter(new InMemoryLedgerStore());
        VectorStore reopened = newStore(files, keys, emptyLedger);
        reopened.openShards();

        StoreWriteReceipt replayed = reopened.replay(entry);

        assertEquals(committed.getChecksum(), replayed.getChecksum());
        List<LedgerEntry> entries = emptyLedger.entries("repo");
        assertEquals(1, entries.size());
        assertEquals("manifest:m-b1/batch:b1/sha256:" + committed.getChecksum(), entries.get(0).getManifestPointer());
        assertEquals(1L, reopened.commitVersion("repo"));
    }

    @Test
    void fullBufferUnderRejectIsStorageUnavailable() throws IOException {
        ShardBackend dead = mock(ShardBackend.class);
        doThrow(new IOException("down")).when(dead).put(anyString(), anyString(), any());
        buffer = new RetryBuffer(1, 60_000L, OverflowPolicy.REJECT);
        store = new VectorStore(dead, keys, engine, ledger, buffer, RetryPolicy.noBackoff(1), Clock.systemUTC(), registry);

        assertFalse(put("repo", "b1", v(1, 0)).isCommitted());
        StorageUnavailableException ex = assertThrows(StorageUnavailableException.class, () -> put("repo", "b2", v(1, 0)));
        assertInstanceOf(BufferFullException.class, ex.getCause());
    }

    @Test
    @DisplayName("ledger failure rolls back the shard commit")
    void ledgerFailureRollsBack() throws IOException {
        LedgerStore failing = mock(LedgerStore.class, AdditionalAnswers.delegatesTo(ledgerStore));
        doThrow(new IOException("ledger disk full")).when(failing).append(any());
        store = newStore(files, keys, new LedgerWriter(failing));

        PutAcknowledgement ack = put("repo", "b1", v(1, 0));

        assertFalse(ack.isCommitted());
        assertEquals(List.of(), files.list("repo"));
        assertEquals(0L, store.commitVersion("repo"));
        assertTrue(store.quarantined().isEmpty());
    }

    @Test
    void rollbackRestoresPreviousCatalog() throws IOException {
        put("repo", "b1", v(1, 0));
        byte[] catalogBefore = files.get("repo", ShardCatalog.OBJECT_NAME).orElseThrow();

        LedgerStore failing = mock(LedgerStore.class, AdditionalAnswers.delegatesTo(ledgerStore));
        doThrow(new IOException("ledger disk full")).when(failing).append(any());
        VectorStore second = newStore(files, keys, new LedgerWriter(failing));
        assertFalse(second.put(batch("repo", "b2", v(0, 1)), ManifestDiff.adding("m2", "b2")).isCommitted());

        assertArrayEquals(catalogBefore, files.get("repo", ShardCatalog.OBJECT_NAME).orElseThrow());
        assertEquals(List.of(segmentName(1), ShardCatalog.OBJECT_NAME), files.list("repo"));
    }

    @Test
    @DisplayName("unavailable key store buffers the batch seal-pending")
    void keyStoreOutageBuffersSealPending() throws IOException {
        KeyProvider broken = mock(KeyProvider.class);
        when(broken.materialFor(anyString(), anyLong())).thenThrow(new IOException("hsm offline"));
        KeyManager offline = new KeyManager(dir.resolve("other-keys/keystore.blob"), broken);
        store = newStore(files, offline, ledger);

        PutAcknowledgement ack = put("repo", "b1", v(1, 0));

        assertFalse(ack.isCommitted());
        RetryBufferEntry e = buffer.drainReady().get(0);
        assertEquals(RetryPayload.Stage.SEAL_PENDING, e.getPayload().getStage());
        assertNull(e.getPayload().getKeyId());
    }

    @Test
    void replaySealsSealPendingEntriesUnderCurrentKey() {
        EmbeddingBatch b = batch("repo", "late", v(0, 1));
        RetryPayload p = RetryPayload.sealPending("late", "m-late", List.of(), SegmentCodec.encode(b, "m-late"));

        StoreWriteReceipt receipt = store.replay(RetryBufferEntry.of(7L, "repo", p, 1));

        assertEquals("late", receipt.getBatchId());
        QueryResultSet rs = store.query(QueryCriteria.builder().repo("repo").vector(v(0, 1)).k(1).build());
        assertEquals("late-v0", rs.getHits().get(0).getVectorId());
    }

    @Test
    void quarantinedShardRefusesWrites() throws IOException {
        put("repo", "b1", v(1, 0));
        byte[] seg = files.get("repo", segmentName(1)).orElseThrow();
        seg[seg.length - 1] ^= 0x01;
        files.put("repo", segmentName(1), seg);
        assertThrows(ShardCorruptionException.class,
                () -> store.query(QueryCriteria.builder().repo("repo").build()));

        assertThrows(ShardCorruptionException.class, () -> put("repo", "b2", v(1, 0)));
    }

    /* ---------------- query ---------------- */

    @Test
    @DisplayName("results are ordered by score, then batch id, then vector index, and repeat identically")
    void queryOrderingIsDeterministic() {
        put("repo", "b2", v(1, 0), v(1, 0), v(0, 1));
        put("repo", "b1", v(2, 0));
        put("repo", "b3", v(1, 1));

        QueryCriteria c = QueryCriteria.builder().repo("repo").vector(v(1, 0)).k(4).build();
        QueryResultSet first = store.query(c);
        QueryResultSet second = store.query(c);

        List<String> ids = first.getHits().stream().map(QueryHit::getVectorId).collect(Collectors.toList());
        assertEquals(List.of("b1-v0", "b2-v0", "b2-v1", "b3-v0"), ids);
        assertEquals(ids, second.getHits().stream().map(QueryHit::getVectorId).collect(Collectors.toList()));
        assertEquals(1.0, first.getHits().get(0).getScore(), 1e-9);
        assertEquals(1, first.getHits().get(2).getVectorIndex());
    }

    @Test
    void queryWithoutVectorListsInBatchOrder() {
        put("repo", "b2", v(1, 0));
        put("repo", "b1", v(0, 1), v(1, 1));

        List<String> ids = store.query(QueryCriteria.builder().repo("repo").k(10).build()).getHits().stream()
                .map(QueryHit::getVectorId).collect(Collectors.toList());
        assertEquals(List.of("b1-v0", "b1-v1", "b2-v0"), ids);
    }

    @Test
    void attributeFiltersApply() {
        put("repo", "b1", v(1, 0), v(1, 0), v(1, 0));

        QueryResultSet rs = store.query(QueryCriteria.builder().repo("repo").vector(v(1, 0)).filter("lang", "de").build());

        assertEquals(1, rs.size());
        assertEquals("b1-v1", rs.getHits().get(0).getVectorId());
        assertEquals("de", rs.getHits().get(0).getAttributes().get("lang"));
    }

    @Test
    @DisplayName("batch selection prunes segments before decryption")
    void batchSelectionPrunes() {
        put("repo", "b1", v(1, 0));
        put("repo", "b2", v(1, 0));
        put("repo", "b3", v(1, 0));

        QueryResultSet rs = store.query(QueryCriteria.builder().repo("repo").batch("b2").build());

        assertEquals(1, rs.getSegmentsDecrypted());
        assertEquals("b2", rs.getHits().get(0).getBatchId());
    }

    @Test
    void removedBatchesAreHiddenAndNotDecrypted() {
        put("repo", "b1", v(1, 0));
        store.put(batch("repo", "b2", v(0, 1)), new ManifestDiff("m2", List.of("b2"), List.of("b1")));

        QueryResultSet rs = store.query(QueryCriteria.builder().repo("repo").k(10).build());

        assertEquals(List.of("b2"), rs.getHits().stream().map(QueryHit::getBatchId).distinct().collect(Collectors.toList()));
        assertEquals(1, rs.getSegmentsDecrypted());
    }

    @Test
    void queryAcrossRepositoriesAndUnknownRepo() {
        put("a", "b1", v(1, 0));
        put("b", "b1", v(1, 0));

        QueryResultSet all = store.query(QueryCriteria.builder().vector(v(1, 0)).k(5).build());
        assertEquals(List.of("a", "b"), all.getHits().stream().map(QueryHit::getRepoId).collect(Collectors.toList()));
        assertEquals(2, all.getShardsScanned());

        assertEquals(0, store.query(QueryCriteria.builder().repo("nobody").build()).size());
    }

    @Test
    void dimensionMismatchIsSkipped() {
        put("repo", "b1", v(1, 0, 0));
        put("repo", "b2", v(1, 0));
        QueryResultSet rs = store.query(QueryCriteria.builder().repo("repo").vector(v(1, 0)).build());
        assertEquals(List.of("b2-v0"), rs.getHits().stream().map(QueryHit::getVectorId).collect(Collectors.toList()));
    }

    @Test
    @DisplayName("a segment failing its checksum quarantines the shard")
    void tamperedSegmentQuarantines() throws IOException {
        put("repo", "b1", v(1, 0));
        byte[] seg = files.get("repo", segmentName(1)).orElseThrow();
        seg[seg.length - 1] ^= 0x01;
        files.put("repo", segmentName(1), seg);

        ShardCorruptionException ex = assertThrows(ShardCorruptionException.class,
                () -> store.query(QueryCriteria.builder().repo("repo").build()));

        assertEquals("repo", ex.getRepoId());
        assertEquals(1, store.quarantined().size());
        assertTrue(files.get("repo", segmentName(1)).isPresent());
    }

    @Test
    void readFailuresSurfaceAsDegradedRead() throws IOException {
        put("repo", "b1", v(1, 0));
        ShardBackend flaky = mock(ShardBackend.class, AdditionalAnswers.delegatesTo(files));
        VectorStore reader = newStore(flaky, keys, ledger);
        reader.openShards();
        clearInvocations(flaky);
        doThrow(new IOException("timeout")).when(flaky).get(eq("repo"), startsWith("seg-"));

        assertThrows(StorageUnavailableException.class,
                () -> reader.query(QueryCriteria.builder().repo("repo").build()));
        verify(flaky, times(2)).get("repo", segmentName(1));
        assertTrue(reader.quarantined().isEmpty());
    }

    /* ---------------- open ---------------- */

    @Test
    void openShardsReloadsValidatesAndSweepsOrphans() throws IOException {
        put("good", "b1", v(1, 0));
        put("bad", "b1", v(1, 0));
        files.put("good", segmentName(99), new byte[]{1, 2, 3});
        byte[] seg = files.get("bad", segmentName(1)).orElseThrow();
        seg[0] ^= 0x7f;
        files.put("bad", segmentName(1), seg);

        VectorStore reopened = newStore(files, keys, ledger);
        List<QuarantinedShard> q = reopened.openShards();

        assertEquals(1, q.size());
        assertEquals("bad", q.get(0).getRepoId());
        assertFalse(files.get("good", segmentName(99)).isPresent());
        assertEquals(1, reopened.query(QueryCriteria.builder().repo("good").build()).size());
        assertEquals(1L, reopened.commitVersion("good"));
    }

    @Test
    void unreadableCatalogQuarantines() throws IOException {
        files.put("repo", ShardCatalog.OBJECT_NAME, "not json".getBytes(java.nio.charset.StandardCharsets.UTF_8));
        List<QuarantinedShard> q = store.openShards();
        assertEquals(1, q.size());
        assertTrue(q.get(0).getReason().startsWith("unreadable catalog"));
    }

    @Test
    void reopenedStoreContinuesSegmentNumbering() throws IOException {
        put("repo", "b1", v(1, 0));
        VectorStore reopened = newStore(files, keys, ledger);
        reopened.put(batch("repo", "b2", v(0, 1)), ManifestDiff.adding("m2", "b2"));

        assertEquals(List.of(segmentName(1), segmentName(2), ShardCatalog.OBJECT_NAME), files.list("repo"));
    }

    /* ---------------- compaction ---------------- */

    @Test
    @DisplayName("compaction merges segments, appends a ledger entry, and deletes retired objects")
    void compactionMerges() throws IOException {
        for (int i = 1; i <= 4; i++) put("repo", "b" + i, v(i, 1));

        CompactionReport report = store.compact(CompactionPolicy.all(4));

        assertEquals(List.of("repo"), report.getCompacted());
        assertEquals(4, report.getSegmentsBefore());
        assertEquals(1, report.getSegmentsAfter());
        assertEquals(List.of(segmentName(5), ShardCatalog.OBJECT_NAME), files.list("repo"));
        List<LedgerEntry> entries = ledger.entries("repo");
        assertTrue(entries.get(entries.size() - 1).getManifestPointer().startsWith("compact:"));
        assertTrue(ledger.verify("repo").isOk());
        assertEquals(4, store.query(QueryCriteria.builder().repo("repo").k(10).build()).size());
    }

    @Test
    void compactionSkipsShardsBelowThreshold() {
        put("repo", "b1", v(1, 0));
        CompactionReport report = store.compact(CompactionPolicy.all(4));
        assertTrue(report.getCompacted().isEmpty());
        assertEquals(1L, store.commitVersion("repo"));
    }

    @Test
    void compactionDropsRemovedBatches() throws IOException {
        put("repo", "b1", v(1, 0));
        store.put(batch("repo", "b2", v(0, 1)), new ManifestDiff("m2", List.of("b2"), List.of("b1")));

        CompactionReport report = store.compact(CompactionPolicy.all(10));

        assertEquals(List.of("repo"), report.getCompacted());
        ShardVersion v = currentVersion("repo");
        assertEquals(1, v.getSegments().size());
        assertEquals(List.of("b2"), v.getSegments().get(0).getBatchIds());
        assertTrue(v.getRemovedBatchIds().isEmpty());
    }

    @Test
    @DisplayName("compaction is deferred while a rotation is in progress")
    void compactionDeferredDuringRotation() {
        KeyManager rotating = spy(keys);
        doReturn(true).when(rotating).isRotationInProgress("repo");
        store = newStore(files, rotating, ledger);
        for (int i = 1; i <= 4; i++) put("repo", "b" + i, v(1, 0));

        CompactionReport report = store.compact(CompactionPolicy.all(2));

        assertEquals(List.of("repo"), report.getDeferred());
        assertTrue(report.getCompacted().isEmpty());
        assertEquals(4, currentVersion("repo").getSegments().size());
    }

    @Test
    void quarantinedShardIsReportedByCompaction() throws IOException {
        put("repo", "b1", v(1, 0));
        put("repo", "b2", v(1, 0));
        byte[] seg = files.get("repo", segmentName(2)).orElseThrow();
        seg[seg.length - 1] ^= 0x01;
        files.put("repo", segmentName(2), seg);

        CompactionReport first = store.compact(CompactionPolicy.all(2));
        assertEquals(List.of("repo"), first.getQuarantined());
        assertTrue(files.get("repo", segmentName(1)).isPresent());

        CompactionReport second = store.compact(CompactionPolicy.all(2));
        assertEquals(List.of("repo"), second.getQuarantined());
    }

    /* ---------------- rotation ---------------- */

    @Test
    @DisplayName("rotateKeys marks shards; the next compaction re-seals under the new key")
    void rotationMarksThenCompactionReseals() {
        put("repo", "b1", v(1, 0));

        RotationReport rotation = store.rotateKeys(RotationSchedule.all());

        assertEquals(List.of("repo"), rotation.getSucceeded());
        assertTrue(currentVersion("repo").isResealPending());
        assertEquals(1, store.query(QueryCriteria.builder().repo("repo").build()).size());

        CompactionReport report = store.compact(CompactionPolicy.all(10));

        assertEquals(List.of("repo"), report.getResealed());
        assertEquals("repo#e2", store.describe("repo").orElseThrow().getKeyId());
        assertFalse(currentVersion("repo").isResealPending());
        assertEquals(1, store.query(QueryCriteria.builder().repo("repo").build()).size());
    }

    @Test
    void keyCurrencyPolicyResealsStaleSegments() {
        put("repo", "b1", v(1, 0));
        keys.rotate(RotationSchedule.all());
        put("repo", "b2", v(0, 1));

        assertTrue(store.compact(CompactionPolicy.all(10)).getCompacted().isEmpty());
        CompactionReport report = store.compact(CompactionPolicy.keyCurrency(10));

        assertEquals(List.of("repo"), report.getResealed());
        assertEquals(Set.of("repo#e2"), currentVersion("repo").getSegments().stream()
                .map(SegmentRef::getKeyId).collect(Collectors.toSet()));
    }

    @Test
    void putsAfterRotationUseTheNewKey() throws IOException {
        put("repo", "b1", v(1, 0));
        store.rotateKeys(RotationSchedule.all());
        put("repo", "b2", v(1, 0));

        assertEquals("repo#e1", EnvelopeCodec.peekKeyId(files.get("repo", segmentName(1)).orElseThrow()));
        assertEquals("repo#e2", EnvelopeCodec.peekKeyId(files.get("repo", segmentName(2)).orElseThrow()));
        assertEquals(2, store.query(QueryCriteria.builder().repo("repo").build()).size());
    }

    /* ---------------- export ---------------- */

    @Test
    @DisplayName("export streams stored envelopes in commit order without decrypting")
    void exportStreamsSealedSegments() throws IOException {
        put("repo", "b1", v(1, 0));
        put("repo", "b2", v(0, 1));

        List<ExportRecord> records;
        try (Stream<ExportRecord> s = store.export(ExportCursor.fromStart("repo"))) {
            records = s.collect(Collectors.toList());
        }

        assertEquals(2, records.size());
        assertEquals(List.of(1L, 2L), records.stream().map(ExportRecord::getCommitVersion).collect(Collectors.toList()));
        assertArrayEquals(files.get("repo", segmentName(1)).orElseThrow(), records.get(0).getEnvelope());
        assertEquals("repo#e1", records.get(0).getKeyId());

        byte[] plain = engine.open(records.get(1).getEnvelope(), keys.get(records.get(1).getKeyId()), "repo");
        assertEquals("b2", SegmentCodec.decode(plain).get(0).batchId());

        ExportCursor next = ExportCursor.fromStart("repo").after(records.get(0));
        try (Stream<ExportRecord> s = store.export(next)) {
            assertEquals(List.of(segmentName(2)), s.map(ExportRecord::getSegmentId).collect(Collectors.toList()));
        }
        assertEquals(0, store.pinnedReaders("repo"));
    }

    @Test
    void exportOfUnknownRepositoryIsEmpty() {
        try (Stream<ExportRecord> s = store.export(ExportCursor.fromStart("nobody"))) {
            assertEquals(0, s.count());
        }
    }

    @Test
    @DisplayName("reads of an unknown repository create no shard")
    void unknownRepositoryReadsCreateNoShard() throws IOException {
        put("repo", "b1", v(1, 0));
        Set<String> before = store.repositories();

        assertEquals(0, store.query(QueryCriteria.builder().repo("nobody").build()).getShardsScanned());
        try (Stream<ExportRecord> s = store.export(ExportCursor.fromStart("nobody"))) {
            assertEquals(0, s.count());
        }
        CompactionReport report = store.compact(new CompactionPolicy(List.of("nobody"), 2, false));

        assertEquals(before, store.repositories());
        assertEquals(Set.of("repo"), files.repositories());
        assertTrue(report.getCompacted().isEmpty());
        assertEquals(1, store.query(QueryCriteria.builder().k(10).build()).getShardsScanned());
    }

    @Test
    void readsLoadShardsWrittenByAnotherInstance() {
        put("repo", "b1", v(1, 0));
        VectorStore other = newStore(files, keys, ledger);

        assertEquals(1, other.query(QueryCriteria.builder().repo("repo").build()).size());
        assertEquals(Set.of("repo"), other.repositories());
    }

    @Test
    @DisplayName("a pinned reader keeps retired segments until it finishes")
    void pinnedExportSurvivesCompaction() throws IOException {
        for (int i = 1; i <= 3; i++) put("repo", "b" + i, v(1, 0));

        Stream<ExportRecord> export = store.export(ExportCursor.fromStart("repo"));
        assertEquals(1, store.pinnedReaders("repo"));

        store.compact(CompactionPolicy.all(2));
        assertTrue(files.get("repo", segmentName(1)).isPresent());
        List<ExportRecord> exported = export.collect(Collectors.toList());
        assertEquals(3, exported.size());
        assertEquals(segmentName(1), exported.get(0).getSegmentId());

        export.close();
        assertEquals(0, store.pinnedReaders("repo"));
        assertFalse(files.get("repo", segmentName(1)).isPresent());
        assertEquals(List.of(segmentName(4), ShardCatalog.OBJECT_NAME), files.list("repo"));
    }

    private ShardVersion currentVersion(String repo) {
        try {
            return ShardCatalog.decode(files.get(repo, ShardCatalog.OBJECT_NAME).orElseThrow());
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
    }
}

package com.evg.replay;

import com.evg.buffer.OverflowPolicy;
import com.evg.buffer.RetryBuffer;
import com.evg.buffer.RetryBufferEntry;
import com.evg.common.Embedding;
import com.evg.common.EmbeddingBatch;
import com.evg.common.LedgerEntry;
import com.evg.common.ManifestDiff;
import com.evg.crypto.AesGcmEncryptionEngine;
import com.evg.key.DerivedKeyProvider;
import com.evg.key.KeyManager;
import com.evg.ledger.InMemoryLedgerStore;
import com.evg.ledger.LedgerWriter;
import com.evg.store.PutAcknowledgement;
import com.evg.store.QueryCriteria;
import com.evg.store.QueryHit;
import com.evg.store.RetryPolicy;
import com.evg.store.VectorStore;
import com.evg.store.backend.FileShardBackend;
import com.evg.store.backend.ShardBackend;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.AdditionalAnswers;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class ReplayIntegrationTest {

    @TempDir
    Path dir;

    private static EmbeddingBatch batch(String repo, String id) {
        return new EmbeddingBatch(repo, id, List.of(new Embedding(id + "-v0", new float[]{1f, 0f})));
    }

    @Test
    void outageIsBufferedThenReplayedInSequenceOrder() throws IOException {
        FileShardBackend files = new FileShardBackend(dir.resolve("shards"));
        ShardBackend backend = mock(ShardBackend.class, AdditionalAnswers.delegatesTo(files));
        KeyManager keys = new KeyManager(dir.resolve("keys/keystore.blob"), new DerivedKeyProvider(new byte[32]));
        LedgerWriter ledger = new LedgerWriter(new InMemoryLedgerStore());
        RetryBuffer buffer = new RetryBuffer(100, 60_000L, OverflowPolicy.EVICT_OLDEST);
        VectorStore store = new VectorStore(backend, keys, new AesGcmEncryptionEngine(), ledger, buffer,
                RetryPolicy.noBackoff(1));
        ReplayCoordinator coordinator = new ReplayCoordinator(buffer, store::replay, 50L);

        doThrow(new IOException("nfs unreachable")).when(backend).put(anyString(), anyString(), any());
        for (int i = 1; i <= 3; i++) {
            PutAcknowledgement ack = store.put(batch("repo", "b" + i), ManifestDiff.adding("m" + i, "b" + i));
            assertEquals(PutAcknowledgement.Status.BUFFERED, ack.getStatus());
        }

        ReplayStats stillDown = coordinator.drainOnce();
        assertEquals(0, stillDown.getApplied());
        assertEquals(3, stillDown.getRequeued());
        assertTrue(ledger.entries("repo").isEmpty());

        doAnswer(AdditionalAnswers.delegatesTo(files)).when(backend).put(anyString(), anyString(), any());
        ReplayStats recovered = coordinator.drainOnce();

        assertEquals(3, recovered.getApplied());
        assertEquals(3L, recovered.getMaxSequence());
        assertTrue(buffer.isEmpty());
        List<String> batches = ledger.entries("repo").stream()
                .map(LedgerEntry::getManifestPointer)
                .map(p -> p.substring(p.indexOf("batch:") + 6, p.indexOf("/sha256")))
                .collect(Collectors.toList());
        assertEquals(List.of("b1", "b2", "b3"), batches);
        assertTrue(ledger.verify("repo").isOk());
        assertEquals(3, store.query(QueryCriteria.builder().repo("repo").k(10).build()).size());
    }

    @Test
    void failureOnOneRepositoryHoldsBackOnlyItsOwnEntries() throws IOException {
        FileShardBackend files = new FileShardBackend(dir.resolve("shards"));
        ShardBackend backend = mock(ShardBackend.class, AdditionalAnswers.delegatesTo(files));
        KeyManager keys = new KeyManager(dir.resolve("keys/keystore.blob"), new DerivedKeyProvider(new byte[32]));
        LedgerWriter ledger = new LedgerWriter(new InMemoryLedgerStore());
        RetryBuffer buffer = new RetryBuffer(100, 60_000L, OverflowPolicy.EVICT_OLDEST);
        VectorStore store = new VectorStore(backend, keys, new AesGcmEncryptionEngine(), ledger, buffer,
                RetryPolicy.noBackoff(1));
        ReplayCoordinator coordinator = new ReplayCoordinator(buffer, store::replay, 50L);

        doThrow(new IOException("down")).when(backend).put(anyString(), anyString(), any());
        store.put(batch("a", "a1"), ManifestDiff.adding("m", "a1"));
        store.put(batch("b", "b1"), ManifestDiff.adding("m", "b1"));
        store.put(batch("a", "a2"), ManifestDiff.adding("m", "a2"));

        doAnswer(AdditionalAnswers.delegatesTo(files)).when(backend).put(eq("a"), anyString(), any());
        ReplayStats stats = coordinator.drainOnce();

        assertEquals(2, stats.getApplied());
        assertEquals(1, stats.getRequeued());
        assertEquals(List.of("a1", "a2"), store.query(QueryCriteria.builder().repo("a").k(10).build()).getHits()
                .stream().map(QueryHit::getBatchId).collect(Collectors.toList()));
        assertEquals(2, ledger.entries("a").size());
        assertTrue(ledger.entries("b").isEmpty());
        assertEquals(List.of("b"), buffer.drainReady().stream()
                .map(RetryBufferEntry::getRepoId).collect(Collectors.toList()));
    }
}

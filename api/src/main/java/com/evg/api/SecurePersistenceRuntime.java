package com.evg.api;

import com.evg.buffer.OverflowPolicy;
import com.evg.buffer.RestoreReport;
import com.evg.buffer.RetryBuffer;
import com.evg.common.EmbeddingBatch;
import com.evg.common.FsPaths;
import com.evg.common.ManifestDiff;
import com.evg.config.SystemConfig;
import com.evg.crypto.AesGcmEncryptionEngine;
import com.evg.key.AttestationSink;
import com.evg.key.DerivedKeyProvider;
import com.evg.key.KeyManager;
import com.evg.key.RotationReport;
import com.evg.key.RotationSchedule;
import com.evg.ledger.LedgerWriter;
import com.evg.ledger.RocksDBLedgerStore;
import com.evg.ledger.VerificationReport;
import com.evg.replay.ReplayCoordinator;
import com.evg.store.*;
import com.evg.store.backend.FileShardBackend;
import com.evg.store.backend.RocksDBShardBackend;
import com.evg.store.backend.ShardBackend;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Builds the persistence stack from a {@link SystemConfig} and owns its lifecycle.
 * <p>
 * Open order: ledger, keys (attesting into the ledger), retry buffer (restored from its snapshot), shard
 * backend, store (shards validated), replay worker. {@link #close()} releases them in reverse.
 */
public final class SecurePersistenceRuntime implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(SecurePersistenceRuntime.class);

    private static final long SHUTDOWN_TIMEOUT_MS = 10_000L;
    private static final String MASTER_KEY_FILE = "master.key";

    private final SystemConfig config;
    private final Path baseDir;
    private final MeterRegistry registry;
    private final PersistenceMetrics metrics;
    private final LedgerWriter ledger;
    private final KeyManager keys;
    private final RetryBuffer buffer;
    private final VectorStore store;
    private final ReplayCoordinator coordinator;
    private final RestoreReport restoreReport;
    private final List<QuarantinedShard> quarantinedAtOpen;

    private volatile boolean closed = false;

    private SecurePersistenceRuntime(SystemConfig config, Path baseDir, MeterRegistry registry,
                                     PersistenceMetrics metrics, LedgerWriter ledger, KeyManager keys,
                                     RetryBuffer buffer, VectorStore store, ReplayCoordinator coordinator,
                                     RestoreReport restoreReport, List<QuarantinedShard> quarantinedAtOpen) {
        this.config = config;
        this.baseDir = baseDir;
        this.registry = registry;
        this.metrics = metrics;
        this.ledger = ledger;
        this.keys = keys;
        this.buffer = buffer;
        this.store = store;
        this.coordinator = coordinator;
        this.restoreReport = restoreReport;
        this.quarantinedAtOpen = List.copyOf(quarantinedAtOpen);
    }

    public static SecurePersistenceRuntime open(SystemConfig config) throws IOException {
        return open(config, new SimpleMeterRegistry(), Clock.systemUTC());
    }

    /**
     * @throws IOException a store could not be opened; everything opened so far is closed again
     */
    public static SecurePersistenceRuntime open(SystemConfig config, MeterRegistry registry, Clock clock)
            throws IOException {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(clock, "clock");

        SystemConfig.PathsConfig paths = config.getPaths();
        Path base = (paths.getBaseDir() != null) ? paths.getBaseDir() : FsPaths.baseDir();
        Files.createDirectories(base);
        logger.info("Opening secure persistence runtime at {}", base);

        Deque<AutoCloseable> opened = new ArrayDeque<>();
        try {
            // ==== Ledger ====
            LedgerWriter ledger = new LedgerWriter(
                    new RocksDBLedgerStore(paths.resolve(base, paths.ledgerDb)), clock);
            opened.push(ledger);

            // ==== Keys ====
            Path keyStore = paths.resolve(base, paths.keyStore);
            Path masterFile = (keyStore.getParent() != null)
                    ? keyStore.getParent().resolve(MASTER_KEY_FILE)
                    : base.resolve(MASTER_KEY_FILE);
            AttestationSink sink = a -> ledger.append(a.toManifestPointer(), a.getRepoId());
            KeyManager keys = new KeyManager(keyStore, new DerivedKeyProvider(masterFile),
                    config.getKeys().getTtlMs(), clock, sink);

            // ==== Retry buffer ====
            SystemConfig.BufferConfig bc = config.getBuffer();
            Path snapshot = bc.isSnapshotOnMutation() ? paths.resolve(base, paths.bufferSnapshot) : null;
            RetryBuffer buffer = new RetryBuffer(bc.getMaxItems(), bc.getMaxAgeMs(),
                    OverflowPolicy.parse(bc.getOverflowPolicy()), clock, snapshot);
            RestoreReport restored = buffer.restoreFromSnapshotFile();

            // ==== Store ====
            ShardBackend backend = openBackend(config, paths.resolve(base, paths.shardRoot));
            opened.push(backend);
            SystemConfig.RetryConfig rc = config.getRetry();
            VectorStore store = new VectorStore(backend, keys, new AesGcmEncryptionEngine(), ledger, buffer,
                    new RetryPolicy(rc.getMaxAttempts(), rc.getInitialBackoffMs(), rc.getMaxBackoffMs()),
                    clock, registry);
            opened.pop();
            opened.push(store);
            List<QuarantinedShard> quarantined = store.openShards();
            if (!quarantined.isEmpty()) {
                logger.warn("{} shard(s) quarantined at open: {}", quarantined.size(), quarantined);
            }

            // ==== Replay ====
            ReplayCoordinator coordinator = new ReplayCoordinator(buffer, store::replay,
                    config.getReplay().getIdleWaitMs());
            buffer.addListener(coordinator);

            PersistenceMetrics metrics = null;
            if (config.isMetricsEnabled()) {
                metrics = new PersistenceMetrics(registry);
                metrics.bindBuffer(buffer);
                metrics.bindReplay(coordinator);
            }

            coordinator.start();
            logger.info("Runtime open: repositories={}, buffered={}, restored={}",
                    store.repositories().size(), buffer.size(), restored.getRestored());
            return new SecurePersistenceRuntime(config, base, registry, metrics, ledger, keys, buffer, store,
                    coordinator, restored, quarantined);
        } catch (IOException | RuntimeException e) {
            logger.error("Failed to open runtime at {}", base, e);
            while (!opened.isEmpty()) {
                try {
                    opened.pop().close();
                } catch (Exception closeFailure) {
                    e.addSuppressed(closeFailure);
                }
            }
            throw e;
        }
    }

    private static ShardBackend openBackend(SystemConfig config, Path shardRoot) throws IOException {
        String kind = config.getStore().getBackend().toLowerCase(Locale.ROOT);
        if ("rocksdb".equals(kind)) {
            return new RocksDBShardBackend(shardRoot.resolve("rocksdb"));
        }
        return new FileShardBackend(shardRoot);
    }

    /* --------------------------------------------------------
     * OPERATIONS
     * -------------------------------------------------------- */

    public PutAcknowledgement put(EmbeddingBatch batch, ManifestDiff manifest) {
        ensureOpen();
        return store.put(batch, manifest);
    }

    public QueryResultSet query(QueryCriteria criteria) {
        ensureOpen();
        return store.query(criteria);
    }

    public Stream<ExportRecord> export(ExportCursor cursor) {
        ensureOpen();
        return store.export(cursor);
    }

    /** Compacts every repository with the configured segment threshold. */
    public CompactionReport compact() {
        return compact(CompactionPolicy.all(config.getStore().getCompactionMinSegments()));
    }

    public CompactionReport compact(CompactionPolicy policy) {
        ensureOpen();
        return store.compact(policy);
    }

    /** Rotates every repository whose active key is older than {@code keys.maxKeyAgeMs}. */
    public RotationReport rotateDueKeys() {
        return rotateKeys(RotationSchedule.olderThan(Duration.ofMillis(config.getKeys().getMaxKeyAgeMs())));
    }

    public RotationReport rotateKeys(RotationSchedule schedule) {
        ensureOpen();
        return store.rotateKeys(schedule);
    }

    public VerificationReport verifyLedger(String repoId) {
        ensureOpen();
        return (metrics != null) ? metrics.verify(ledger, repoId) : ledger.verify(repoId);
    }

    private void ensureOpen() {
        if (closed) throw new IllegalStateException("Runtime is closed");
    }

    /* --------------------------------------------------------
     * ACCESSORS
     * -------------------------------------------------------- */

    public Path getBaseDir() { return baseDir; }
    public SystemConfig getConfig() { return config; }
    public MeterRegistry getRegistry() { return registry; }
    public Optional<PersistenceMetrics> getMetrics() { return Optional.ofNullable(metrics); }
    public LedgerWriter getLedger() { return ledger; }
    public KeyManager getKeys() { return keys; }
    public RetryBuffer getBuffer() { return buffer; }
    public VectorStore getStore() { return store; }
    public ReplayCoordinator getCoordinator() { return coordinator; }
    public RestoreReport getRestoreReport() { return restoreReport; }
    public List<QuarantinedShard> getQuarantinedAtOpen() { return quarantinedAtOpen; }

    /* --------------------------------------------------------
     * SHUTDOWN
     * -------------------------------------------------------- */

    @Override
    public synchronized void close() {
        if (closed) return;
        closed = true;
        try {
            if (!coordinator.shutdown(SHUTDOWN_TIMEOUT_MS)) {
                logger.warn("Replay worker still running after {} ms; {} entries stay buffered",
                        SHUTDOWN_TIMEOUT_MS, buffer.size());
            }
        } catch (RuntimeException e) {
            logger.error("Unexpected error stopping replay", e);
        }
        try {
            store.close();
        } catch (RuntimeException e) {
            logger.error("Unexpected error closing store", e);
        }
        try {
            ledger.close();
        } catch (RuntimeException e) {
            logger.error("Unexpected error closing ledger", e);
        }
        logger.info("Runtime closed ({} entries left in retry buffer)", buffer.size());
    }
}

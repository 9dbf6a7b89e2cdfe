package com.evg.key;

import com.evg.common.KeyHandle;
import com.evg.common.KeyStoreUnavailableException;
import com.evg.common.PersistenceUtils;
import com.evg.common.UnknownKeyIdException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.SecretKey;
import java.io.IOException;
import java.io.Serializable;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Key table for all repositories.
 * <p>
 * Historical handles are never deleted: a superseded epoch stays resolvable through {@link #get(String)}
 * so existing envelopes remain openable. Only the active pointer for a repository is swapped, under that
 * repository's lock; lookups go through concurrent maps and never block on a rotation.
 * <p>
 * The registry file holds handle metadata only. Key material is re-obtained from the {@link KeyProvider}
 * when the registry is reloaded.
 */
public class KeyManager {
    private static final Logger logger = LoggerFactory.getLogger(KeyManager.class);

    private final Path storeFile;
    private final KeyProvider provider;
    private final long ttlMs;
    private final Clock clock;
    private final AttestationSink attestationSink;

    private final ConcurrentMap<String, KeyHandle> byKeyId = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, KeyHandle> active = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, ReentrantLock> repoLocks = new ConcurrentHashMap<>();
    private final Set<String> rotating = ConcurrentHashMap.newKeySet();
    private final Object persistLock = new Object();

    public KeyManager(Path storeFile, KeyProvider provider) throws IOException {
        this(storeFile, provider, 0L, Clock.systemUTC(), AttestationSink.NONE);
    }

    public KeyManager(Path storeFile, KeyProvider provider, long ttlMs,
                      Clock clock, AttestationSink attestationSink) throws IOException {
        Path p = Objects.requireNonNull(storeFile, "storeFile").toAbsolutePath().normalize();
        this.storeFile = (Files.isDirectory(p)) ? p.resolve("keystore.blob") : p;
        this.provider = Objects.requireNonNull(provider, "provider");
        if (ttlMs < 0) throw new IllegalArgumentException("ttlMs must be >= 0");
        this.ttlMs = ttlMs;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.attestationSink = (attestationSink != null) ? attestationSink : AttestationSink.NONE;

        Path parent = this.storeFile.getParent();
        if (parent != null) Files.createDirectories(parent);
        load();
    }

    private void load() throws IOException {
        if (!Files.exists(storeFile)) {
            logger.info("No key registry at {}, starting empty", storeFile);
            return;
        }
        KeyRegistryBlob blob;
        try {
            blob = PersistenceUtils.loadObject(storeFile, storeFile.getParent(), KeyRegistryBlob.class);
        } catch (ClassNotFoundException | IOException e) {
            throw new IOException("Failed to load key registry: " + storeFile, e);
        }
        if (blob.records == null) {
            throw new IOException("Invalid key registry: " + storeFile);
        }
        for (KeyRecord r : blob.records) {
            SecretKey material = provider.materialFor(r.repoId, r.epoch);
            KeyHandle h = new KeyHandle(KeyHandle.keyIdFor(r.repoId, r.epoch), r.repoId, r.epoch,
                    r.createdAt, r.expiresAt, material);
            byKeyId.put(h.getKeyId(), h);
            active.merge(h.getRepoId(), h,
                    (a, b) -> (a.getRotationEpoch() >= b.getRotationEpoch()) ? a : b);
        }
        logger.info("Loaded key registry {}, repositories={}, handles={}",
                storeFile, active.size(), byKeyId.size());
    }

    /**
     * Returns the active handle for {@code repoId}, creating epoch 1 if the repository has none.
     * Calling it again within the same epoch returns the same handle.
     */
    public KeyHandle provision(String repoId) {
        requireRepo(repoId);
        KeyHandle existing = active.get(repoId);
        if (existing != null) return existing;

        ReentrantLock lock = lockFor(repoId);
        lock.lock();
        try {
            existing = active.get(repoId);
            if (existing != null) return existing;
            KeyHandle h = install(repoId, 1L);
            logger.info("Provisioned key {} for repository {}", h.getKeyId(), repoId);
            emit(h, KeyAttestation.Action.PROVISION);
            return h;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Latest non-expired handle for sealing. An expired active handle is superseded by the next epoch.
     */
    public KeyHandle current(String repoId) {
        requireRepo(repoId);
        KeyHandle h = active.get(repoId);
        if (h == null) return provision(repoId);
        if (!h.isExpired(clock.millis())) return h;

        ReentrantLock lock = lockFor(repoId);
        lock.lock();
        try {
            KeyHandle latest = active.get(repoId);
            if (!latest.isExpired(clock.millis())) return latest;
            KeyHandle next = install(repoId, latest.getRotationEpoch() + 1);
            logger.info("Key {} expired, advanced repository {} to {}", latest.getKeyId(), repoId, next.getKeyId());
            emit(next, KeyAttestation.Action.ROTATE);
            return next;
        } finally {
            lock.unlock();
        }
    }

    /** Resolves any retained handle, including superseded epochs. */
    public KeyHandle get(String keyId) {
        KeyHandle h = byKeyId.get(Objects.requireNonNull(keyId, "keyId"));
        if (h == null) {
            throw new UnknownKeyIdException(keyId);
        }
        return h;
    }

    /**
     * Advances the active key of every repository the schedule selects. Failures are collected per
     * repository; they do not abort the pass.
     */
    public RotationReport rotate(RotationSchedule schedule) {
        Objects.requireNonNull(schedule, "schedule");
        long started = clock.millis();
        List<String> succeeded = new ArrayList<>();
        Map<String, String> failed = new LinkedHashMap<>();

        for (String repoId : new TreeSet<>(active.keySet())) {
            KeyHandle current = active.get(repoId);
            if (current == null || !schedule.selects(current, started)) continue;

            rotating.add(repoId);
            ReentrantLock lock = lockFor(repoId);
            lock.lock();
            try {
                KeyHandle latest = active.get(repoId);
                KeyHandle next = install(repoId, latest.getRotationEpoch() + 1);
                succeeded.add(repoId);
                logger.info("Rotated repository {}: {} -> {}", repoId, latest.getKeyId(), next.getKeyId());
                emit(next, KeyAttestation.Action.ROTATE);
            } catch (RuntimeException e) {
                failed.put(repoId, String.valueOf(e.getMessage()));
                logger.warn("Rotation failed for repository {}", repoId, e);
            } finally {
                lock.unlock();
                rotating.remove(repoId);
            }
        }

        RotationReport report = new RotationReport(succeeded, failed, started, clock.millis());
        if (report.isPartial()) {
            logger.warn("Partial rotation: {}", report);
        } else {
            logger.info("Rotation complete: {}", report);
        }
        return report;
    }

    public boolean isRotationInProgress(String repoId) {
        return rotating.contains(repoId);
    }

    public Set<String> repositories() {
        return Collections.unmodifiableSet(new TreeSet<>(active.keySet()));
    }

    /** All retained handles of a repository, oldest epoch first. */
    public List<KeyHandle> history(String repoId) {
        List<KeyHandle> out = new ArrayList<>();
        for (KeyHandle h : byKeyId.values()) {
            if (h.getRepoId().equals(repoId)) out.add(h);
        }
        out.sort(Comparator.comparingLong(KeyHandle::getRotationEpoch));
        return out;
    }

    public Path getStoreFile() {
        return storeFile;
    }

    /**
     * Obtains material, persists the registry including the new handle, then swaps the active pointer.
     * A failure leaves the previous handle active.
     */
    private KeyHandle install(String repoId, long epoch) {
        SecretKey material;
        try {
            material = provider.materialFor(repoId, epoch);
        } catch (IOException e) {
            throw new KeyStoreUnavailableException("Key provider unavailable for " + repoId, e);
        }
        long now = clock.millis();
        long expiresAt = (ttlMs > 0) ? now + ttlMs : 0L;
        KeyHandle h = new KeyHandle(KeyHandle.keyIdFor(repoId, epoch), repoId, epoch, now, expiresAt, material);

        synchronized (persistLock) {
            ArrayList<KeyRecord> records = new ArrayList<>();
            for (KeyHandle k : byKeyId.values()) records.add(KeyRecord.of(k));
            records.add(KeyRecord.of(h));
            records.sort(Comparator.comparing((KeyRecord r) -> r.repoId).thenComparingLong(r -> r.epoch));
            try {
                PersistenceUtils.saveObject(new KeyRegistryBlob(records), storeFile, storeFile.getParent());
            } catch (IOException e) {
                throw new KeyStoreUnavailableException("Failed to persist key registry to " + storeFile, e);
            }
            byKeyId.put(h.getKeyId(), h);
            active.put(repoId, h);
        }
        logger.debug("Persisted key registry {}, handles={}", storeFile.getFileName(), byKeyId.size());
        return h;
    }

    private void emit(KeyHandle h, KeyAttestation.Action action) {
        KeyAttestation a = new KeyAttestation(h.getRepoId(), h.getKeyId(), h.getRotationEpoch(), action, clock.millis());
        try {
            attestationSink.attest(a);
        } catch (RuntimeException e) {
            // key change is already durable; the missing attestation must be visible to operators
            logger.error("Attestation not recorded: {}", a, e);
        }
    }

    private ReentrantLock lockFor(String repoId) {
        return repoLocks.computeIfAbsent(repoId, r -> new ReentrantLock());
    }

    private static void requireRepo(String repoId) {
        if (repoId == null || repoId.isBlank()) {
            throw new IllegalArgumentException("repoId cannot be null or blank");
        }
    }

    private static class KeyRegistryBlob implements Serializable {
        private static final long serialVersionUID = 1L;
        final ArrayList<KeyRecord> records;

        KeyRegistryBlob(ArrayList<KeyRecord> records) {
            this.records = records;
        }
    }

    private static class KeyRecord implements Serializable {
        private static final long serialVersionUID = 1L;
        final String repoId;
        final long epoch;
        final long createdAt;
        final long expiresAt;

        KeyRecord(String repoId, long epoch, long createdAt, long expiresAt) {
            this.repoId = repoId;
            this.epoch = epoch;
            this.createdAt = createdAt;
            this.expiresAt = expiresAt;
        }

        static KeyRecord of(KeyHandle h) {
            return new KeyRecord(h.getRepoId(), h.getRotationEpoch(), h.getCreatedAt(), h.getExpiresAt());
        }
    }
}

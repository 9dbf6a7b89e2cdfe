package com.evg.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Canonical configuration for the persistence engine.
 *
 * - Loaded from JSON via {@link #load(String, boolean)}.
 * - Cached per absolute/real path.
 * - Exposes nested config blocks: paths, keys, retry, buffer, replay, store.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SystemConfig {

    private static final long ONE_DAY_MS        = 24L * 60L * 60L * 1000L;
    private static final long MAX_AGE_MS        = 365L * ONE_DAY_MS; // 1 year
    private static final int  MAX_ATTEMPTS      = 100;
    private static final long MAX_BACKOFF_MS    = 60_000L;
    private static final int  MAX_BUFFER_ITEMS  = 10_000_000;
    private static final int  MAX_SEGMENTS      = 1024;

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    /** Per-path cache for loaded configs. */
    private static final ConcurrentMap<String, SystemConfig> configCache = new ConcurrentHashMap<>();

    /* ======================== Top-level fields ======================== */

    @JsonProperty("metricsEnabled")
    private boolean metricsEnabled = true;

    @JsonProperty("paths")
    private PathsConfig paths = new PathsConfig();

    @JsonProperty("keys")
    private KeysConfig keys = new KeysConfig();

    @JsonProperty("retry")
    private RetryConfig retry = new RetryConfig();

    @JsonProperty("buffer")
    private BufferConfig buffer = new BufferConfig();

    @JsonProperty("replay")
    private ReplayConfig replay = new ReplayConfig();

    @JsonProperty("store")
    private StoreConfig store = new StoreConfig();

    /* ======================== Static loading API ======================== */

    public static SystemConfig load(String path, boolean refresh) throws ConfigLoadException {
        Objects.requireNonNull(path, "Config path cannot be null");
        String key;
        try {
            Path p = Paths.get(path).toAbsolutePath().normalize();
            if (Files.exists(p)) {
                p = p.toRealPath();
            }
            key = p.toString();
        } catch (Exception e) {
            throw new ConfigLoadException("Invalid config path: " + path, e);
        }

        if (!refresh) {
            SystemConfig cached = configCache.get(key);
            if (cached != null) return cached;
        }

        SystemConfig cfg;
        try {
            Path p = Paths.get(key);
            if (!Files.isRegularFile(p) || !Files.isReadable(p)) {
                throw new IOException("Config file not found or not readable: " + key);
            }
            cfg = MAPPER.readValue(p.toFile(), SystemConfig.class);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to read/parse SystemConfig from " + key, e);
        }

        cfg.normalize();
        configCache.put(key, cfg);
        return cfg;
    }

    /** Parses a config document held in memory; not cached. */
    public static SystemConfig fromJson(String json) throws ConfigLoadException {
        Objects.requireNonNull(json, "json");
        try {
            SystemConfig cfg = MAPPER.readValue(json, SystemConfig.class);
            cfg.normalize();
            return cfg;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse SystemConfig", e);
        }
    }

    public static void clearCache() {
        configCache.clear();
    }

    private void normalize() {
        if (paths == null) paths = new PathsConfig();
        if (keys == null) keys = new KeysConfig();
        if (retry == null) retry = new RetryConfig();
        if (buffer == null) buffer = new BufferConfig();
        if (replay == null) replay = new ReplayConfig();
        if (store == null) store = new StoreConfig();
    }

    /* ======================== Getters used by other modules ======================== */

    public boolean isMetricsEnabled() {
        return metricsEnabled;
    }

    public PathsConfig getPaths() {
        return paths;
    }

    public KeysConfig getKeys() {
        return keys;
    }

    public RetryConfig getRetry() {
        return retry;
    }

    public BufferConfig getBuffer() {
        return buffer;
    }

    public ReplayConfig getReplay() {
        return replay;
    }

    public StoreConfig getStore() {
        return store;
    }

    /* ======================== Nested config types ======================== */

    /** On-disk locations. Relative entries resolve against {@code baseDir}. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PathsConfig {
        @JsonProperty("baseDir")
        public String baseDir;

        @JsonProperty("keyStore")
        public String keyStore = "keys/keystore.blob";

        @JsonProperty("ledgerDb")
        public String ledgerDb = "ledger/rocksdb";

        @JsonProperty("shardRoot")
        public String shardRoot = "shards";

        @JsonProperty("bufferSnapshot")
        public String bufferSnapshot = "buffer/retry-buffer.ndjson";

        /** Explicit base dir, or null when the process default applies. */
        public Path getBaseDir() {
            return (baseDir == null || baseDir.isBlank()) ? null : Paths.get(baseDir).toAbsolutePath().normalize();
        }

        public Path resolve(Path base, String rel) {
            Path p = Paths.get(rel);
            return p.isAbsolute() ? p.normalize() : base.resolve(p).normalize();
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class KeysConfig {
        /** Lifetime of a sealing key; 0 disables expiry. */
        @JsonProperty("ttlMs")
        public long ttlMs = 0L;

        /** Age beyond which {@code RotationSchedule.olderThan} selects a repository. */
        @JsonProperty("maxKeyAgeMs")
        public long maxKeyAgeMs = 30L * ONE_DAY_MS;

        public long getTtlMs() {
            return clamp(ttlMs, 0L, MAX_AGE_MS);
        }

        public long getMaxKeyAgeMs() {
            return clamp(maxKeyAgeMs, 1L, MAX_AGE_MS);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RetryConfig {
        @JsonProperty("maxAttempts")
        public int maxAttempts = 3;

        @JsonProperty("initialBackoffMs")
        public long initialBackoffMs = 10L;

        @JsonProperty("maxBackoffMs")
        public long maxBackoffMs = 1000L;

        public int getMaxAttempts() {
            return clamp(maxAttempts, 1, MAX_ATTEMPTS);
        }

        public long getInitialBackoffMs() {
            return clamp(initialBackoffMs, 0L, MAX_BACKOFF_MS);
        }

        public long getMaxBackoffMs() {
            return Math.max(getInitialBackoffMs(), clamp(maxBackoffMs, 0L, MAX_BACKOFF_MS));
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class BufferConfig {
        @JsonProperty("maxItems")
        public int maxItems = 10_000;

        @JsonProperty("maxAgeMs")
        public long maxAgeMs = ONE_DAY_MS;

        /** "EVICT_OLDEST" | "REJECT". */
        @JsonProperty("overflowPolicy")
        public String overflowPolicy = "EVICT_OLDEST";

        @JsonProperty("snapshotOnMutation")
        public boolean snapshotOnMutation = true;

        public int getMaxItems() {
            return clamp(maxItems, 1, MAX_BUFFER_ITEMS);
        }

        public long getMaxAgeMs() {
            return clamp(maxAgeMs, 1L, MAX_AGE_MS);
        }

        public String getOverflowPolicy() {
            String p = (overflowPolicy == null) ? "" : overflowPolicy.trim().toUpperCase(Locale.ROOT);
            return "REJECT".equals(p) ? "REJECT" : "EVICT_OLDEST";
        }

        public boolean isSnapshotOnMutation() {
            return snapshotOnMutation;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ReplayConfig {
        @JsonProperty("idleWaitMs")
        public long idleWaitMs = 500L;

        public long getIdleWaitMs() {
            return clamp(idleWaitMs, 10L, MAX_BACKOFF_MS);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StoreConfig {
        /** "file" | "rocksdb". */
        @JsonProperty("backend")
        public String backend = "file";

        @JsonProperty("compactionMinSegments")
        public int compactionMinSegments = 4;

        public String getBackend() {
            String b = (backend == null) ? "" : backend.trim().toLowerCase(Locale.ROOT);
            return "rocksdb".equals(b) ? "rocksdb" : "file";
        }

        public int getCompactionMinSegments() {
            return clamp(compactionMinSegments, 2, MAX_SEGMENTS);
        }
    }

    /* ======================== Helper methods ======================== */

    private static int clamp(int v, int min, int max) {
        if (v < min) return min;
        if (v > max) return max;
        return v;
    }

    private static long clamp(long v, long min, long max) {
        if (v < min) return min;
        if (v > max) return max;
        return v;
    }

    /* ======================== Exception type ======================== */

    public static class ConfigLoadException extends Exception {
        public ConfigLoadException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}

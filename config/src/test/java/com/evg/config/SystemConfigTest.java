package com.evg.config;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SystemConfig Unit Tests")
public class SystemConfigTest {

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        SystemConfig.clearCache();
    }

    private Path fixture() throws IOException {
        Path target = tempDir.resolve("evg-config.json");
        try (InputStream in = getClass().getResourceAsStream("/evg-config.json")) {
            assertNotNull(in, "fixture missing from test resources");
            Files.copy(in, target);
        }
        return target;
    }

    @Test
    @DisplayName("defaults match the documented values")
    void defaults() {
        SystemConfig cfg = new SystemConfig();

        assertTrue(cfg.isMetricsEnabled());
        assertEquals(3, cfg.getRetry().getMaxAttempts());
        assertEquals(10L, cfg.getRetry().getInitialBackoffMs());
        assertEquals(1000L, cfg.getRetry().getMaxBackoffMs());
        assertEquals(10_000, cfg.getBuffer().getMaxItems());
        assertEquals(24L * 60 * 60 * 1000, cfg.getBuffer().getMaxAgeMs());
        assertEquals("EVICT_OLDEST", cfg.getBuffer().getOverflowPolicy());
        assertTrue(cfg.getBuffer().isSnapshotOnMutation());
        assertEquals(500L, cfg.getReplay().getIdleWaitMs());
        assertEquals("file", cfg.getStore().getBackend());
        assertEquals(4, cfg.getStore().getCompactionMinSegments());
        assertEquals(0L, cfg.getKeys().getTtlMs());
        assertNull(cfg.getPaths().getBaseDir());
    }

    @Test
    @DisplayName("load reads nested sections and clamps out-of-range values")
    void loadFixture() throws Exception {
        SystemConfig cfg = SystemConfig.load(fixture().toString(), true);

        assertFalse(cfg.isMetricsEnabled());
        assertEquals(5, cfg.getRetry().getMaxAttempts());
        // max backoff never drops below the initial backoff
        assertEquals(20L, cfg.getRetry().getMaxBackoffMs());
        assertEquals(1, cfg.getBuffer().getMaxItems());
        assertEquals("REJECT", cfg.getBuffer().getOverflowPolicy());
        assertFalse(cfg.getBuffer().isSnapshotOnMutation());
        assertEquals(250L, cfg.getReplay().getIdleWaitMs());
        assertEquals("rocksdb", cfg.getStore().getBackend());
        assertEquals(2, cfg.getStore().getCompactionMinSegments());
        assertEquals(3_600_000L, cfg.getKeys().getTtlMs());
        assertEquals("ledger/rocksdb", cfg.getPaths().ledgerDb);
    }

    @Test
    void pathsResolveAgainstBase() throws Exception {
        SystemConfig cfg = SystemConfig.load(fixture().toString(), true);
        SystemConfig.PathsConfig paths = cfg.getPaths();

        assertEquals(tempDir.resolve("k/store.blob"), paths.resolve(tempDir, paths.keyStore));
        assertEquals(Paths.get("/var/lib/evg/shards"), paths.resolve(tempDir, paths.shardRoot));
    }

    @Test
    void loadIsCachedUnlessRefreshed() throws Exception {
        String path = fixture().toString();
        SystemConfig first = SystemConfig.load(path, false);

        assertSame(first, SystemConfig.load(path, false));
        assertNotSame(first, SystemConfig.load(path, true));
    }

    @Test
    void missingSectionsFallBackToDefaults() throws Exception {
        Path cfgPath = tempDir.resolve("partial.json");
        Files.writeString(cfgPath, "{ \"retry\": null, \"metricsEnabled\": true }", StandardCharsets.UTF_8);

        SystemConfig cfg = SystemConfig.load(cfgPath.toString(), true);

        assertNotNull(cfg.getRetry());
        assertNotNull(cfg.getBuffer());
        assertEquals(3, cfg.getRetry().getMaxAttempts());
    }

    @Test
    void fromJsonParsesInlineDocument() throws Exception {
        SystemConfig cfg = SystemConfig.fromJson("{\"buffer\":{\"maxItems\":3}}");
        assertEquals(3, cfg.getBuffer().getMaxItems());
    }

    @Test
    void load_nonExistingFile_throwsConfigLoadException() {
        assertThrows(SystemConfig.ConfigLoadException.class,
                () -> SystemConfig.load("this/does/not/exist/config.json", true));
    }

    @Test
    void load_directoryInsteadOfFile_throwsConfigLoadException() {
        assertThrows(SystemConfig.ConfigLoadException.class,
                () -> SystemConfig.load(tempDir.toString(), true));
    }

    @Test
    void load_malformedJson_throwsConfigLoadException() throws IOException {
        Path cfgPath = tempDir.resolve("bad.json");
        Files.writeString(cfgPath, "this is not valid JSON {", StandardCharsets.UTF_8);

        assertThrows(SystemConfig.ConfigLoadException.class,
                () -> SystemConfig.load(cfgPath.toString(), true));
    }
}

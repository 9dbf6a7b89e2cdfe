package com.evg.store.backend;

import org.rocksdb.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Shard objects in a RocksDB instance, keyed {@code {repoId}\0{name}}. Single puts are atomic and synced.
 */
public class RocksDBShardBackend implements ShardBackend {
    private static final Logger logger = LoggerFactory.getLogger(RocksDBShardBackend.class);

    static {
        try {
            RocksDB.loadLibrary();
        } catch (Throwable t) {
            throw new RuntimeException("Failed to load RocksDB native library", t);
        }
    }

    private final Path dbPath;
    private final Options options;
    private final RocksDB db;
    private volatile boolean closed = false;

    public RocksDBShardBackend(Path dbPath) throws IOException {
        this.dbPath = Objects.requireNonNull(dbPath, "dbPath").toAbsolutePath().normalize();
        Files.createDirectories(this.dbPath);
        this.options = new Options()
                .setCreateIfMissing(true)
                .setCompressionType(CompressionType.NO_COMPRESSION)
                .setInfoLogLevel(InfoLogLevel.ERROR_LEVEL);
        try {
            this.db = RocksDB.open(options, this.dbPath.toString());
        } catch (RocksDBException e) {
            options.close();
            throw new IOException("RocksDB open failed at " + this.dbPath, e);
        }
        logger.info("RocksDB shard backend opened at {}", this.dbPath);
    }

    private static byte[] key(String repoId, String name) {
        if (repoId.indexOf('\0') >= 0 || name.indexOf('\0') >= 0) {
            throw new IllegalArgumentException("repoId and name must not contain NUL");
        }
        return (repoId + "\0" + name).getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public void put(String repoId, String name, byte[] bytes) throws IOException {
        try (WriteOptions wo = new WriteOptions().setSync(true)) {
            db.put(wo, key(repoId, name), bytes);
        } catch (RocksDBException e) {
            throw new IOException("put failed for " + repoId + "/" + name, e);
        }
    }

    @Override
    public Optional<byte[]> get(String repoId, String name) throws IOException {
        try {
            return Optional.ofNullable(db.get(key(repoId, name)));
        } catch (RocksDBException e) {
            throw new IOException("get failed for " + repoId + "/" + name, e);
        }
    }

    @Override
    public void delete(String repoId, String name) throws IOException {
        try (WriteOptions wo = new WriteOptions().setSync(true)) {
            db.delete(wo, key(repoId, name));
        } catch (RocksDBException e) {
            throw new IOException("delete failed for " + repoId + "/" + name, e);
        }
    }

    @Override
    public List<String> list(String repoId) {
        byte[] prefix = (repoId + "\0").getBytes(StandardCharsets.UTF_8);
        List<String> out = new ArrayList<>();
        try (RocksIterator it = db.newIterator()) {
            for (it.seek(prefix); it.isValid(); it.next()) {
                byte[] k = it.key();
                if (k.length < prefix.length || !Arrays.equals(k, 0, prefix.length, prefix, 0, prefix.length)) break;
                out.add(new String(k, prefix.length, k.length - prefix.length, StandardCharsets.UTF_8));
            }
        }
        return out;
    }

    @Override
    public Set<String> repositories() {
        Set<String> out = new TreeSet<>();
        try (RocksIterator it = db.newIterator()) {
            for (it.seekToFirst(); it.isValid(); it.next()) {
                String k = new String(it.key(), StandardCharsets.UTF_8);
                int sep = k.indexOf('\0');
                if (sep > 0) out.add(k.substring(0, sep));
            }
        }
        return out;
    }

    @Override
    public synchronized void close() {
        if (closed) return;
        try {
            db.syncWal();
        } catch (RocksDBException e) {
            logger.warn("WAL sync on close failed for {}", dbPath, e);
        }
        db.close();
        options.close();
        closed = true;
        logger.info("RocksDB shard backend closed at {}", dbPath);
    }
}

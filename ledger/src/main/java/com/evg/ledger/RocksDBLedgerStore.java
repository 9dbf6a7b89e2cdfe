package com.evg.ledger;

import com.evg.common.LedgerEntry;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.rocksdb.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * RocksDB-backed ledger.
 *
 * Keys:
 *   e\0{repoId}\0{sequence, 20 digits}  -> entry JSON
 *   h\0{repoId}                         -> head entry JSON
 *
 * Entry and head are written in one synced {@link WriteBatch}.
 */
public class RocksDBLedgerStore implements LedgerStore {
    private static final Logger logger = LoggerFactory.getLogger(RocksDBLedgerStore.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final String ENTRY_PREFIX = "e\0";
    private static final String HEAD_PREFIX = "h\0";

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

    public RocksDBLedgerStore(Path dbPath) throws IOException {
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
        logger.info("Ledger store opened at {}", this.dbPath);
    }

    static byte[] entryKey(String repoId, long sequence) {
        return (ENTRY_PREFIX + repoId + "\0" + String.format("%020d", sequence)).getBytes(StandardCharsets.UTF_8);
    }

    static byte[] headKey(String repoId) {
        return (HEAD_PREFIX + repoId).getBytes(StandardCharsets.UTF_8);
    }

    private static void checkRepo(String repoId) {
        if (repoId.indexOf('\0') >= 0) {
            throw new IllegalArgumentException("repoId must not contain NUL");
        }
    }

    @Override
    public Optional<LedgerEntry> head(String repoId) throws IOException {
        checkRepo(repoId);
        try {
            byte[] v = db.get(headKey(repoId));
            return (v == null) ? Optional.empty() : Optional.of(MAPPER.readValue(v, LedgerEntry.class));
        } catch (RocksDBException e) {
            throw new IOException("Ledger head read failed for " + repoId, e);
        }
    }

    @Override
    public void append(LedgerEntry entry) throws IOException {
        checkRepo(entry.getRepoId());
        byte[] json = MAPPER.writeValueAsBytes(entry);
        try (WriteBatch batch = new WriteBatch(); WriteOptions wo = new WriteOptions().setSync(true)) {
            batch.put(entryKey(entry.getRepoId(), entry.getSequence()), json);
            batch.put(headKey(entry.getRepoId()), json);
            db.write(wo, batch);
        } catch (RocksDBException e) {
            throw new IOException("Ledger append failed for " + entry.getRepoId() + "#" + entry.getSequence(), e);
        }
    }

    @Override
    public List<LedgerEntry> read(String repoId) throws IOException {
        checkRepo(repoId);
        byte[] prefix = (ENTRY_PREFIX + repoId + "\0").getBytes(StandardCharsets.UTF_8);
        List<LedgerEntry> out = new ArrayList<>();
        try (RocksIterator it = db.newIterator()) {
            for (it.seek(prefix); it.isValid() && startsWith(it.key(), prefix); it.next()) {
                out.add(MAPPER.readValue(it.value(), LedgerEntry.class));
            }
        }
        return out;
    }

    @Override
    public Set<String> repositories() {
        byte[] prefix = HEAD_PREFIX.getBytes(StandardCharsets.UTF_8);
        Set<String> out = new TreeSet<>();
        try (RocksIterator it = db.newIterator()) {
            for (it.seek(prefix); it.isValid() && startsWith(it.key(), prefix); it.next()) {
                byte[] k = it.key();
                out.add(new String(k, prefix.length, k.length - prefix.length, StandardCharsets.UTF_8));
            }
        }
        return out;
    }

    private static boolean startsWith(byte[] key, byte[] prefix) {
        if (key.length < prefix.length) return false;
        return Arrays.equals(key, 0, prefix.length, prefix, 0, prefix.length);
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
        logger.info("Ledger store closed at {}", dbPath);
    }
}

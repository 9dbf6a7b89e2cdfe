package com.evg.store.backend;

import com.evg.common.PersistenceUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.*;
import java.util.stream.Stream;

/**
 * One directory per repository under a root. Directory and file names are percent-encoded so that
 * arbitrary repository ids cannot escape the root. Writes go through a temp file, fsync and atomic rename.
 */
public class FileShardBackend implements ShardBackend {
    private static final Logger logger = LoggerFactory.getLogger(FileShardBackend.class);

    private final Path root;

    public FileShardBackend(Path root) throws IOException {
        this.root = Objects.requireNonNull(root, "root").toAbsolutePath().normalize();
        Files.createDirectories(this.root);
        logger.info("File shard backend at {}", this.root);
    }

    static String encode(String component) {
        String s = URLEncoder.encode(component, StandardCharsets.UTF_8);
        // URLEncoder leaves '.' alone
        if (s.equals(".") || s.equals("..")) return s.replace(".", "%2E");
        return s;
    }

    static String decode(String component) {
        return URLDecoder.decode(component, StandardCharsets.UTF_8);
    }

    private Path dirOf(String repoId) {
        return root.resolve(encode(repoId));
    }

    private Path fileOf(String repoId, String name) {
        return dirOf(repoId).resolve(encode(name));
    }

    @Override
    public void put(String repoId, String name, byte[] bytes) throws IOException {
        PersistenceUtils.writeAtomically(fileOf(repoId, name), bytes);
    }

    @Override
    public Optional<byte[]> get(String repoId, String name) throws IOException {
        try {
            return Optional.of(Files.readAllBytes(fileOf(repoId, name)));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        }
    }

    @Override
    public void delete(String repoId, String name) throws IOException {
        Files.deleteIfExists(fileOf(repoId, name));
    }

    @Override
    public List<String> list(String repoId) throws IOException {
        Path dir = dirOf(repoId);
        if (!Files.isDirectory(dir)) return List.of();
        List<String> out = new ArrayList<>();
        try (Stream<Path> files = Files.list(dir)) {
            files.filter(Files::isRegularFile)
                    .map(p -> p.getFileName().toString())
                    .filter(n -> !n.endsWith(".tmp"))
                    .map(FileShardBackend::decode)
                    .forEach(out::add);
        }
        Collections.sort(out);
        return out;
    }

    @Override
    public Set<String> repositories() throws IOException {
        Set<String> out = new TreeSet<>();
        try (Stream<Path> dirs = Files.list(root)) {
            dirs.filter(Files::isDirectory)
                    .map(p -> decode(p.getFileName().toString()))
                    .forEach(out::add);
        }
        return out;
    }

    public Path getRoot() {
        return root;
    }
}

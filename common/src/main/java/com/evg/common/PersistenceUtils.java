package com.evg.common;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import java.util.Set;

public class PersistenceUtils {
    private static final Logger logger = LoggerFactory.getLogger(PersistenceUtils.class);
    private static final Set<String> ALLOWED_CLASSES = Set.of(
            "com.evg.key.KeyManager$KeyRegistryBlob",
            "com.evg.key.KeyManager$KeyRecord",
            "com.evg.key.DerivedKeyProvider$MasterKeyBlob",
            "java.util.ArrayList",
            "java.util.HashMap",
            "java.util.concurrent.ConcurrentHashMap",
            "javax.crypto.spec.SecretKeySpec",
            "[B"
    );

    private PersistenceUtils() {}

    /**
     * Saves a serializable object to {@code path} atomically (temp file + move).
     * Validates that the file path is within the expected directory.
     */
    public static <T extends Serializable> void saveObject(T object, Path path, Path baseDir) throws IOException {
        Objects.requireNonNull(object, "Object cannot be null");
        checkWithin(path, baseDir);

        ByteArrayOutputStream bos = new ByteArrayOutputStream();
        try (ObjectOutputStream oos = new ObjectOutputStream(bos)) {
            oos.writeObject(object);
        }
        writeAtomically(path, bos.toByteArray());
        logger.debug("Saved object to {}", path);
    }

    /**
     * Loads a serializable object with type safety.
     * Restricts deserialization to allowed classes and validates file path.
     */
    public static <T extends Serializable> T loadObject(Path path, Path baseDir, Class<T> expectedType)
            throws IOException, ClassNotFoundException {
        Objects.requireNonNull(expectedType, "Expected type cannot be null");
        checkWithin(path, baseDir);

        if (!Files.exists(path)) {
            throw new FileNotFoundException("File does not exist: " + path);
        }

        try (BufferedInputStream bis = new BufferedInputStream(Files.newInputStream(path));
             ValidatingObjectInputStream ois = new ValidatingObjectInputStream(bis)) {
            Object obj = ois.readObject();
            if (!expectedType.isInstance(obj)) {
                logger.error("Deserialized object is not of expected type: {}", expectedType.getName());
                throw new InvalidClassException("Expected " + expectedType.getName() + ", got " + obj.getClass().getName());
            }
            logger.debug("Loaded object from {}", path);
            return expectedType.cast(obj);
        }
    }

    /**
     * Writes bytes to a sibling temp file, fsyncs it and renames it over {@code target}.
     * Readers observe either the old or the new content, never a torn file.
     */
    public static void writeAtomically(Path target, byte[] bytes) throws IOException {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(bytes, "bytes");
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);

        Path tmp = Files.createTempFile(parent, target.getFileName().toString(), ".tmp");
        try {
            try (FileChannel ch = FileChannel.open(tmp, StandardOpenOption.WRITE,
                    StandardOpenOption.TRUNCATE_EXISTING)) {
                java.nio.ByteBuffer buf = java.nio.ByteBuffer.wrap(bytes);
                while (buf.hasRemaining()) {
                    ch.write(buf);
                }
                ch.force(true);
            }
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    private static void checkWithin(Path path, Path baseDir) throws IOException {
        Objects.requireNonNull(path, "File path cannot be null");
        Objects.requireNonNull(baseDir, "Base directory cannot be null");
        Path p = path.toAbsolutePath().normalize();
        Path base = baseDir.toAbsolutePath().normalize();
        if (!p.startsWith(base)) {
            logger.error("Path traversal detected: {}", path);
            throw new IOException("Invalid file path: " + path);
        }
    }

    /**
     * Custom ObjectInputStream to restrict deserialization to allowed classes.
     */
    private static class ValidatingObjectInputStream extends ObjectInputStream {

        ValidatingObjectInputStream(InputStream in) throws IOException {
            super(in);
        }

        @Override
        protected Class<?> resolveClass(ObjectStreamClass desc) throws IOException, ClassNotFoundException {
            String className = desc.getName();
            if (!ALLOWED_CLASSES.contains(className)) {
                logger.error("Attempted to deserialize unauthorized class: {}", className);
                throw new InvalidClassException("Unauthorized class: " + className);
            }
            return super.resolveClass(desc);
        }
    }
}

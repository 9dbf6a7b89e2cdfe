package com.evg.ledger;

import com.evg.common.Checksums;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Hash input of a ledger entry:
 * <pre>
 * sequence (int64 BE) | len(repoId) (int32 BE) | repoId utf8 | len(pointer) (int32 BE) | pointer utf8 | timestamp (int64 BE)
 * </pre>
 * Length prefixes keep adjacent variable-width fields unambiguous.
 */
public final class LedgerCanonicalForm {
    /** hash_prev of the first entry of every repository. */
    public static final String GENESIS = "0".repeat(64);

    private LedgerCanonicalForm() {}

    public static byte[] canonicalBytes(long sequence, String repoId, String manifestPointer, long timestamp) {
        byte[] repo = repoId.getBytes(StandardCharsets.UTF_8);
        byte[] ptr = manifestPointer.getBytes(StandardCharsets.UTF_8);
        return ByteBuffer.allocate(8 + 4 + repo.length + 4 + ptr.length + 8)
                .putLong(sequence)
                .putInt(repo.length).put(repo)
                .putInt(ptr.length).put(ptr)
                .putLong(timestamp)
                .array();
    }

    /** {@code SHA-256(hashPrev bytes || canonical)} as lowercase hex. */
    public static String chainHash(String hashPrev, long sequence, String repoId, String manifestPointer, long timestamp) {
        MessageDigest md = Checksums.sha256();
        md.update(Checksums.fromHex(hashPrev));
        md.update(canonicalBytes(sequence, repoId, manifestPointer, timestamp));
        return Checksums.toHex(md.digest());
    }
}

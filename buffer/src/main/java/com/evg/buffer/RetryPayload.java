package com.evg.buffer;

import java.util.List;
import java.util.Objects;

/**
 * What a buffered write carries.
 * {@code SEALED} payloads hold envelope bytes and are committed as-is on replay.
 * {@code SEAL_PENDING} payloads hold the encoded batch and are sealed under the current key on replay;
 * they are never written to the snapshot file.
 */
public final class RetryPayload {

    public enum Stage { SEALED, SEAL_PENDING }

    private final Stage stage;
    private final String batchId;
    private final String manifestId;
    private final List<String> removedBatchIds;
    private final String keyId;
    private final byte[] bytes;

    public RetryPayload(Stage stage, String batchId, String manifestId, List<String> removedBatchIds,
                        String keyId, byte[] bytes) {
        this.stage = Objects.requireNonNull(stage, "stage");
        this.batchId = Objects.requireNonNull(batchId, "batchId");
        this.manifestId = Objects.requireNonNull(manifestId, "manifestId");
        this.removedBatchIds = (removedBatchIds != null) ? List.copyOf(removedBatchIds) : List.of();
        if (stage == Stage.SEALED && keyId == null) {
            throw new IllegalArgumentException("sealed payload requires a keyId");
        }
        this.keyId = keyId;
        this.bytes = Objects.requireNonNull(bytes, "bytes").clone();
    }

    public static RetryPayload sealed(String batchId, String manifestId, List<String> removedBatchIds,
                                      String keyId, byte[] envelope) {
        return new RetryPayload(Stage.SEALED, batchId, manifestId, removedBatchIds, keyId, envelope);
    }

    public static RetryPayload sealPending(String batchId, String manifestId, List<String> removedBatchIds,
                                           byte[] encodedBatch) {
        return new RetryPayload(Stage.SEAL_PENDING, batchId, manifestId, removedBatchIds, null, encodedBatch);
    }

    public Stage getStage() { return stage; }
    public String getBatchId() { return batchId; }
    public String getManifestId() { return manifestId; }
    public List<String> getRemovedBatchIds() { return removedBatchIds; }
    /** null for {@code SEAL_PENDING}. */
    public String getKeyId() { return keyId; }
    public byte[] getBytes() { return bytes.clone(); }

    public int length() {
        return bytes.length;
    }

    @Override
    public String toString() {
        return String.format("RetryPayload{%s, batch=%s, len=%d}", stage, batchId, bytes.length);
    }
}

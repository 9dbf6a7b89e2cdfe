package com.evg.store;

import java.util.Objects;

/** One sealed segment as stored. The envelope bytes are never decrypted on the export path. */
public final class ExportRecord {
    private final String repoId;
    private final String segmentId;
    private final long commitVersion;
    private final String keyId;
    private final String sha256;
    private final byte[] envelope;

    public ExportRecord(String repoId, String segmentId, long commitVersion, String keyId,
                        String sha256, byte[] envelope) {
        this.repoId = Objects.requireNonNull(repoId, "repoId");
        this.segmentId = Objects.requireNonNull(segmentId, "segmentId");
        this.commitVersion = commitVersion;
        this.keyId = Objects.requireNonNull(keyId, "keyId");
        this.sha256 = Objects.requireNonNull(sha256, "sha256");
        this.envelope = Objects.requireNonNull(envelope, "envelope").clone();
    }

    public String getRepoId() { return repoId; }
    public String getSegmentId() { return segmentId; }
    public long getCommitVersion() { return commitVersion; }
    public String getKeyId() { return keyId; }
    public String getSha256() { return sha256; }
    public byte[] getEnvelope() { return envelope.clone(); }

    @Override
    public String toString() {
        return String.format("ExportRecord{repo=%s, %s, v=%d, key=%s, len=%d}",
                repoId, segmentId, commitVersion, keyId, envelope.length);
    }
}

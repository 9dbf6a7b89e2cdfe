package com.evg.key;

import java.util.Objects;

/**
 * Audit event emitted for every provision and rotation.
 */
public final class KeyAttestation {

    public enum Action { PROVISION, ROTATE }

    private final String repoId;
    private final String keyId;
    private final long epoch;
    private final Action action;
    private final long timestamp;

    public KeyAttestation(String repoId, String keyId, long epoch, Action action, long timestamp) {
        this.repoId = Objects.requireNonNull(repoId, "repoId");
        this.keyId = Objects.requireNonNull(keyId, "keyId");
        this.epoch = epoch;
        this.action = Objects.requireNonNull(action, "action");
        this.timestamp = timestamp;
    }

    public String getRepoId() { return repoId; }
    public String getKeyId() { return keyId; }
    public long getEpoch() { return epoch; }
    public Action getAction() { return action; }
    public long getTimestamp() { return timestamp; }

    /** Manifest pointer recorded in the audit ledger for this event. */
    public String toManifestPointer() {
        return "key-attestation:" + action.name().toLowerCase() + "/" + keyId + "/epoch:" + epoch + "/ts:" + timestamp;
    }

    @Override
    public String toString() {
        return String.format("KeyAttestation{%s repo=%s key=%s epoch=%d}", action, repoId, keyId, epoch);
    }
}

package com.evg.buffer;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One NDJSON line of the crash-recovery snapshot.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
class SnapshotRecord {
    @JsonProperty("sequence")
    public long sequence;

    @JsonProperty("repo_id")
    public String repoId;

    /** Age of the entry when the snapshot was taken. */
    @JsonProperty("delayed_ms")
    public long delayedMs;

    @JsonProperty("enqueued_at")
    public long enqueuedAt;

    /** SHA-256 hex of the payload bytes. */
    @JsonProperty("checksum")
    public String checksum;

    @JsonProperty("attempt_count")
    public int attemptCount;

    @JsonProperty("stage")
    public String stage;

    @JsonProperty("batch_id")
    public String batchId;

    @JsonProperty("manifest_id")
    public String manifestId;

    @JsonProperty("removed_batch_ids")
    public List<String> removedBatchIds;

    @JsonProperty("key_id")
    public String keyId;

    /** Base64 envelope bytes; absent for seal-pending entries. */
    @JsonProperty("payload")
    public byte[] payload;
}

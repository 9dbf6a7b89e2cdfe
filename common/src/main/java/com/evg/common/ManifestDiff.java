package com.evg.common;

import java.util.List;
import java.util.Objects;

/**
 * Describes the batches added and removed by one ingestion step.
 * Removed batches are tombstoned on commit and reclaimed by compaction.
 */
public final class ManifestDiff {
    private final String manifestId;
    private final List<String> addedBatchIds;
    private final List<String> removedBatchIds;

    public ManifestDiff(String manifestId, List<String> addedBatchIds, List<String> removedBatchIds) {
        this.manifestId = Objects.requireNonNull(manifestId, "manifestId cannot be null");
        this.addedBatchIds = (addedBatchIds != null) ? List.copyOf(addedBatchIds) : List.of();
        this.removedBatchIds = (removedBatchIds != null) ? List.copyOf(removedBatchIds) : List.of();
    }

    public static ManifestDiff adding(String manifestId, String batchId) {
        return new ManifestDiff(manifestId, List.of(batchId), List.of());
    }

    public String getManifestId() { return manifestId; }
    public List<String> getAddedBatchIds() { return addedBatchIds; }
    public List<String> getRemovedBatchIds() { return removedBatchIds; }

    @Override
    public String toString() {
        return String.format("ManifestDiff{id=%s, +%d, -%d}",
                manifestId, addedBatchIds.size(), removedBatchIds.size());
    }
}

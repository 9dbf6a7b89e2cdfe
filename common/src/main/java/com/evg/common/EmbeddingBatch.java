package com.evg.common;

import java.util.List;
import java.util.Objects;

/**
 * A batch of embeddings produced by the ingestion pipeline for one repository.
 */
public final class EmbeddingBatch {
    private final String repoId;
    private final String batchId;
    private final List<Embedding> embeddings;

    public EmbeddingBatch(String repoId, String batchId, List<Embedding> embeddings) {
        this.repoId = requireText(repoId, "repoId");
        this.batchId = requireText(batchId, "batchId");
        this.embeddings = List.copyOf(Objects.requireNonNull(embeddings, "embeddings"));
    }

    private static String requireText(String s, String name) {
        if (s == null || s.isBlank()) {
            throw new IllegalArgumentException(name + " cannot be null or blank");
        }
        return s;
    }

    public String getRepoId() { return repoId; }
    public String getBatchId() { return batchId; }
    public List<Embedding> getEmbeddings() { return embeddings; }
    public int size() { return embeddings.size(); }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof EmbeddingBatch that)) return false;
        return repoId.equals(that.repoId)
                && batchId.equals(that.batchId)
                && embeddings.equals(that.embeddings);
    }

    @Override
    public int hashCode() {
        return Objects.hash(repoId, batchId, embeddings);
    }

    @Override
    public String toString() {
        return String.format("EmbeddingBatch{repo=%s, batch=%s, size=%d}", repoId, batchId, embeddings.size());
    }
}

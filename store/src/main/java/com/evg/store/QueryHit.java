package com.evg.store;

import java.util.Comparator;
import java.util.Map;
import java.util.Objects;

public final class QueryHit {
    /** Score descending, then batch id, vector index and repository ascending. */
    static final Comparator<QueryHit> ORDER = Comparator
            .comparingDouble(QueryHit::getScore).reversed()
            .thenComparing(QueryHit::getBatchId)
            .thenComparingInt(QueryHit::getVectorIndex)
            .thenComparing(QueryHit::getRepoId);

    private final String repoId;
    private final String batchId;
    private final int vectorIndex;
    private final String vectorId;
    private final double score;
    private final Map<String, String> attributes;

    public QueryHit(String repoId, String batchId, int vectorIndex, String vectorId,
                    double score, Map<String, String> attributes) {
        this.repoId = Objects.requireNonNull(repoId, "repoId");
        this.batchId = Objects.requireNonNull(batchId, "batchId");
        this.vectorIndex = vectorIndex;
        this.vectorId = Objects.requireNonNull(vectorId, "vectorId");
        this.score = score;
        this.attributes = (attributes != null) ? Map.copyOf(attributes) : Map.of();
    }

    public String getRepoId() { return repoId; }
    public String getBatchId() { return batchId; }
    public int getVectorIndex() { return vectorIndex; }
    public String getVectorId() { return vectorId; }
    public double getScore() { return score; }
    public Map<String, String> getAttributes() { return attributes; }

    @Override
    public String toString() {
        return "QueryHit{repo='" + repoId + "', batch='" + batchId + "', idx=" + vectorIndex
                + ", id='" + vectorId + "', score=" + score + '}';
    }
}

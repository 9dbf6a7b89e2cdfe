package com.evg.store;

import java.util.*;

/**
 * Selection for {@link VectorStore#query}. With no vector every matching embedding scores 0 and results
 * come back in batch/vector order. Empty {@code repoIds} means every open shard.
 */
public final class QueryCriteria {
    private final Set<String> repoIds;
    private final float[] vector;
    private final int k;
    private final Map<String, String> filters;
    private final Set<String> batchIds;

    private QueryCriteria(Builder b) {
        if (b.k < 1) throw new IllegalArgumentException("k must be >= 1");
        this.repoIds = Collections.unmodifiableSet(new TreeSet<>(b.repoIds));
        this.vector = (b.vector == null) ? null : b.vector.clone();
        this.k = b.k;
        this.filters = Map.copyOf(b.filters);
        this.batchIds = Set.copyOf(b.batchIds);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Set<String> getRepoIds() { return repoIds; }
    public float[] getVector() { return (vector == null) ? null : vector.clone(); }
    public int getK() { return k; }
    public Map<String, String> getFilters() { return filters; }
    public Set<String> getBatchIds() { return batchIds; }

    boolean hasVector() {
        return vector != null;
    }

    float[] vectorRef() {
        return vector;
    }

    boolean matches(Map<String, String> attributes) {
        for (Map.Entry<String, String> f : filters.entrySet()) {
            if (!f.getValue().equals(attributes.get(f.getKey()))) return false;
        }
        return true;
    }

    @Override
    public String toString() {
        return String.format("QueryCriteria{repos=%s, dim=%s, k=%d, filters=%s, batches=%s}",
                repoIds, vector == null ? "-" : String.valueOf(vector.length), k, filters.keySet(), batchIds.size());
    }

    public static final class Builder {
        private final Set<String> repoIds = new TreeSet<>();
        private float[] vector;
        private int k = 10;
        private final Map<String, String> filters = new LinkedHashMap<>();
        private final Set<String> batchIds = new TreeSet<>();

        private Builder() {}

        public Builder repo(String repoId) {
            repoIds.add(Objects.requireNonNull(repoId, "repoId"));
            return this;
        }

        public Builder vector(float[] v) {
            this.vector = Objects.requireNonNull(v, "vector").clone();
            if (v.length == 0) throw new IllegalArgumentException("query vector cannot be empty");
            return this;
        }

        public Builder k(int k) {
            this.k = k;
            return this;
        }

        public Builder filter(String attribute, String value) {
            filters.put(Objects.requireNonNull(attribute, "attribute"), Objects.requireNonNull(value, "value"));
            return this;
        }

        public Builder batch(String batchId) {
            batchIds.add(Objects.requireNonNull(batchId, "batchId"));
            return this;
        }

        public QueryCriteria build() {
            return new QueryCriteria(this);
        }
    }
}

package com.evg.common;

import java.util.Arrays;
import java.util.Map;
import java.util.Objects;

/**
 * One embedding vector inside a batch, with free-form attributes used by query filters.
 */
public final class Embedding {
    private final String vectorId;
    private final float[] values;
    private final Map<String, String> attributes;

    public Embedding(String vectorId, float[] values, Map<String, String> attributes) {
        this.vectorId = Objects.requireNonNull(vectorId, "vectorId cannot be null");
        Objects.requireNonNull(values, "values cannot be null");
        if (values.length == 0) {
            throw new IllegalArgumentException("Embedding cannot be empty");
        }
        for (float v : values) {
            if (Float.isNaN(v) || Float.isInfinite(v)) {
                throw new IllegalArgumentException("Embedding contains invalid values (NaN or Infinite)");
            }
        }
        this.values = values.clone();
        this.attributes = (attributes != null) ? Map.copyOf(attributes) : Map.of();
    }

    public Embedding(String vectorId, float[] values) {
        this(vectorId, values, Map.of());
    }

    public String getVectorId() { return vectorId; }
    public float[] getValues() { return values.clone(); }
    public int getDimension() { return values.length; }
    public Map<String, String> getAttributes() { return attributes; }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Embedding that)) return false;
        return vectorId.equals(that.vectorId)
                && Arrays.equals(values, that.values)
                && attributes.equals(that.attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(vectorId, Arrays.hashCode(values), attributes);
    }

    @Override
    public String toString() {
        return String.format("Embedding{id=%s, dim=%d}", vectorId, values.length);
    }
}

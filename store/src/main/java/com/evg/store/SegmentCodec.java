package com.evg.store;

import com.evg.common.Embedding;
import com.evg.common.EmbeddingBatch;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Plaintext layout of a segment: a JSON list of batches. Only ever written to storage inside an envelope.
 */
public final class SegmentCodec {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private SegmentCodec() {}

    /** One batch as stored in a segment. */
    public record StoredBatch(String batchId, String manifestId, EmbeddingBatch batch) {}

    public static byte[] encode(List<StoredBatch> batches) {
        List<BatchDoc> docs = new ArrayList<>(batches.size());
        for (StoredBatch b : batches) {
            BatchDoc d = new BatchDoc();
            d.repoId = b.batch().getRepoId();
            d.batchId = b.batchId();
            d.manifestId = b.manifestId();
            d.vectors = new ArrayList<>(b.batch().size());
            for (Embedding e : b.batch().getEmbeddings()) {
                VectorDoc v = new VectorDoc();
                v.id = e.getVectorId();
                v.values = e.getValues();
                v.attributes = e.getAttributes();
                d.vectors.add(v);
            }
            docs.add(d);
        }
        try {
            return MAPPER.writeValueAsBytes(docs);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot encode segment", e);
        }
    }

    public static byte[] encode(EmbeddingBatch batch, String manifestId) {
        return encode(List.of(new StoredBatch(batch.getBatchId(), manifestId, batch)));
    }

    public static List<StoredBatch> decode(byte[] plaintext) throws IOException {
        BatchDoc[] docs = MAPPER.readValue(plaintext, BatchDoc[].class);
        List<StoredBatch> out = new ArrayList<>(docs.length);
        for (BatchDoc d : docs) {
            if (d.repoId == null || d.batchId == null || d.vectors == null) {
                throw new IOException("Segment batch is missing required fields");
            }
            List<Embedding> embeddings = new ArrayList<>(d.vectors.size());
            for (VectorDoc v : d.vectors) {
                embeddings.add(new Embedding(v.id, v.values, v.attributes));
            }
            out.add(new StoredBatch(d.batchId, d.manifestId, new EmbeddingBatch(d.repoId, d.batchId, embeddings)));
        }
        return out;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static final class BatchDoc {
        public String repoId;
        public String batchId;
        public String manifestId;
        public List<VectorDoc> vectors;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static final class VectorDoc {
        public String id;
        public float[] values;
        public Map<String, String> attributes;
    }
}

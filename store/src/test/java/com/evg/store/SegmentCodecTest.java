package com.evg.store;

import com.evg.common.Embedding;
import com.evg.common.EmbeddingBatch;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SegmentCodecTest {

    @Test
    void batchesKeepOrderValuesAndAttributes() throws IOException {
        EmbeddingBatch a = new EmbeddingBatch("repo", "a", List.of(
                new Embedding("a0", new float[]{0.25f, -1.5f}, Map.of("k", "v")),
                new Embedding("a1", new float[]{3f, 4f})));
        EmbeddingBatch b = new EmbeddingBatch("repo", "b", List.of(new Embedding("b0", new float[]{1f})));

        List<SegmentCodec.StoredBatch> back = SegmentCodec.decode(SegmentCodec.encode(List.of(
                new SegmentCodec.StoredBatch("a", "m1", a),
                new SegmentCodec.StoredBatch("b", "m2", b))));

        assertEquals(List.of("a", "b"), List.of(back.get(0).batchId(), back.get(1).batchId()));
        assertEquals("m2", back.get(1).manifestId());
        assertEquals(a, back.get(0).batch());
        assertEquals(b, back.get(1).batch());
    }

    @Test
    void missingFieldsAreRejected() {
        byte[] json = "[{\"batchId\":\"x\"}]".getBytes(StandardCharsets.UTF_8);
        assertThrows(IOException.class, () -> SegmentCodec.decode(json));
    }
}

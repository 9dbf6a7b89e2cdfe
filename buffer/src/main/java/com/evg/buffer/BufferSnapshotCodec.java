package com.evg.buffer;

import com.evg.common.Checksums;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Newline-delimited JSON, one record per entry, ordered by sequence.
 * Jackson writes {@code byte[]} as base64.
 */
final class BufferSnapshotCodec {
    private static final Logger logger = LoggerFactory.getLogger(BufferSnapshotCodec.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private BufferSnapshotCodec() {}

    static byte[] encode(Collection<RetryBufferEntry> ordered, long now) {
        StringBuilder sb = new StringBuilder();
        for (RetryBufferEntry e : ordered) {
            RetryPayload p = e.getPayload();
            SnapshotRecord r = new SnapshotRecord();
            r.sequence = e.getSequence();
            r.repoId = e.getRepoId();
            r.delayedMs = Math.max(0L, now - e.getEnqueuedAt());
            r.enqueuedAt = e.getEnqueuedAt();
            byte[] bytes = p.getBytes();
            r.checksum = Checksums.sha256Hex(bytes);
            r.attemptCount = e.getAttemptCount();
            r.stage = p.getStage().name();
            r.batchId = p.getBatchId();
            r.manifestId = p.getManifestId();
            r.removedBatchIds = p.getRemovedBatchIds().isEmpty() ? null : p.getRemovedBatchIds();
            r.keyId = p.getKeyId();
            r.payload = (p.getStage() == RetryPayload.Stage.SEALED) ? bytes : null;
            try {
                sb.append(MAPPER.writeValueAsString(r)).append('\n');
            } catch (IOException ex) {
                throw new UncheckedIOException("Snapshot encoding failed at sequence " + e.getSequence(), ex);
            }
        }
        return sb.toString().getBytes(StandardCharsets.UTF_8);
    }

    static List<SnapshotRecord> decode(byte[] bytes) throws IOException {
        List<SnapshotRecord> out = new ArrayList<>();
        String text = new String(bytes, StandardCharsets.UTF_8);
        int lineNo = 0;
        for (String line : text.split("\n")) {
            lineNo++;
            if (line.isBlank()) continue;
            try {
                out.add(MAPPER.readValue(line, SnapshotRecord.class));
            } catch (IOException e) {
                logger.error("Unparseable snapshot line {}", lineNo);
                throw new IOException("Snapshot line " + lineNo + " is not valid JSON", e);
            }
        }
        return out;
    }
}

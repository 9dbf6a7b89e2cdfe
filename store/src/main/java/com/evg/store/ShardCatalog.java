package com.evg.store;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;

/**
 * JSON form of a {@link ShardVersion}, stored next to the segments as {@value #OBJECT_NAME}.
 */
final class ShardCatalog {
    static final String OBJECT_NAME = "shard.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ShardCatalog() {}

    static byte[] encode(ShardVersion version) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsBytes(version);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot serialize shard catalog " + version, e);
        }
    }

    static ShardVersion decode(byte[] bytes) throws IOException {
        return MAPPER.readValue(bytes, ShardVersion.class);
    }
}

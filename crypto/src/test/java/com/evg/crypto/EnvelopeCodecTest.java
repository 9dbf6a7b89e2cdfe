package com.evg.crypto;

import com.evg.common.EnvelopeFormatException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class EnvelopeCodecTest {

    private static Envelope sample(String keyId) {
        byte[] nonce = new byte[Envelope.NONCE_LEN];
        byte[] tag = new byte[Envelope.TAG_LEN];
        Arrays.fill(nonce, (byte) 0x11);
        Arrays.fill(tag, (byte) 0x22);
        return new Envelope(keyId, nonce, tag, new byte[]{5, 6, 7});
    }

    @Test
    void layoutStartsWithMagicAndLittleEndianKeyLength() {
        byte[] wire = EnvelopeCodec.encode(sample("repo#e1"));

        assertArrayEquals("EVG1".getBytes(StandardCharsets.US_ASCII), Arrays.copyOf(wire, 4));
        assertEquals(7, wire[4]);
        assertEquals(0, wire[5]);
        assertEquals("repo#e1", new String(wire, 6, 7, StandardCharsets.UTF_8));
        assertEquals(4 + 2 + 7 + 12 + 16 + 3, wire.length);
        assertEquals(0x22, wire[6 + 7 + 12]);
        assertEquals(5, wire[wire.length - 3]);
    }

    @Test
    void keyLengthAbove255UsesBothBytes() {
        String longId = "k".repeat(300);
        byte[] wire = EnvelopeCodec.encode(sample(longId));

        assertEquals((byte) (300 & 0xFF), wire[4]);
        assertEquals((byte) (300 >> 8), wire[5]);
        assertEquals(longId, EnvelopeCodec.peekKeyId(wire));
    }

    @Test
    void decodeRestoresAllFields() {
        Envelope original = sample("r#e3");
        assertEquals(original, EnvelopeCodec.decode(EnvelopeCodec.encode(original)));
    }

    @Test
    void badMagicIsFormatError() {
        byte[] wire = EnvelopeCodec.encode(sample("r#e1"));
        wire[0] = 'X';
        assertThrows(EnvelopeFormatException.class, () -> EnvelopeCodec.decode(wire));
    }

    @Test
    void truncatedHeaderIsFormatError() {
        byte[] wire = EnvelopeCodec.encode(sample("r#e1"));
        assertThrows(EnvelopeFormatException.class, () -> EnvelopeCodec.decode(Arrays.copyOf(wire, 5)));
        assertThrows(EnvelopeFormatException.class, () -> EnvelopeCodec.decode(Arrays.copyOf(wire, 8)));
        assertThrows(EnvelopeFormatException.class, () -> EnvelopeCodec.decode(Arrays.copyOf(wire, 6 + 4 + 20)));
    }

    @Test
    void invalidUtf8KeyIdIsFormatError() {
        byte[] wire = EnvelopeCodec.encode(sample("ab"));
        wire[6] = (byte) 0xC3;
        wire[7] = (byte) 0x28;
        assertThrows(EnvelopeFormatException.class, () -> EnvelopeCodec.peekKeyId(wire));
    }

    @Test
    void envelopeRejectsWrongNonceLength() {
        assertThrows(IllegalArgumentException.class,
                () -> new Envelope("k", new byte[8], new byte[16], new byte[0]));
    }
}

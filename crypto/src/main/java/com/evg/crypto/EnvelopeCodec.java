package com.evg.crypto;

import com.evg.common.EnvelopeFormatException;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * Wire form of an {@link Envelope}:
 * <pre>
 * magic(4) = "EVG1" | key_id_len (u16, little-endian) | key_id (utf8) | nonce(12) | tag(16) | ciphertext(rest)
 * </pre>
 */
public final class EnvelopeCodec {
    static final byte[] MAGIC = {'E', 'V', 'G', '1'};
    private static final int MAX_KEY_ID_LEN = 0xFFFF;

    private EnvelopeCodec() {}

    public static byte[] encode(Envelope env) {
        Objects.requireNonNull(env, "envelope");
        byte[] keyId = env.getKeyId().getBytes(StandardCharsets.UTF_8);
        if (keyId.length > MAX_KEY_ID_LEN) {
            throw new IllegalArgumentException("key id longer than " + MAX_KEY_ID_LEN + " bytes");
        }
        byte[] ct = env.getCiphertext();
        ByteBuffer buf = ByteBuffer.allocate(MAGIC.length + 2 + keyId.length
                        + Envelope.NONCE_LEN + Envelope.TAG_LEN + ct.length)
                .order(ByteOrder.LITTLE_ENDIAN);
        buf.put(MAGIC);
        buf.putShort((short) keyId.length);
        buf.put(keyId);
        buf.put(env.getNonce());
        buf.put(env.getTag());
        buf.put(ct);
        return buf.array();
    }

    public static Envelope decode(byte[] bytes) {
        ByteBuffer buf = header(bytes);
        String keyId = readKeyId(buf);
        try {
            byte[] nonce = new byte[Envelope.NONCE_LEN];
            byte[] tag = new byte[Envelope.TAG_LEN];
            buf.get(nonce);
            buf.get(tag);
            byte[] ct = new byte[buf.remaining()];
            buf.get(ct);
            return new Envelope(keyId, nonce, tag, ct);
        } catch (BufferUnderflowException e) {
            throw new EnvelopeFormatException("Envelope truncated after key id", e);
        }
    }

    /** Reads only the key id, for routing a stored envelope to its key without decoding the body. */
    public static String peekKeyId(byte[] bytes) {
        return readKeyId(header(bytes));
    }

    private static ByteBuffer header(byte[] bytes) {
        if (bytes == null || bytes.length < MAGIC.length + 2) {
            throw new EnvelopeFormatException("Envelope too short");
        }
        if (!Arrays.equals(bytes, 0, MAGIC.length, MAGIC, 0, MAGIC.length)) {
            throw new EnvelopeFormatException("Bad envelope magic");
        }
        ByteBuffer buf = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
        buf.position(MAGIC.length);
        return buf;
    }

    private static String readKeyId(ByteBuffer buf) {
        int len = Short.toUnsignedInt(buf.getShort());
        if (buf.remaining() < len) {
            throw new EnvelopeFormatException("Envelope key id truncated: need " + len + " bytes");
        }
        byte[] raw = new byte[len];
        buf.get(raw);
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(raw))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new EnvelopeFormatException("Envelope key id is not valid UTF-8", e);
        }
    }
}

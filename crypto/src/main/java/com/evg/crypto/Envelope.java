package com.evg.crypto;

import java.util.Arrays;
import java.util.Objects;

/**
 * Authenticated ciphertext bound to a key id. Byte layout is owned by {@link EnvelopeCodec}.
 */
public final class Envelope {
    public static final int NONCE_LEN = 12;
    public static final int TAG_LEN = 16;

    private final String keyId;
    private final byte[] nonce;
    private final byte[] tag;
    private final byte[] ciphertext;

    public Envelope(String keyId, byte[] nonce, byte[] tag, byte[] ciphertext) {
        this.keyId = Objects.requireNonNull(keyId, "keyId");
        Objects.requireNonNull(nonce, "nonce");
        Objects.requireNonNull(tag, "tag");
        Objects.requireNonNull(ciphertext, "ciphertext");
        if (nonce.length != NONCE_LEN) throw new IllegalArgumentException("nonce must be " + NONCE_LEN + " bytes");
        if (tag.length != TAG_LEN) throw new IllegalArgumentException("tag must be " + TAG_LEN + " bytes");
        this.nonce = nonce.clone();
        this.tag = tag.clone();
        this.ciphertext = ciphertext.clone();
    }

    public String getKeyId() { return keyId; }
    public byte[] getNonce() { return nonce.clone(); }
    public byte[] getTag() { return tag.clone(); }
    public byte[] getCiphertext() { return ciphertext.clone(); }

    public int ciphertextLength() {
        return ciphertext.length;
    }

    /** Ciphertext followed by tag, the form the GCM cipher consumes. */
    byte[] sealedBody() {
        byte[] out = Arrays.copyOf(ciphertext, ciphertext.length + tag.length);
        System.arraycopy(tag, 0, out, ciphertext.length, tag.length);
        return out;
    }

    public byte[] toBytes() {
        return EnvelopeCodec.encode(this);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Envelope that)) return false;
        return keyId.equals(that.keyId)
                && Arrays.equals(nonce, that.nonce)
                && Arrays.equals(tag, that.tag)
                && Arrays.equals(ciphertext, that.ciphertext);
    }

    @Override
    public int hashCode() {
        int h = keyId.hashCode();
        h = 31 * h + Arrays.hashCode(nonce);
        h = 31 * h + Arrays.hashCode(tag);
        return 31 * h + Arrays.hashCode(ciphertext);
    }

    @Override
    public String toString() {
        return String.format("Envelope{key=%s, ctLen=%d}", keyId, ciphertext.length);
    }
}

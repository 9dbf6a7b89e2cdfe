package com.evg.crypto;

import com.evg.common.AadMismatchException;
import com.evg.common.DecryptException;
import com.evg.common.KeyHandle;
import com.evg.common.TagMismatchException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import javax.crypto.KeyGenerator;
import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.security.NoSuchAlgorithmException;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AesGcmEncryptionEngine Tests")
class AesGcmEncryptionEngineTest {

    private AesGcmEncryptionEngine engine;
    private KeyHandle handle;

    private static SecretKey aesKey() throws NoSuchAlgorithmException {
        KeyGenerator kg = KeyGenerator.getInstance("AES");
        kg.init(256);
        return kg.generateKey();
    }

    @BeforeEach
    void setUp() throws Exception {
        engine = new AesGcmEncryptionEngine();
        handle = new KeyHandle("repo-a#e1", "repo-a", 1, 0, 0, aesKey());
    }

    @Test
    @DisplayName("seal then open returns the plaintext")
    void roundTrip() {
        byte[] plain = "embedding batch payload".getBytes(StandardCharsets.UTF_8);

        Envelope env = engine.seal(plain, handle);
        Envelope decoded = EnvelopeCodec.decode(env.toBytes());

        assertArrayEquals(plain, engine.open(decoded, handle, "repo-a"));
        assertEquals(plain.length, env.ciphertextLength());
    }

    @Test
    void emptyPlaintextRoundTrips() {
        Envelope env = engine.seal(new byte[0], handle);
        assertArrayEquals(new byte[0], engine.open(env.toBytes(), handle, "repo-a"));
    }

    @Test
    void noncesAreFreshPerSeal() {
        byte[] plain = {1, 2, 3};
        Envelope a = engine.seal(plain, handle);
        Envelope b = engine.seal(plain, handle);
        assertFalse(java.util.Arrays.equals(a.getNonce(), b.getNonce()));
    }

    @Test
    @DisplayName("flipping the last byte fails with TagMismatch")
    void flipLastByteFails() {
        byte[] wire = engine.seal("tamper me".getBytes(StandardCharsets.UTF_8), handle).toBytes();
        wire[wire.length - 1] ^= 0x01;

        assertThrows(TagMismatchException.class, () -> engine.open(wire, handle, "repo-a"));
    }

    @Test
    @DisplayName("every single-byte mutation of tag or ciphertext fails with TagMismatch")
    void everyTagAndCiphertextByteIsAuthenticated() {
        byte[] wire = engine.seal("0123456789abcdef0123".getBytes(StandardCharsets.UTF_8), handle).toBytes();
        int tagStart = 4 + 2 + handle.getKeyId().getBytes(StandardCharsets.UTF_8).length + Envelope.NONCE_LEN;

        for (int i = tagStart; i < wire.length; i++) {
            byte[] mutated = wire.clone();
            mutated[i] ^= (byte) 0x80;
            int at = i;
            assertThrows(TagMismatchException.class, () -> engine.open(mutated, handle, "repo-a"),
                    "mutation at offset " + at + " was not detected");
        }
    }

    @Test
    void nonceMutationIsDetected() {
        byte[] wire = engine.seal(new byte[]{9, 9, 9}, handle).toBytes();
        int nonceStart = 4 + 2 + handle.getKeyId().length();
        wire[nonceStart] ^= 0x01;
        assertThrows(TagMismatchException.class, () -> engine.open(wire, handle, "repo-a"));
    }

    @Test
    @DisplayName("opening with a different repository fails with AadMismatch")
    void differentRepositoryFails() {
        Envelope env = engine.seal(new byte[]{1}, handle);

        AadMismatchException ex = assertThrows(AadMismatchException.class,
                () -> engine.open(env, handle, "repo-b"));
        assertEquals("repo-a#e1", ex.getKeyId());
        assertTrue(ex instanceof DecryptException);
    }

    @Test
    void handleForAnotherKeyIdFailsWithAadMismatch() throws Exception {
        Envelope env = engine.seal(new byte[]{1}, handle);
        KeyHandle other = new KeyHandle("repo-a#e2", "repo-a", 2, 0, 0, aesKey());

        assertThrows(AadMismatchException.class, () -> engine.open(env, other, "repo-a"));
    }

    @Test
    void wrongKeyMaterialWithSameIdFailsAsTagMismatch() throws Exception {
        Envelope env = engine.seal(new byte[]{1, 2}, handle);
        KeyHandle impostor = new KeyHandle("repo-a#e1", "repo-a", 1, 0, 0, aesKey());

        assertThrows(TagMismatchException.class, () -> engine.open(env, impostor, "repo-a"));
    }
}

package org.publicip.cache;

import org.junit.jupiter.api.Test;
import org.publicip.errors.CacheException;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class EncryptedCacheCodecTest {
    private static final byte[] PLAIN = "{\"current_address\":null}".getBytes(StandardCharsets.UTF_8);

    private final EncryptedCacheCodec codec = new EncryptedCacheCodec("passphrase", 1_000);

    @Test
    void decodesWhatItEncodes() throws CacheException {
        assertArrayEquals(PLAIN, codec.decode(codec.encode(PLAIN)));
    }

    @Test
    void usesFreshSaltAndNonce() throws CacheException {
        assertFalse(java.util.Arrays.equals(codec.encode(PLAIN), codec.encode(PLAIN)));
    }

    @Test
    void rejectsTamperedCiphertext() throws CacheException {
        var stored = codec.encode(PLAIN);
        stored[stored.length - 20] ^= 0x01;

        var error = assertThrows(CacheException.class, () -> codec.decode(stored));
        assertEquals(CacheException.Kind.ENCRYPTION, error.getKind());
    }

    @Test
    void rejectsTamperedHeader() throws CacheException {
        var stored = codec.encode(PLAIN);
        // First byte of the salt
        stored[9] ^= 0x01;

        var error = assertThrows(CacheException.class, () -> codec.decode(stored));
        assertEquals(CacheException.Kind.ENCRYPTION, error.getKind());
    }

    @Test
    void rejectsPlainContent() {
        var error = assertThrows(CacheException.class, () -> codec.decode(new byte[64]));
        assertEquals(CacheException.Kind.ENCRYPTION, error.getKind());
    }

    @Test
    void rejectsTruncatedContent() throws CacheException {
        var stored = codec.encode(PLAIN);
        var truncated = java.util.Arrays.copyOf(stored, 20);

        var error = assertThrows(CacheException.class, () -> codec.decode(truncated));
        assertEquals(CacheException.Kind.ENCRYPTION, error.getKind());
    }

    @Test
    void readsIterationCountFromEnvelope() throws CacheException {
        var stored = new EncryptedCacheCodec("passphrase", 2_000).encode(PLAIN);

        assertArrayEquals(PLAIN, codec.decode(stored));
    }

    @Test
    void rejectsEmptyPassphrase() {
        assertThrows(IllegalArgumentException.class, () -> new EncryptedCacheCodec(""));
    }

    @Test
    void rejectsOutOfRangeIterations() {
        assertThrows(IllegalArgumentException.class, () -> new EncryptedCacheCodec("passphrase", 0));
        assertThrows(IllegalArgumentException.class,
                () -> new EncryptedCacheCodec("passphrase", EncryptedCacheCodec.MAX_ITERATIONS + 1));
    }

    @Test
    void rejectsHugeIterationCountWithoutDerivingKey() {
        var stored = envelope(Integer.MAX_VALUE);

        var error = assertTimeoutPreemptively(Duration.ofSeconds(5),
                () -> assertThrows(CacheException.class, () -> codec.decode(stored)));
        assertEquals(CacheException.Kind.ENCRYPTION, error.getKind());
    }

    @Test
    void rejectsIterationCountJustAboveLimit() {
        var error = assertThrows(CacheException.class,
                () -> codec.decode(envelope(EncryptedCacheCodec.MAX_ITERATIONS + 1)));
        assertEquals(CacheException.Kind.ENCRYPTION, error.getKind());
    }

    /**
     * A well-formed envelope header with the given iteration count, zero salt and nonce, and 32 bytes of payload.
     */
    static byte[] envelope(int iterations) {
        return ByteBuffer.allocate(4 + 1 + 4 + 16 + 12 + 32)
                .put("PIPC".getBytes(StandardCharsets.US_ASCII))
                .put((byte) 1)
                .putInt(iterations)
                .array();
    }
}

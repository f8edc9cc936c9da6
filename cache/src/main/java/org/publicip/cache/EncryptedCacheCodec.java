package org.publicip.cache;

import org.bouncycastle.crypto.InvalidCipherTextException;
import org.bouncycastle.crypto.PBEParametersGenerator;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.generators.PKCS5S2ParametersGenerator;
import org.bouncycastle.crypto.modes.AEADCipher;
import org.bouncycastle.crypto.modes.ChaCha20Poly1305;
import org.bouncycastle.crypto.params.AEADParameters;
import org.bouncycastle.crypto.params.KeyParameter;
import org.jetbrains.annotations.NotNull;
import org.publicip.errors.CacheException;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Arrays;

/**
 * Wraps the cache document in an authenticated ChaCha20-Poly1305 envelope.
 * <p>
 * The key is derived from a passphrase with PBKDF2-HMAC-SHA256 and a random salt. Envelope layout:
 * <pre>
 * magic "PIPC" (4) | version (1) | iterations (4, big endian) | salt (16) | nonce (12) | ciphertext | tag (16)
 * </pre>
 * The header up to and including the nonce is authenticated as associated data.
 */
public final class EncryptedCacheCodec implements CacheCodec {
    public static final int DEFAULT_ITERATIONS = 100_000;
    /**
     * The largest iteration count accepted on either side. A header above it is treated as corrupted.
     */
    public static final int MAX_ITERATIONS = 10 * DEFAULT_ITERATIONS;

    private static final byte[] MAGIC = "PIPC".getBytes(StandardCharsets.US_ASCII);
    private static final byte VERSION = 1;
    private static final int SALT_LEN = 16;
    private static final int NONCE_LEN = 12;
    private static final int KEY_BITS = 256;
    private static final int TAG_BITS = 128;
    private static final int HEADER_LEN = MAGIC.length + 1 + Integer.BYTES + SALT_LEN + NONCE_LEN;
    private static final SecureRandom RANDOM = new SecureRandom();

    private final char[] _passphrase;
    private final int _iterations;

    public EncryptedCacheCodec(@NotNull String passphrase) {
        this(passphrase, DEFAULT_ITERATIONS);
    }

    public EncryptedCacheCodec(@NotNull String passphrase, int iterations) {
        if (passphrase.isEmpty()) {
            throw new IllegalArgumentException("Passphrase must not be empty");
        }
        if (iterations < 1 || iterations > MAX_ITERATIONS) {
            throw new IllegalArgumentException("Iterations must be between 1 and " + MAX_ITERATIONS);
        }
        _passphrase = passphrase.toCharArray();
        _iterations = iterations;
    }

    @Override
    public byte[] encode(byte[] plain) throws CacheException {
        var salt = new byte[SALT_LEN];
        var nonce = new byte[NONCE_LEN];
        RANDOM.nextBytes(salt);
        RANDOM.nextBytes(nonce);

        var header = ByteBuffer.allocate(HEADER_LEN)
                .put(MAGIC)
                .put(VERSION)
                .putInt(_iterations)
                .put(salt)
                .put(nonce)
                .array();

        var cipher = initCipher(true, deriveKey(salt, _iterations), nonce, header);
        var output = Arrays.copyOf(header, HEADER_LEN + cipher.getOutputSize(plain.length));
        try {
            var written = cipher.processBytes(plain, 0, plain.length, output, HEADER_LEN);
            written += cipher.doFinal(output, HEADER_LEN + written);
            return Arrays.copyOf(output, HEADER_LEN + written);
        } catch (InvalidCipherTextException | IllegalStateException e) {
            throw new CacheException(CacheException.Kind.ENCRYPTION, "Cannot encrypt the cache", e);
        }
    }

    @Override
    public byte[] decode(byte[] stored) throws CacheException {
        if (stored.length < HEADER_LEN + TAG_BITS / 8) {
            throw new CacheException(CacheException.Kind.ENCRYPTION, "The encrypted cache is truncated");
        }

        var buffer = ByteBuffer.wrap(stored);
        var magic = new byte[MAGIC.length];
        buffer.get(magic);
        if (!Arrays.equals(MAGIC, magic)) {
            throw new CacheException(CacheException.Kind.ENCRYPTION, "The cache is not encrypted");
        }

        var version = buffer.get();
        if (version != VERSION) {
            throw new CacheException(CacheException.Kind.ENCRYPTION, "Unsupported envelope version " + version);
        }

        var iterations = buffer.getInt();
        if (iterations < 1 || iterations > MAX_ITERATIONS) {
            throw new CacheException(CacheException.Kind.ENCRYPTION,
                    "Invalid key derivation parameters (iterations " + iterations + ")");
        }

        var salt = new byte[SALT_LEN];
        var nonce = new byte[NONCE_LEN];
        buffer.get(salt);
        buffer.get(nonce);

        var header = Arrays.copyOf(stored, HEADER_LEN);
        var cipher = initCipher(false, deriveKey(salt, iterations), nonce, header);
        var ciphertextLen = stored.length - HEADER_LEN;
        var output = new byte[cipher.getOutputSize(ciphertextLen)];
        try {
            var written = cipher.processBytes(stored, HEADER_LEN, ciphertextLen, output, 0);
            written += cipher.doFinal(output, written);
            return Arrays.copyOf(output, written);
        } catch (InvalidCipherTextException e) {
            throw new CacheException(CacheException.Kind.ENCRYPTION,
                    "Cannot decrypt the cache (wrong key or corrupted file)", e);
        } catch (IllegalStateException e) {
            throw new CacheException(CacheException.Kind.ENCRYPTION, "Cannot decrypt the cache", e);
        }
    }

    private KeyParameter deriveKey(byte[] salt, int iterations) {
        var generator = new PKCS5S2ParametersGenerator(new SHA256Digest());
        generator.init(PBEParametersGenerator.PKCS5PasswordToUTF8Bytes(_passphrase), salt, iterations);
        return (KeyParameter) generator.generateDerivedMacParameters(KEY_BITS);
    }

    private static AEADCipher initCipher(boolean forEncryption, KeyParameter key, byte[] nonce, byte[] header) {
        var cipher = new ChaCha20Poly1305();
        cipher.init(forEncryption, new AEADParameters(key, TAG_BITS, nonce, header));
        return cipher;
    }
}

package org.publicip.cache;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.publicip.Common;
import org.publicip.errors.CacheException;
import org.publicip.models.LookupProvider;
import org.publicip.models.LookupResponse;
import org.publicip.models.ProviderType;

import java.net.InetAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class ResponseCacheTest {
    private static final InetAddress CURRENT = Common.parseAddress("1.1.1.1");
    private static final InetAddress TARGET = Common.parseAddress("8.8.8.8");

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private CacheSettings settings;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T12:00:00.250Z"));
        settings = new CacheSettings(tempDir, "test.cache", PlainCacheCodec.INSTANCE, clock);
    }

    private static LookupResponse response(InetAddress ip) {
        return LookupResponse.builder(ip, LookupProvider.of(ProviderType.IP_WHO_IS))
                .country("Australia")
                .countryCode("AU")
                .latitude(-33.494)
                .longitude(143.2104)
                .asn("AS13335")
                .isProxy(false)
                .build();
    }

    @Test
    void emptyCacheIsExpired() {
        var cache = new ResponseCache(settings);

        assertTrue(cache.currentIsExpired());
        assertTrue(cache.targetIsExpired(TARGET));
        assertNull(cache.currentResponse());
        assertNull(cache.currentIp());
    }

    @Test
    void plainRoundTripKeepsEveryRecord() throws CacheException {
        var cache = new ResponseCache(settings);
        cache.updateCurrent(response(CURRENT), 60L);
        cache.updateTarget(TARGET, response(TARGET), null);
        cache.save();

        var loaded = ResponseCache.load(settings);

        assertEquals(cache, loaded);
        assertEquals(CURRENT, loaded.currentIp());
        assertEquals(response(TARGET), loaded.targetResponse(TARGET));
        assertEquals(Instant.parse("2024-05-01T12:00:00.250Z"), loaded.currentRecord().responseTime());
    }

    @Test
    void encryptedRoundTripKeepsEveryRecord() throws Exception {
        var encrypted = settings.withCodec(new EncryptedCacheCodec("machine-secret", 1_000));
        var cache = new ResponseCache(encrypted);
        cache.updateCurrent(response(CURRENT), 2L);
        cache.updateTarget(TARGET, response(TARGET), 5L);
        cache.save();

        var raw = Files.readString(encrypted.path(), StandardCharsets.ISO_8859_1);
        assertTrue(raw.startsWith("PIPC"));
        assertFalse(raw.contains("Australia"));

        assertEquals(cache, ResponseCache.load(encrypted));
    }

    @Test
    void plainFileIsReadableJson() throws Exception {
        var cache = new ResponseCache(settings);
        cache.updateTarget(TARGET, response(TARGET), 1L);
        cache.save();

        var text = Files.readString(settings.path());
        assertTrue(text.contains("\"current_address\":null"));
        assertTrue(text.contains("\"lookup_address\":{\"8.8.8.8\":"));
        assertTrue(text.contains("\"response_time\":" + Instant.parse("2024-05-01T12:00:00.250Z").toEpochMilli()));
    }

    @Test
    void wrongPassphraseFailsWithEncryptionError() throws CacheException {
        var cache = new ResponseCache(settings.withCodec(new EncryptedCacheCodec("right", 1_000)));
        cache.updateCurrent(response(CURRENT), null);
        cache.save();

        var error = assertThrows(CacheException.class,
                () -> ResponseCache.load(settings.withCodec(new EncryptedCacheCodec("wrong", 1_000))));
        assertEquals(CacheException.Kind.ENCRYPTION, error.getKind());
    }

    @Test
    void corruptedIterationCountFailsFast() throws Exception {
        var encrypted = settings.withCodec(new EncryptedCacheCodec("right", 1_000));
        Files.write(encrypted.path(), EncryptedCacheCodecTest.envelope(0x7FFFFFFF));

        var error = assertTimeoutPreemptively(Duration.ofSeconds(5),
                () -> assertThrows(CacheException.class, () -> ResponseCache.load(encrypted)));
        assertEquals(CacheException.Kind.ENCRYPTION, error.getKind());
    }

    @Test
    void hostNameInsteadOfAddressIsSerializationError() throws Exception {
        Files.writeString(settings.path(), """
                {"current_address": {"response": {"ip": "localhost", "provider": {"type": "ipwhois"}},
                 "response_time": 0, "ttl": null}, "lookup_address": {}}
                """);

        var error = assertThrows(CacheException.class, () -> ResponseCache.load(settings));
        assertEquals(CacheException.Kind.SERIALIZATION, error.getKind());
    }

    @Test
    void missingFileIsNotFound() {
        var error = assertThrows(CacheException.class, () -> ResponseCache.load(settings));
        assertEquals(CacheException.Kind.NOT_FOUND, error.getKind());
    }

    @Test
    void invalidUtf8IsReported() throws Exception {
        Files.write(settings.path(), new byte[]{'{', (byte) 0xC3, (byte) 0x28, '}'});

        var error = assertThrows(CacheException.class, () -> ResponseCache.load(settings));
        assertEquals(CacheException.Kind.UTF8, error.getKind());
    }

    @Test
    void malformedJsonIsSerializationError() throws Exception {
        Files.writeString(settings.path(), "{\"current_address\": [");

        var error = assertThrows(CacheException.class, () -> ResponseCache.load(settings));
        assertEquals(CacheException.Kind.SERIALIZATION, error.getKind());
    }

    @Test
    void fileNameOverrideIsUsedForLoadAndSave() throws CacheException {
        var other = new ResponseCache(settings.withFileName("other.cache"));
        other.updateCurrent(response(CURRENT), null);
        other.save();

        assertTrue(Files.exists(tempDir.resolve("other.cache")));
        assertFalse(Files.exists(settings.path()));
        assertEquals(CURRENT, ResponseCache.load(settings, "other.cache").currentIp());
    }

    @Test
    void saveCreatesMissingDirectory() throws CacheException {
        var nested = settings.withDirectory(tempDir.resolve("a").resolve("b"));
        var cache = new ResponseCache(nested);
        cache.updateCurrent(response(CURRENT), null);
        cache.save();

        assertTrue(Files.isRegularFile(nested.path()));
    }

    @Test
    void currentExpiresAfterTtl() {
        var cache = new ResponseCache(settings);
        cache.updateCurrent(response(CURRENT), 2L);

        assertFalse(cache.currentIsExpired());
        clock.advance(Duration.ofSeconds(2));
        assertTrue(cache.currentIsExpired());
        // Expired records stay readable
        assertEquals(CURRENT, cache.currentIp());
    }

    @Test
    void updateResetsTimestamp() {
        var cache = new ResponseCache(settings);
        cache.updateCurrent(response(CURRENT), 2L);
        clock.advance(Duration.ofSeconds(5));
        cache.updateCurrent(response(CURRENT), 2L);

        assertFalse(cache.currentIsExpired());
    }

    @Test
    void targetsAreIsolatedFromCurrent() {
        var cache = new ResponseCache(settings);
        cache.updateCurrent(response(CURRENT), 1L);
        clock.advance(Duration.ofSeconds(1));
        cache.updateTarget(TARGET, response(TARGET), 10L);

        assertTrue(cache.currentIsExpired());
        assertFalse(cache.targetIsExpired(TARGET));

        cache.clearTarget(TARGET);
        assertNull(cache.targetResponse(TARGET));
        assertEquals(CURRENT, cache.currentIp());

        cache.updateTarget(TARGET, response(TARGET), 10L);
        cache.clearCurrent();
        assertNull(cache.currentResponse());
        assertEquals(response(TARGET), cache.targetResponse(TARGET));
    }

    @Test
    void targetKeyIsCanonical() {
        var cache = new ResponseCache(settings);
        var longForm = Common.parseAddress("2001:0db8:0000:0000:0000:0000:0000:0001");
        cache.updateTarget(longForm, response(longForm), null);

        assertFalse(cache.targetIsExpired(Common.parseAddress("2001:db8::1")));
        assertTrue(cache.targetRecords().containsKey("2001:db8::1"));
    }

    @Test
    void clearDropsEverythingInMemoryOnly() throws CacheException {
        var cache = new ResponseCache(settings);
        cache.updateCurrent(response(CURRENT), null);
        cache.updateTarget(TARGET, response(TARGET), null);
        cache.save();

        cache.clear();
        assertTrue(cache.currentIsExpired());
        assertTrue(cache.targetRecords().isEmpty());
        assertEquals(CURRENT, ResponseCache.load(settings).currentIp());
    }

    @Test
    void deleteRemovesFile() throws CacheException {
        var cache = new ResponseCache(settings);
        cache.updateCurrent(response(CURRENT), null);
        cache.save();

        cache.delete();
        assertFalse(Files.exists(settings.path()));
        assertNull(cache.currentResponse());

        var error = assertThrows(CacheException.class, cache::delete);
        assertEquals(CacheException.Kind.NOT_FOUND, error.getKind());
    }

    @Test
    void saveLeavesNoTemporaryFiles() throws Exception {
        var cache = new ResponseCache(settings);
        cache.updateCurrent(response(CURRENT), null);
        cache.save();
        cache.save();

        try (var files = Files.list(tempDir)) {
            assertEquals(1, files.count());
        }
    }
}

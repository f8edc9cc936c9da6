package org.publicip.cache;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.publicip.Common;
import org.publicip.errors.CacheException;
import org.publicip.models.LookupResponse;

import java.io.IOException;
import java.net.InetAddress;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The persisted lookup results: one record for the caller's own address and one record per looked-up target.
 * Every record carries its own timestamp and TTL, so expiring or clearing one slot never affects another.
 * <p>
 * The cache is not thread-safe. Changes stay in memory until {@link #save()} is called.
 */
public final class ResponseCache {
    public static final String COMPONENT_NAME = "response-cache";
    private static final org.slf4j.Logger Logger = Common.getComponentLogger(ResponseCache.class);
    private static final ObjectMapper Mapper = Common.makeMapper().build();

    /**
     * The JSON document stored in the cache file.
     */
    record CacheDocument(
            @JsonProperty("current_address") @JsonInclude(JsonInclude.Include.ALWAYS)
            @Nullable ResponseRecord currentAddress,
            @JsonProperty("lookup_address") @Nullable LinkedHashMap<String, ResponseRecord> lookupAddress
    ) {
    }

    private final CacheSettings _settings;
    private ResponseRecord _currentAddress;
    private final LinkedHashMap<String, ResponseRecord> _lookupAddress;

    /**
     * Creates an empty cache that is saved according to the settings.
     */
    public ResponseCache(@NotNull CacheSettings settings) {
        _settings = Objects.requireNonNull(settings, "settings");
        _lookupAddress = new LinkedHashMap<>();
    }

    private ResponseCache(CacheSettings settings, CacheDocument document) {
        this(settings);
        _currentAddress = document.currentAddress();
        if (document.lookupAddress() != null) {
            document.lookupAddress().forEach((key, record) -> {
                if (key != null && record != null) {
                    _lookupAddress.put(key, record);
                }
            });
        }
    }

    /**
     * Loads the cache file.
     *
     * @param settings the cache settings
     * @param fileName the file name to use instead of the one in the settings, or null
     * @return the loaded cache, bound to the (possibly overridden) settings
     * @throws CacheException of kind {@link CacheException.Kind#NOT_FOUND} if there is no cache file yet,
     *                        otherwise of the kind of the failed step
     */
    public static ResponseCache load(@NotNull CacheSettings settings, @Nullable String fileName)
            throws CacheException {
        var effective = settings.withFileName(fileName);
        var path = effective.path();

        byte[] stored;
        try {
            stored = Files.readAllBytes(path);
        } catch (NoSuchFileException e) {
            throw new CacheException(CacheException.Kind.NOT_FOUND, "Cache file not found: " + path, e);
        } catch (IOException e) {
            throw new CacheException(CacheException.Kind.IO, "Cannot read the cache file " + path, e);
        }

        var json = decodeUtf8(effective.codec().decode(stored));
        try {
            var document = Mapper.readValue(json, CacheDocument.class);
            if (document == null) {
                throw new CacheException(CacheException.Kind.SERIALIZATION, "The cache file is empty");
            }
            Logger.debug("Loaded cache from {}", path);
            return new ResponseCache(effective, document);
        } catch (JsonProcessingException e) {
            throw new CacheException(CacheException.Kind.SERIALIZATION, "Cannot parse the cache file " + path, e);
        }
    }

    public static ResponseCache load(@NotNull CacheSettings settings) throws CacheException {
        return load(settings, null);
    }

    /**
     * Writes the cache to its file. The document is written to a temporary file in the same directory,
     * which then replaces the cache file. The directory is created if needed.
     *
     * @throws CacheException if the document cannot be serialized, encoded or written
     */
    public void save() throws CacheException {
        byte[] json;
        try {
            json = Mapper.writeValueAsBytes(toDocument());
        } catch (JsonProcessingException e) {
            throw new CacheException(CacheException.Kind.SERIALIZATION, "Cannot serialize the cache", e);
        }

        var encoded = _settings.codec().encode(json);
        var path = _settings.path();
        Path temp = null;
        try {
            Files.createDirectories(_settings.directory());
            temp = Files.createTempFile(_settings.directory(), "." + _settings.fileName(), ".tmp");
            Files.write(temp, encoded);
            try {
                Files.move(temp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
            }
            Logger.debug("Saved cache to {}", path);
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new CacheException(CacheException.Kind.IO, "Cannot write the cache file " + path, e);
        }
    }

    /**
     * Removes the cache file and empties this instance.
     *
     * @throws CacheException of kind {@link CacheException.Kind#NOT_FOUND} if the file does not exist
     */
    public void delete() throws CacheException {
        var path = _settings.path();
        try {
            Files.delete(path);
            Logger.debug("Deleted cache file {}", path);
        } catch (NoSuchFileException e) {
            throw new CacheException(CacheException.Kind.NOT_FOUND, "Cache file not found: " + path, e);
        } catch (IOException e) {
            throw new CacheException(CacheException.Kind.IO, "Cannot delete the cache file " + path, e);
        } finally {
            clear();
        }
    }

    /**
     * Drops every record in memory. The file is not touched until {@link #save()}.
     */
    public void clear() {
        _currentAddress = null;
        _lookupAddress.clear();
    }

    public void clearCurrent() {
        _currentAddress = null;
    }

    public void clearTarget(@NotNull InetAddress target) {
        _lookupAddress.remove(Common.canonicalAddress(target));
    }

    /**
     * Replaces the record of the caller's address, stamped with the current time.
     *
     * @param response the response
     * @param ttl      the time-to-live in seconds, or null if the record never expires
     */
    public void updateCurrent(@NotNull LookupResponse response, @Nullable Long ttl) {
        _currentAddress = ResponseRecord.now(response, ttl, _settings.clock());
    }

    /**
     * Replaces the record of a target address, stamped with the current time.
     *
     * @param target   the looked-up target
     * @param response the response
     * @param ttl      the time-to-live in seconds, or null if the record never expires
     */
    public void updateTarget(@NotNull InetAddress target, @NotNull LookupResponse response, @Nullable Long ttl) {
        _lookupAddress.put(Common.canonicalAddress(target), ResponseRecord.now(response, ttl, _settings.clock()));
    }

    /**
     * @return true if there is no record of the caller's address or its TTL has elapsed
     */
    public boolean currentIsExpired() {
        return _currentAddress == null || _currentAddress.isExpired(_settings.clock());
    }

    /**
     * @return true if there is no record of the target or its TTL has elapsed
     */
    public boolean targetIsExpired(@NotNull InetAddress target) {
        var record = _lookupAddress.get(Common.canonicalAddress(target));
        return record == null || record.isExpired(_settings.clock());
    }

    public @Nullable LookupResponse currentResponse() {
        return _currentAddress == null ? null : _currentAddress.response();
    }

    public @Nullable LookupResponse targetResponse(@NotNull InetAddress target) {
        var record = _lookupAddress.get(Common.canonicalAddress(target));
        return record == null ? null : record.response();
    }

    public @Nullable InetAddress currentIp() {
        return _currentAddress == null ? null : _currentAddress.ip();
    }

    public @Nullable ResponseRecord currentRecord() {
        return _currentAddress;
    }

    /**
     * @return a read-only view of the target records, keyed by the canonical address, in insertion order
     */
    public Map<String, ResponseRecord> targetRecords() {
        return Collections.unmodifiableMap(_lookupAddress);
    }

    public CacheSettings getSettings() {
        return _settings;
    }

    public Path path() {
        return _settings.path();
    }

    private CacheDocument toDocument() {
        return new CacheDocument(_currentAddress, new LinkedHashMap<>(_lookupAddress));
    }

    private static String decodeUtf8(byte[] bytes) throws CacheException {
        var decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            return decoder.decode(ByteBuffer.wrap(bytes)).toString();
        } catch (CharacterCodingException e) {
            throw new CacheException(CacheException.Kind.UTF8, "The cache file is not valid UTF-8", e);
        }
    }

    private static void deleteQuietly(@Nullable Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            Logger.warn("Cannot remove the temporary cache file {}: {}", temp, e.getMessage());
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ResponseCache that)) return false;
        return Objects.equals(_currentAddress, that._currentAddress)
                && _lookupAddress.equals(that._lookupAddress);
    }

    @Override
    public int hashCode() {
        return Objects.hash(_currentAddress, _lookupAddress);
    }

    @Override
    public String toString() {
        return "ResponseCache[current=" + _currentAddress + ", targets=" + _lookupAddress.keySet()
                + ", path=" + _settings.path() + "]";
    }
}

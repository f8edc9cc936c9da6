package org.publicip.cache;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.publicip.LookupConfig;
import org.publicip.errors.ConfigurationException;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Objects;
import java.util.Properties;

/**
 * Where and how the response cache is stored.
 *
 * @param directory The directory of the cache file.
 * @param fileName  The name of the cache file within the directory.
 * @param codec     The transformation applied to the serialized document.
 * @param clock     The clock used to stamp and expire records.
 */
public record CacheSettings(
        @NotNull Path directory,
        @NotNull String fileName,
        @NotNull CacheCodec codec,
        @NotNull Clock clock
) {
    public CacheSettings {
        Objects.requireNonNull(directory, "directory");
        Objects.requireNonNull(fileName, "fileName");
        Objects.requireNonNull(codec, "codec");
        Objects.requireNonNull(clock, "clock");
        if (!isPlainFileName(fileName)) {
            throw new IllegalArgumentException("Invalid cache file name: " + fileName);
        }
    }

    /**
     * Plaintext cache named {@value LookupConfig#CACHE_FILE_DEFAULT} in the resolved platform directory.
     */
    public static CacheSettings defaults() {
        return new CacheSettings(CacheLocation.system().resolveDirectory(), LookupConfig.CACHE_FILE_DEFAULT,
                PlainCacheCodec.INSTANCE, Clock.systemUTC());
    }

    /**
     * Creates the settings from the {@code cache.*} configuration keys.
     *
     * @param properties the configuration
     * @return the settings
     * @throws ConfigurationException if the directory or the file name is not a valid path
     */
    public static CacheSettings fromProperties(@NotNull Properties properties) throws ConfigurationException {
        var dirValue = properties.getProperty(LookupConfig.CACHE_DIR_CONFIG, LookupConfig.CACHE_DIR_DEFAULT).trim();
        var fileName = properties.getProperty(LookupConfig.CACHE_FILE_CONFIG, LookupConfig.CACHE_FILE_DEFAULT).trim();
        var encrypt = Boolean.parseBoolean(properties.getProperty(LookupConfig.CACHE_ENCRYPT_CONFIG,
                LookupConfig.CACHE_ENCRYPT_DEFAULT).trim());

        Path directory;
        try {
            directory = dirValue.isEmpty() ? CacheLocation.system().resolveDirectory() : Path.of(dirValue);
        } catch (InvalidPathException e) {
            throw new ConfigurationException(ConfigurationException.Kind.INVALID_VALUE,
                    "Invalid value of " + LookupConfig.CACHE_DIR_CONFIG + ": " + dirValue, e);
        }

        if (!isPlainFileName(fileName)) {
            throw new ConfigurationException(ConfigurationException.Kind.INVALID_VALUE,
                    "Invalid value of " + LookupConfig.CACHE_FILE_CONFIG + ": " + fileName);
        }

        CacheCodec codec = PlainCacheCodec.INSTANCE;
        if (encrypt) {
            var passphrase = properties.getProperty(LookupConfig.CACHE_PASSPHRASE_CONFIG,
                    LookupConfig.CACHE_PASSPHRASE_DEFAULT);
            codec = new EncryptedCacheCodec(passphrase.isEmpty() ? MachinePassphrase.resolve() : passphrase);
        }

        return new CacheSettings(directory, fileName, codec, Clock.systemUTC());
    }

    public Path path() {
        return directory.resolve(fileName);
    }

    public CacheSettings withFileName(@Nullable String fileName) {
        return fileName == null ? this : new CacheSettings(directory, fileName, codec, clock);
    }

    public CacheSettings withDirectory(@NotNull Path directory) {
        return new CacheSettings(directory, fileName, codec, clock);
    }

    public CacheSettings withCodec(@NotNull CacheCodec codec) {
        return new CacheSettings(directory, fileName, codec, clock);
    }

    public CacheSettings withClock(@NotNull Clock clock) {
        return new CacheSettings(directory, fileName, codec, clock);
    }

    private static boolean isPlainFileName(String fileName) {
        if (fileName.isBlank() || fileName.equals(".") || fileName.equals("..")) {
            return false;
        }

        try {
            var path = Path.of(fileName);
            return path.getNameCount() == 1 && path.getFileName().toString().equals(fileName);
        } catch (InvalidPathException e) {
            return false;
        }
    }
}

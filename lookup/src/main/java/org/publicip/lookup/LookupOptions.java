package org.publicip.lookup;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.publicip.LookupConfig;
import org.publicip.errors.ConfigurationException;
import org.publicip.models.ProviderEntry;

import java.time.Duration;
import java.util.List;
import java.util.Properties;

/**
 * The lookup part of the configuration.
 *
 * @param providers The fallback list, in order.
 * @param ttl       The time-to-live of cached responses in seconds, or null if they never expire.
 * @param timeout   The connect and request timeout.
 * @param blocking  Whether requests block the calling thread.
 */
public record LookupOptions(
        @NotNull List<ProviderEntry> providers,
        @Nullable Long ttl,
        @NotNull Duration timeout,
        boolean blocking
) {
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(Long.parseLong(LookupConfig.HTTP_TIMEOUT_DEFAULT));

    public LookupOptions {
        providers = List.copyOf(providers);
    }

    /**
     * Reads the {@code lookup.*} configuration keys.
     *
     * @param properties the configuration
     * @return the options
     * @throws ConfigurationException if a value is malformed
     */
    public static LookupOptions fromProperties(@NotNull Properties properties) throws ConfigurationException {
        var providers = ProviderRegistry.parseList(
                properties.getProperty(LookupConfig.PROVIDERS_CONFIG, LookupConfig.PROVIDERS_DEFAULT));
        var ttl = parseTtl(properties.getProperty(LookupConfig.TTL_CONFIG, LookupConfig.TTL_DEFAULT));

        var timeoutValue = properties.getProperty(LookupConfig.HTTP_TIMEOUT_CONFIG,
                LookupConfig.HTTP_TIMEOUT_DEFAULT).trim();
        Duration timeout;
        try {
            timeout = Duration.ofSeconds(Long.parseLong(timeoutValue));
        } catch (NumberFormatException e) {
            throw invalid(LookupConfig.HTTP_TIMEOUT_CONFIG, timeoutValue, e);
        }
        if (timeout.isNegative() || timeout.isZero()) {
            throw invalid(LookupConfig.HTTP_TIMEOUT_CONFIG, timeoutValue, null);
        }

        var blocking = Boolean.parseBoolean(properties.getProperty(LookupConfig.HTTP_BLOCKING_CONFIG,
                LookupConfig.HTTP_BLOCKING_DEFAULT).trim());

        return new LookupOptions(providers, ttl, timeout, blocking);
    }

    /**
     * Parses a TTL in seconds.
     *
     * @param value the value; empty means no expiry
     * @return the TTL, or null if the value is empty
     * @throws ConfigurationException if the value is not a non-negative number
     */
    public static @Nullable Long parseTtl(@NotNull String value) throws ConfigurationException {
        var trimmed = value.trim();
        if (trimmed.isEmpty()) {
            return null;
        }

        try {
            var ttl = Long.parseLong(trimmed);
            if (ttl < 0) {
                throw invalid(LookupConfig.TTL_CONFIG, trimmed, null);
            }
            return ttl;
        } catch (NumberFormatException e) {
            throw invalid(LookupConfig.TTL_CONFIG, trimmed, e);
        }
    }

    private static ConfigurationException invalid(String key, String value, @Nullable Throwable cause) {
        return new ConfigurationException(ConfigurationException.Kind.INVALID_VALUE,
                "Invalid value of " + key + ": " + value, cause);
    }
}

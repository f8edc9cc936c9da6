package org.publicip.lookup;

import org.jetbrains.annotations.NotNull;
import org.publicip.errors.ConfigurationException;
import org.publicip.lookup.providers.*;
import org.publicip.models.LookupProvider;
import org.publicip.models.Parameters;
import org.publicip.models.ProviderEntry;

import java.util.ArrayList;
import java.util.List;

/**
 * Creates provider implementations from their identifiers and parses textual provider lists.
 */
public final class ProviderRegistry {
    private ProviderRegistry() {
    }

    /**
     * Creates the implementation of a provider.
     *
     * @param provider the identifier
     * @return a new provider instance
     */
    public static Provider build(@NotNull LookupProvider provider) {
        return switch (provider.type()) {
            case ABSTRACT_API -> new AbstractApiProvider(provider);
            case FREE_IP_API -> new FreeIpApiProvider(provider);
            case GET_JSON_IP -> new GetJsonIpProvider(provider);
            case IF_CONFIG -> new IfConfigProvider(provider);
            case IP2LOCATION -> new Ip2LocationProvider(provider);
            case IP_API_CO -> new IpApiCoProvider(provider);
            case IP_API_COM -> new IpApiComProvider(provider);
            case IP_API_IO -> new IpApiIoProvider(provider);
            case IP_BASE -> new IpBaseProvider(provider);
            case IP_DATA -> new IpDataProvider(provider);
            case IP_GEOLOCATION -> new IpGeolocationProvider(provider);
            case IPIFY -> new IpifyProvider(provider);
            case IP_INFO -> new IpInfoProvider(provider);
            case IP_LEAK -> new IpLeakProvider(provider);
            case IP_LOCATE_IO -> new IpLocateIoProvider(provider);
            case IP_QUERY -> new IpQueryProvider(provider);
            case IP_WHO_IS -> new IpWhoIsProvider(provider);
            case MULLVAD -> new MullvadProvider(provider);
            case MY_IP -> new MyIpProvider(provider);
            case MY_IP_COM -> new MyIpComProvider(provider);
            case MOCK -> new MockProvider(provider);
        };
    }

    /**
     * Parses a provider entry in the form {@code "<name> [api key]"}. The whole text is trimmed and lower-cased
     * before it is split on whitespace, so the key is lower-cased too.
     *
     * @param text the entry
     * @return the provider and its credentials, if any
     * @throws ConfigurationException if the name is unknown or there are extra tokens
     */
    public static ProviderEntry parse(@NotNull String text) throws ConfigurationException {
        var normalized = text.trim().toLowerCase();
        if (normalized.isEmpty()) {
            throw new ConfigurationException(ConfigurationException.Kind.PROVIDER_NOT_FOUND,
                    "Provider not found: (empty)");
        }

        var tokens = normalized.split("\\s+");
        if (tokens.length > 2) {
            throw new ConfigurationException(ConfigurationException.Kind.INVALID_VALUE,
                    "Expected '<provider> [api key]', got: " + text.trim());
        }

        var provider = LookupProvider.fromString(tokens[0]);
        return tokens.length == 2
                ? new ProviderEntry(provider, new Parameters(tokens[1]))
                : ProviderEntry.of(provider);
    }

    /**
     * Parses a comma-separated list of provider entries. Empty items are skipped.
     *
     * @param text the list
     * @return the entries in the given order
     * @throws ConfigurationException if an entry is invalid
     */
    public static List<ProviderEntry> parseList(@NotNull String text) throws ConfigurationException {
        var result = new ArrayList<ProviderEntry>();
        for (var item : text.split(",")) {
            if (!item.isBlank()) {
                result.add(parse(item));
            }
        }
        return result;
    }
}

package org.publicip.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.publicip.errors.ConfigurationException;

import java.util.Objects;

/**
 * Identifies a lookup backend together with its provider-specific configuration.
 * <p>
 * The identifier is stored in every cached response, so its JSON form is part of the cache file format.
 *
 * @param type        The backend.
 * @param mockAddress The address a {@link ProviderType#MOCK} provider answers with; null for the other types.
 * @param endpoint    An optional base URL replacing the backend's default one (used to point providers at
 *                    a local test server).
 */
public record LookupProvider(
        @JsonProperty("type") @NotNull ProviderType type,
        @JsonProperty("mock_address") @Nullable String mockAddress,
        @JsonProperty("endpoint") @Nullable String endpoint
) {
    public LookupProvider {
        Objects.requireNonNull(type, "type");
        if (type == ProviderType.MOCK && mockAddress == null) {
            throw new IllegalArgumentException("A mock provider needs an address");
        }
    }

    public static LookupProvider of(@NotNull ProviderType type) {
        return new LookupProvider(type, null, null);
    }

    public static LookupProvider mock(@NotNull String address) {
        return new LookupProvider(ProviderType.MOCK, address, null);
    }

    public static LookupProvider mock(@NotNull String address, @Nullable String endpoint) {
        return new LookupProvider(ProviderType.MOCK, address, endpoint);
    }

    /**
     * Returns a copy of this identifier pointing at a different base URL.
     *
     * @param endpoint the base URL, or null to use the default one
     * @return the new identifier
     */
    public LookupProvider withEndpoint(@Nullable String endpoint) {
        return new LookupProvider(type, mockAddress, endpoint);
    }

    /**
     * Parses a provider name such as {@code "ipinfo"}. The mock provider cannot be created from text.
     *
     * @param name the name, matched case-insensitively after trimming
     * @return the identifier
     * @throws ConfigurationException if no such provider exists
     */
    public static LookupProvider fromString(@NotNull String name) throws ConfigurationException {
        var type = ProviderType.fromId(name);
        if (type == null || type == ProviderType.MOCK) {
            throw new ConfigurationException(ConfigurationException.Kind.PROVIDER_NOT_FOUND,
                    "Provider not found: " + name.trim().toLowerCase());
        }
        return of(type);
    }

    @JsonIgnore
    public boolean isMock() {
        return type == ProviderType.MOCK;
    }

    @Override
    public String toString() {
        if (type == ProviderType.MOCK) {
            return endpoint == null ? "mock(" + mockAddress + ")" : "mock(" + mockAddress + ", " + endpoint + ")";
        }
        return endpoint == null ? type.id() : type.id() + "(" + endpoint + ")";
    }
}

package org.publicip.models;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * One element of a fallback list: a provider and the credentials to use with it.
 *
 * @param provider   The provider identifier.
 * @param parameters The credentials, or null if the provider is used without them.
 */
public record ProviderEntry(
        @NotNull LookupProvider provider,
        @Nullable Parameters parameters
) {
    public ProviderEntry {
        Objects.requireNonNull(provider, "provider");
    }

    public static ProviderEntry of(@NotNull LookupProvider provider) {
        return new ProviderEntry(provider, null);
    }

    public static ProviderEntry of(@NotNull ProviderType type) {
        return new ProviderEntry(LookupProvider.of(type), null);
    }

    public static ProviderEntry of(@NotNull ProviderType type, @NotNull String apiKey) {
        return new ProviderEntry(LookupProvider.of(type), new Parameters(apiKey));
    }
}

package org.publicip.models;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Credentials attached to a provider at lookup time.
 *
 * @param apiKey The API key or token of the provider.
 */
public record Parameters(@NotNull String apiKey) {
    public Parameters {
        Objects.requireNonNull(apiKey, "apiKey");
    }

    @Override
    public String toString() {
        // Keys end up in log lines otherwise
        return "Parameters[apiKey=***]";
    }
}

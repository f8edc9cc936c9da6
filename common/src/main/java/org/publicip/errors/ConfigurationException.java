package org.publicip.errors;

import org.jetbrains.annotations.NotNull;

/**
 * Signals an invalid lookup configuration: an unknown provider name, an empty provider list or a malformed
 * configuration value.
 */
public class ConfigurationException extends PublicIpException {
    public enum Kind {
        PROVIDER_NOT_FOUND,
        NO_PROVIDERS,
        INVALID_VALUE
    }

    private final Kind _kind;

    public ConfigurationException(@NotNull Kind kind, String message) {
        super(message);
        _kind = kind;
    }

    public ConfigurationException(@NotNull Kind kind, String message, Throwable cause) {
        super(message, cause);
        _kind = kind;
    }

    public @NotNull Kind getKind() {
        return _kind;
    }
}

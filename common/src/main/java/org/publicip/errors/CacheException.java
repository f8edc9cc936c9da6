package org.publicip.errors;

import org.jetbrains.annotations.NotNull;

/**
 * A failure to read, write or decode the response cache file.
 */
public class CacheException extends PublicIpException {
    public enum Kind {
        /** The cache file does not exist yet. */
        NOT_FOUND,
        /** Reading, writing or deleting the file failed. */
        IO,
        /** The JSON document could not be written or read. */
        SERIALIZATION,
        /** The encrypted envelope could not be created or opened. */
        ENCRYPTION,
        /** The decoded content is not valid UTF-8. */
        UTF8
    }

    private final Kind _kind;

    public CacheException(@NotNull Kind kind, String message) {
        super(message);
        _kind = kind;
    }

    public CacheException(@NotNull Kind kind, String message, Throwable cause) {
        super(message, cause);
        _kind = kind;
    }

    public @NotNull Kind getKind() {
        return _kind;
    }
}

package org.publicip.errors;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.publicip.models.LookupProvider;

/**
 * A failure of a single provider lookup. The exception carries the provider it is attributed to and, for
 * unexpected HTTP responses, the status code.
 */
public class LookupException extends PublicIpException {
    public enum Kind {
        /** Connection, DNS, TLS or timeout failure. */
        TRANSPORT,
        /** HTTP 429. */
        TOO_MANY_REQUESTS,
        /** Any other non-200 HTTP status. */
        REQUEST_STATUS,
        /** The reply could not be mapped onto a response. */
        PARSE,
        /** A target address was given to a provider that can only look up the caller's address. */
        TARGET_NOT_SUPPORTED,
        /** The request could not be built, usually because of a malformed endpoint override. */
        INVALID_REQUEST
    }

    private final Kind _kind;
    private final LookupProvider _provider;
    private final int _statusCode;

    public LookupException(@NotNull Kind kind, @Nullable LookupProvider provider, String message) {
        this(kind, provider, message, 0, null);
    }

    public LookupException(@NotNull Kind kind, @Nullable LookupProvider provider, String message,
                           @Nullable Throwable cause) {
        this(kind, provider, message, 0, cause);
    }

    private LookupException(@NotNull Kind kind, @Nullable LookupProvider provider, String message, int statusCode,
                            @Nullable Throwable cause) {
        super(provider == null ? message : provider + ": " + message, cause);
        _kind = kind;
        _provider = provider;
        _statusCode = statusCode;
    }

    public static LookupException status(@Nullable LookupProvider provider, int statusCode) {
        if (statusCode == 429) {
            return new LookupException(Kind.TOO_MANY_REQUESTS, provider, "Too many requests: " + statusCode,
                    statusCode, null);
        }
        return new LookupException(Kind.REQUEST_STATUS, provider, "Status: " + statusCode, statusCode, null);
    }

    public static LookupException parse(@Nullable LookupProvider provider, String message,
                                        @Nullable Throwable cause) {
        return new LookupException(Kind.PARSE, provider, message, 0, cause);
    }

    /**
     * Attributes the failure to a provider, keeping everything else.
     *
     * @param provider the provider
     * @return this exception if it is already attributed, otherwise a copy attributed to the provider
     */
    public LookupException attributedTo(@NotNull LookupProvider provider) {
        if (_provider != null) {
            return this;
        }
        var copy = new LookupException(_kind, provider, getMessage(), _statusCode, getCause());
        copy.setStackTrace(getStackTrace());
        return copy;
    }

    public @NotNull Kind getKind() {
        return _kind;
    }

    public @Nullable LookupProvider getProvider() {
        return _provider;
    }

    /**
     * @return the HTTP status code for {@link Kind#TOO_MANY_REQUESTS} and {@link Kind#REQUEST_STATUS}, otherwise 0
     */
    public int getStatusCode() {
        return _statusCode;
    }
}

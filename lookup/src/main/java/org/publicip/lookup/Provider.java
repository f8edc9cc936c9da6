package org.publicip.lookup;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.publicip.errors.LookupException;
import org.publicip.models.LookupProvider;
import org.publicip.models.LookupResponse;
import org.publicip.models.Parameters;

import java.net.InetAddress;
import java.net.http.HttpRequest;

/**
 * A lookup backend. Implementations only know how to build the request URL and how to read the reply;
 * the request itself is issued by {@link LookupService}.
 */
public interface Provider {
    /**
     * Builds the URL of the lookup request.
     *
     * @param parameters the credentials, or null
     * @param target     the address to look up, or null to look up the caller's own address
     * @return the absolute URL
     */
    @NotNull
    String endpoint(@Nullable Parameters parameters, @Nullable InetAddress target);

    /**
     * Adds provider-specific headers (credentials, user agent) to the request.
     *
     * @param request    the request being built
     * @param parameters the credentials, or null
     * @return the request builder
     */
    default HttpRequest.Builder authenticate(@NotNull HttpRequest.Builder request, @Nullable Parameters parameters) {
        return request;
    }

    /**
     * Maps the body of a successful reply onto a response.
     *
     * @param body the reply body
     * @return the response
     * @throws LookupException of kind {@link LookupException.Kind#PARSE} if the body cannot be mapped
     */
    @NotNull
    LookupResponse parse(@NotNull String body) throws LookupException;

    @NotNull
    LookupProvider identity();

    /**
     * @return true if the provider can look up an arbitrary address, not only the caller's one
     */
    default boolean supportsTargetLookup() {
        return false;
    }

    /**
     * @return true if the provider answers without a network request
     */
    default boolean isOffline() {
        return false;
    }
}

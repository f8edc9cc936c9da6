package org.publicip.lookup;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.publicip.Common;
import org.publicip.errors.LookupException;
import org.publicip.errors.PublicIpException;
import org.publicip.lookup.http.HttpTransport;
import org.publicip.models.LookupProvider;
import org.publicip.models.LookupResponse;
import org.publicip.models.Parameters;

import java.io.IOException;
import java.net.InetAddress;
import java.net.URI;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Performs lookups with a single provider: one request per lookup, no retries.
 * <p>
 * The reply status is mapped uniformly for every provider: 200 is parsed by the provider, 429 fails with
 * {@link LookupException.Kind#TOO_MANY_REQUESTS}, any other status with {@link LookupException.Kind#REQUEST_STATUS}.
 */
public class LookupService {
    public static final String COMPONENT_NAME = "lookup-service";
    private static final org.slf4j.Logger Logger = Common.getComponentLogger(LookupService.class);

    private final Provider _provider;
    private final Parameters _parameters;
    private final HttpTransport _transport;
    private final Duration _requestTimeout;

    /**
     * Creates a service with its own asynchronous transport and the default timeout.
     */
    public LookupService(@NotNull LookupProvider provider, @Nullable Parameters parameters) {
        this(ProviderRegistry.build(provider), parameters,
                HttpTransport.create(LookupOptions.DEFAULT_TIMEOUT, false), LookupOptions.DEFAULT_TIMEOUT);
    }

    public LookupService(@NotNull Provider provider, @Nullable Parameters parameters,
                         @NotNull HttpTransport transport, @NotNull Duration requestTimeout) {
        _provider = provider;
        _parameters = parameters;
        _transport = transport;
        _requestTimeout = requestTimeout;
    }

    public @NotNull Provider getProvider() {
        return _provider;
    }

    /**
     * Looks up an address.
     *
     * @param target the address to look up, or null for the caller's public address
     * @return a future completed with the response or failed with a {@link LookupException}
     */
    public CompletableFuture<LookupResponse> lookup(@Nullable InetAddress target) {
        var identity = _provider.identity();
        if (target != null && !_provider.supportsTargetLookup()) {
            return CompletableFuture.failedFuture(new LookupException(LookupException.Kind.TARGET_NOT_SUPPORTED,
                    identity, "Looking up a target address is not supported"));
        }

        if (_provider.isOffline()) {
            return parse("");
        }

        var endpoint = _provider.endpoint(_parameters, target);
        HttpRequest request;
        try {
            var builder = HttpRequest.newBuilder()
                    .uri(URI.create(endpoint))
                    .timeout(_requestTimeout)
                    .header("Accept", "application/json")
                    .GET();
            request = _provider.authenticate(builder, _parameters).build();
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(new LookupException(LookupException.Kind.INVALID_REQUEST, identity,
                    "Invalid endpoint '" + endpoint + "': " + e.getMessage(), e));
        }

        Logger.debug("Looking up {} with {}", target == null ? "the public address" : target.getHostAddress(),
                identity);
        return _transport.send(request)
                .exceptionallyCompose(error ->
                        CompletableFuture.<HttpResponse<String>>failedFuture(transportError(Common.unwrap(error))))
                .thenCompose(this::handleResponse);
    }

    /**
     * Looks up several target addresses one after another.
     *
     * @param targets the addresses
     * @return a future completed with the responses in the order of the targets, or failed with the first failure
     */
    public CompletableFuture<List<LookupResponse>> lookupBulk(@NotNull List<InetAddress> targets) {
        CompletableFuture<List<LookupResponse>> result = CompletableFuture.completedFuture(new ArrayList<>());
        for (var target : targets) {
            result = result.thenCompose(responses -> lookup(target).thenApply(response -> {
                responses.add(response);
                return responses;
            }));
        }
        return result.thenApply(List::copyOf);
    }

    /**
     * Looks up an address and waits for the result.
     *
     * @param target the address to look up, or null for the caller's public address
     * @return the response
     * @throws LookupException if the lookup fails
     */
    public LookupResponse lookupBlocking(@Nullable InetAddress target) throws LookupException {
        try {
            return Common.await(lookup(target));
        } catch (LookupException e) {
            throw e;
        } catch (PublicIpException e) {
            throw new LookupException(LookupException.Kind.TRANSPORT, _provider.identity(), e.getMessage(), e);
        }
    }

    private CompletableFuture<LookupResponse> handleResponse(HttpResponse<String> response) {
        var status = response.statusCode();
        if (status != 200) {
            Logger.debug("{} replied with status {}", _provider.identity(), status);
            return CompletableFuture.failedFuture(LookupException.status(_provider.identity(), status));
        }
        return parse(response.body() == null ? "" : response.body());
    }

    private CompletableFuture<LookupResponse> parse(String body) {
        try {
            return CompletableFuture.completedFuture(_provider.parse(body));
        } catch (LookupException e) {
            return CompletableFuture.failedFuture(e.attributedTo(_provider.identity()));
        }
    }

    private LookupException transportError(Throwable cause) {
        var identity = _provider.identity();
        if (cause instanceof LookupException lookupException) {
            return lookupException.attributedTo(identity);
        }

        String message;
        if (cause instanceof HttpConnectTimeoutException) {
            message = "Connection timed out (%d ms)".formatted(_requestTimeout.toMillis());
        } else if (cause instanceof HttpTimeoutException) {
            message = "Request timed out (%d ms)".formatted(_requestTimeout.toMillis());
        } else if (cause instanceof IOException) {
            message = "I/O error: " + cause.getMessage();
        } else if (cause instanceof InterruptedException) {
            message = "Interrupted";
        } else {
            Logger.warn("Unexpected transport error", cause);
            message = "Unexpected error: " + cause.getMessage();
        }
        return new LookupException(LookupException.Kind.TRANSPORT, identity, message, cause);
    }
}

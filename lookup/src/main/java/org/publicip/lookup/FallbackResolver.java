package org.publicip.lookup;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.publicip.Common;
import org.publicip.errors.AllProvidersFailedException;
import org.publicip.errors.ConfigurationException;
import org.publicip.errors.LookupException;
import org.publicip.lookup.http.HttpTransport;
import org.publicip.models.LookupResponse;
import org.publicip.models.ProviderEntry;

import java.net.InetAddress;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Tries the providers of a list one at a time, in order, until one of them succeeds.
 * <p>
 * A provider is only asked once the previous one has failed. When every provider fails, the result fails with
 * an {@link AllProvidersFailedException} carrying each failure in the order the providers were tried.
 */
public class FallbackResolver {
    public static final String COMPONENT_NAME = "fallback-resolver";
    private static final org.slf4j.Logger Logger = Common.getComponentLogger(FallbackResolver.class);

    private final HttpTransport _transport;
    private final Duration _requestTimeout;

    public FallbackResolver() {
        this(HttpTransport.create(LookupOptions.DEFAULT_TIMEOUT, false), LookupOptions.DEFAULT_TIMEOUT);
    }

    public FallbackResolver(@NotNull HttpTransport transport, @NotNull Duration requestTimeout) {
        _transport = transport;
        _requestTimeout = requestTimeout;
    }

    public static FallbackResolver fromOptions(@NotNull LookupOptions options) {
        return new FallbackResolver(HttpTransport.create(options.timeout(), options.blocking()), options.timeout());
    }

    /**
     * Looks up an address with the first provider that succeeds.
     *
     * @param providers the providers to try, in order
     * @param target    the address to look up, or null for the caller's public address
     * @return a future completed with the first successful response; failed with a {@link ConfigurationException}
     * if the list is empty, or with an {@link AllProvidersFailedException} if every provider failed
     */
    public CompletableFuture<LookupResponse> lookupWithFallback(@NotNull List<ProviderEntry> providers,
                                                                @Nullable InetAddress target) {
        if (providers.isEmpty()) {
            return CompletableFuture.failedFuture(new ConfigurationException(
                    ConfigurationException.Kind.NO_PROVIDERS, "No providers to look up with"));
        }
        return attempt(List.copyOf(providers), 0, target, new ArrayList<>());
    }

    private CompletableFuture<LookupResponse> attempt(List<ProviderEntry> providers, int index,
                                                      @Nullable InetAddress target,
                                                      List<LookupException> failures) {
        if (index == providers.size()) {
            return CompletableFuture.failedFuture(new AllProvidersFailedException(failures));
        }

        var entry = providers.get(index);
        var service = new LookupService(ProviderRegistry.build(entry.provider()), entry.parameters(),
                _transport, _requestTimeout);

        return service.lookup(target)
                .handle((response, error) -> {
                    if (error == null) {
                        Logger.debug("Lookup succeeded with {}", entry.provider());
                        return CompletableFuture.completedFuture(response);
                    }

                    var failure = toLookupException(entry, Common.unwrap(error));
                    Logger.debug("Lookup with {} failed: {}", entry.provider(), failure.getMessage());
                    failures.add(failure);
                    return attempt(providers, index + 1, target, failures);
                })
                .thenCompose(next -> next);
    }

    private static LookupException toLookupException(ProviderEntry entry, Throwable error) {
        if (error instanceof LookupException lookupException) {
            return lookupException.attributedTo(entry.provider());
        }
        return new LookupException(LookupException.Kind.TRANSPORT, entry.provider(),
                "Unexpected error: " + error.getMessage(), error);
    }
}

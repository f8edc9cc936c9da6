package org.publicip.lookup;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.publicip.Common;
import org.publicip.cache.CacheSettings;
import org.publicip.cache.ResponseCache;
import org.publicip.errors.CacheException;
import org.publicip.errors.PublicIpException;
import org.publicip.models.LookupResponse;
import org.publicip.models.ProviderEntry;
import org.publicip.models.ProviderType;

import java.net.InetAddress;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * The main entry point: answers from the response cache while its record is valid, otherwise looks the address up
 * with the fallback list and stores the fresh response.
 * <p>
 * An unreadable cache is treated as an empty one. A failure to save the fresh response fails the lookup.
 * A failed lookup leaves the cache file untouched.
 */
public class CachedLookup {
    public static final String COMPONENT_NAME = "cached-lookup";
    private static final org.slf4j.Logger Logger = Common.getComponentLogger(CachedLookup.class);

    /**
     * The TTL of {@link #performLookup(InetAddress)}, in seconds.
     */
    public static final long DEFAULT_TTL = 2;

    public static final List<ProviderEntry> DEFAULT_PROVIDERS = List.of(
            ProviderEntry.of(ProviderType.IF_CONFIG),
            ProviderEntry.of(ProviderType.IP_INFO),
            ProviderEntry.of(ProviderType.IP_WHO_IS),
            ProviderEntry.of(ProviderType.IP_API_COM),
            ProviderEntry.of(ProviderType.FREE_IP_API));

    private final CacheSettings _settings;
    private final FallbackResolver _resolver;

    public CachedLookup() {
        this(CacheSettings.defaults(), new FallbackResolver());
    }

    public CachedLookup(@NotNull CacheSettings settings, @NotNull FallbackResolver resolver) {
        _settings = settings;
        _resolver = resolver;
    }

    /**
     * Looks up an address with the default providers and TTL.
     *
     * @param target the address to look up, or null for the caller's public address
     * @return the future response
     */
    public CompletableFuture<LookupResponse> performLookup(@Nullable InetAddress target) {
        return performCachedLookup(DEFAULT_PROVIDERS, target, DEFAULT_TTL, false);
    }

    /**
     * Looks up an address, using the cached response if it is still valid.
     *
     * @param providers  the providers to try, in order
     * @param target     the address to look up, or null for the caller's public address
     * @param ttl        the TTL of the fresh response in seconds, or null if it never expires
     * @param forceFlush if true, the cached response is ignored
     * @return a future completed with the response, or failed with the lookup or cache save failure
     */
    public CompletableFuture<LookupResponse> performCachedLookup(@NotNull List<ProviderEntry> providers,
                                                                 @Nullable InetAddress target,
                                                                 @Nullable Long ttl,
                                                                 boolean forceFlush) {
        var cache = loadCache();

        if (!forceFlush) {
            var cached = cachedResponse(cache, target);
            if (cached != null) {
                Logger.debug("Using cached response for {}", describe(target));
                return CompletableFuture.completedFuture(cached);
            }
        }

        Logger.debug("Cache {} for {}, looking up", forceFlush ? "flushed" : "miss", describe(target));
        return _resolver.lookupWithFallback(providers, target)
                .thenCompose(response -> {
                    if (target == null) {
                        cache.updateCurrent(response, ttl);
                    } else {
                        cache.updateTarget(target, response, ttl);
                    }

                    try {
                        cache.save();
                        return CompletableFuture.completedFuture(response);
                    } catch (CacheException e) {
                        Logger.debug("Cannot save the cache: {}", e.getMessage());
                        return CompletableFuture.<LookupResponse>failedFuture(e);
                    }
                });
    }

    public LookupResponse performLookupBlocking(@Nullable InetAddress target) throws PublicIpException {
        return Common.await(performLookup(target));
    }

    public LookupResponse performCachedLookupBlocking(@NotNull List<ProviderEntry> providers,
                                                      @Nullable InetAddress target,
                                                      @Nullable Long ttl,
                                                      boolean forceFlush) throws PublicIpException {
        return Common.await(performCachedLookup(providers, target, ttl, forceFlush));
    }

    public CacheSettings getSettings() {
        return _settings;
    }

    private ResponseCache loadCache() {
        try {
            return ResponseCache.load(_settings);
        } catch (CacheException e) {
            if (e.getKind() == CacheException.Kind.NOT_FOUND) {
                Logger.debug("No cache file at {}", _settings.path());
            } else {
                Logger.debug("Ignoring unreadable cache file {}: {}", _settings.path(), e.getMessage());
            }
            return new ResponseCache(_settings);
        }
    }

    private static @Nullable LookupResponse cachedResponse(ResponseCache cache, @Nullable InetAddress target) {
        if (target == null) {
            return cache.currentIsExpired() ? null : cache.currentResponse();
        }
        return cache.targetIsExpired(target) ? null : cache.targetResponse(target);
    }

    private static String describe(@Nullable InetAddress target) {
        return target == null ? "the public address" : Common.canonicalAddress(target);
    }
}

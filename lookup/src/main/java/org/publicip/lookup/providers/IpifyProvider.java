package org.publicip.lookup.providers;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.json.JSONObject;
import org.publicip.errors.LookupException;
import org.publicip.lookup.JsonProvider;
import org.publicip.models.LookupProvider;
import org.publicip.models.LookupResponse;
import org.publicip.models.Parameters;

import java.net.InetAddress;

/**
 * <a href="https://www.ipify.org">ipify.org</a>. Reports the caller's address only, over IPv4 or IPv6.
 */
public class IpifyProvider extends JsonProvider {
    private static final String BASE_URL = "https://api64.ipify.org";

    public IpifyProvider(@NotNull LookupProvider identity) {
        super(identity, BASE_URL);
    }

    @Override
    public @NotNull String endpoint(@Nullable Parameters parameters, @Nullable InetAddress target) {
        return withQuery(baseUrl() + "/", "format", "json");
    }

    @Override
    protected LookupResponse map(@NotNull JSONObject json) throws LookupException {
        return builder(requireAddress(json, "ip")).build();
    }
}

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
 * <a href="https://getjsonip.com">getjsonip.com</a>. Reports the caller's IPv4 address only.
 */
public class GetJsonIpProvider extends JsonProvider {
    private static final String BASE_URL = "https://ipv4.jsonip.com";

    public GetJsonIpProvider(@NotNull LookupProvider identity) {
        super(identity, BASE_URL);
    }

    @Override
    public @NotNull String endpoint(@Nullable Parameters parameters, @Nullable InetAddress target) {
        return baseUrl();
    }

    @Override
    protected LookupResponse map(@NotNull JSONObject json) throws LookupException {
        return builder(requireAddress(json, "ip")).build();
    }
}

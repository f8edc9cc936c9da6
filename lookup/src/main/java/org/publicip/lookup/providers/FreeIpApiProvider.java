package org.publicip.lookup.providers;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.json.JSONObject;
import org.publicip.Common;
import org.publicip.errors.LookupException;
import org.publicip.lookup.JsonProvider;
import org.publicip.models.LookupProvider;
import org.publicip.models.LookupResponse;
import org.publicip.models.Parameters;

import java.net.InetAddress;
import java.net.http.HttpRequest;

/**
 * <a href="https://docs.freeipapi.com/response.html">freeipapi.com</a>. An optional API key is sent as a bearer token.
 */
public class FreeIpApiProvider extends JsonProvider {
    private static final String BASE_URL = "https://freeipapi.com/api/json";

    public FreeIpApiProvider(@NotNull LookupProvider identity) {
        super(identity, BASE_URL);
    }

    @Override
    public @NotNull String endpoint(@Nullable Parameters parameters, @Nullable InetAddress target) {
        return baseUrl() + "/" + (target == null ? "" : Common.canonicalAddress(target));
    }

    @Override
    public HttpRequest.Builder authenticate(@NotNull HttpRequest.Builder request, @Nullable Parameters parameters) {
        var key = apiKey(parameters);
        return key == null ? request : request.header("Authorization", "Bearer " + key);
    }

    @Override
    public boolean supportsTargetLookup() {
        return true;
    }

    @Override
    protected LookupResponse map(@NotNull JSONObject json) throws LookupException {
        return builder(requireAddress(json, "ipAddress"))
                .continent(string(json, "continent"))
                .country(string(json, "countryName"))
                .countryCode(string(json, "countryCode"))
                .region(string(json, "regionName"))
                .postalCode(string(json, "zipCode"))
                .city(string(json, "cityName"))
                .latitude(number(json, "latitude"))
                .longitude(number(json, "longitude"))
                .timeZone(string(json, "timeZone"))
                .isProxy(bool(json, "isProxy"))
                .build();
    }
}

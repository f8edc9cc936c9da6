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
 * <a href="https://ipapi.co/api/">ipapi.co</a>. The service rejects requests without a user agent.
 */
public class IpApiCoProvider extends JsonProvider {
    private static final String BASE_URL = "https://ipapi.co";
    static final String USER_AGENT = "public-ip-address";

    public IpApiCoProvider(@NotNull LookupProvider identity) {
        super(identity, BASE_URL);
    }

    @Override
    public @NotNull String endpoint(@Nullable Parameters parameters, @Nullable InetAddress target) {
        return baseUrl() + "/" + (target == null ? "" : Common.canonicalAddress(target) + "/") + "json";
    }

    @Override
    public HttpRequest.Builder authenticate(@NotNull HttpRequest.Builder request, @Nullable Parameters parameters) {
        return request.header("User-Agent", USER_AGENT);
    }

    @Override
    public boolean supportsTargetLookup() {
        return true;
    }

    @Override
    protected LookupResponse map(@NotNull JSONObject json) throws LookupException {
        if (Boolean.TRUE.equals(bool(json, "error"))) {
            throw LookupException.parse(identity(), "Lookup failed: " + string(json, "reason"), null);
        }

        return builder(requireAddress(json, "ip"))
                .country(string(json, "country_name"))
                .countryCode(string(json, "country_code"))
                .region(string(json, "region"))
                .regionCode(string(json, "region_code"))
                .postalCode(string(json, "postal"))
                .city(string(json, "city"))
                .latitude(number(json, "latitude"))
                .longitude(number(json, "longitude"))
                .timeZone(string(json, "timezone"))
                .asn(string(json, "asn"))
                .asnOrg(string(json, "org"))
                .hostname(string(json, "hostname"))
                .build();
    }
}

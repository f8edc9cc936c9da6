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

/**
 * <a href="https://ip-api.com/docs/api:json">ip-api.com</a>. The free tier is served over plain HTTP only.
 */
public class IpApiComProvider extends JsonProvider {
    private static final String BASE_URL = "http://ip-api.com";
    // All documented fields, including "reverse" and "proxy"
    private static final String FIELDS = "66846719";

    public IpApiComProvider(@NotNull LookupProvider identity) {
        super(identity, BASE_URL);
    }

    @Override
    public @NotNull String endpoint(@Nullable Parameters parameters, @Nullable InetAddress target) {
        var url = baseUrl() + "/json/" + (target == null ? "" : Common.canonicalAddress(target));
        return withQuery(url, "fields", FIELDS);
    }

    @Override
    public boolean supportsTargetLookup() {
        return true;
    }

    @Override
    protected LookupResponse map(@NotNull JSONObject json) throws LookupException {
        requireSuccess(json, "status");

        return builder(requireAddress(json, "query"))
                .continent(string(json, "continent"))
                .country(string(json, "country"))
                .countryCode(string(json, "countryCode"))
                .region(string(json, "regionName"))
                .regionCode(string(json, "region"))
                .postalCode(string(json, "zip"))
                .city(string(json, "city"))
                .latitude(number(json, "lat"))
                .longitude(number(json, "lon"))
                .timeZone(string(json, "timezone"))
                .asn(string(json, "as"))
                .asnOrg(string(json, "org"))
                .hostname(string(json, "reverse"))
                .isProxy(bool(json, "proxy"))
                .build();
    }
}

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
 * <a href="https://ipquery.gitbook.io/ipquery-docs">ipquery.io</a>.
 */
public class IpQueryProvider extends JsonProvider {
    private static final String BASE_URL = "https://api.ipquery.io";

    public IpQueryProvider(@NotNull LookupProvider identity) {
        super(identity, BASE_URL);
    }

    @Override
    public @NotNull String endpoint(@Nullable Parameters parameters, @Nullable InetAddress target) {
        var url = baseUrl() + "/" + (target == null ? "" : Common.canonicalAddress(target));
        return withQuery(url, "format", "json");
    }

    @Override
    public boolean supportsTargetLookup() {
        return true;
    }

    @Override
    protected LookupResponse map(@NotNull JSONObject json) throws LookupException {
        var isp = object(json, "isp");
        var location = object(json, "location");

        return builder(requireAddress(json, "ip"))
                .country(string(location, "country"))
                .countryCode(string(location, "country_code"))
                .region(string(location, "state"))
                .postalCode(string(location, "zipcode"))
                .city(string(location, "city"))
                .latitude(number(location, "latitude"))
                .longitude(number(location, "longitude"))
                .timeZone(string(location, "timezone"))
                .asn(string(isp, "asn"))
                .asnOrg(string(isp, "org"))
                .isProxy(bool(object(json, "risk"), "is_proxy"))
                .build();
    }
}

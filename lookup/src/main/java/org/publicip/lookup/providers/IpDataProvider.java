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
 * <a href="https://docs.ipdata.co/docs">ipdata.co</a>. Requires an API key.
 */
public class IpDataProvider extends JsonProvider {
    private static final String BASE_URL = "https://api.ipdata.co";

    public IpDataProvider(@NotNull LookupProvider identity) {
        super(identity, BASE_URL);
    }

    @Override
    public @NotNull String endpoint(@Nullable Parameters parameters, @Nullable InetAddress target) {
        var url = baseUrl() + "/" + (target == null ? "" : Common.canonicalAddress(target));
        var key = apiKey(parameters);
        return key == null ? url : withQuery(url, "api-key", key);
    }

    @Override
    public boolean supportsTargetLookup() {
        return true;
    }

    @Override
    protected LookupResponse map(@NotNull JSONObject json) throws LookupException {
        var asn = object(json, "asn");

        return builder(requireAddress(json, "ip"))
                .continent(string(json, "continent_name"))
                .country(string(json, "country_name"))
                .countryCode(string(json, "country_code"))
                .region(string(json, "region"))
                .regionCode(string(json, "region_code"))
                .postalCode(string(json, "postal"))
                .city(string(json, "city"))
                .latitude(number(json, "latitude"))
                .longitude(number(json, "longitude"))
                .timeZone(string(object(json, "time_zone"), "name"))
                .asn(string(asn, "asn"))
                .asnOrg(string(asn, "name"))
                .isProxy(bool(object(json, "threat"), "is_proxy"))
                .build();
    }
}

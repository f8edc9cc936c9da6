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
 * <a href="https://www.ip2location.io/ip2location-documentation">ip2location.io</a>. The API key is optional;
 * keyless requests are rate limited per address.
 */
public class Ip2LocationProvider extends JsonProvider {
    private static final String BASE_URL = "https://api.ip2location.io";

    public Ip2LocationProvider(@NotNull LookupProvider identity) {
        super(identity, BASE_URL);
    }

    @Override
    public @NotNull String endpoint(@Nullable Parameters parameters, @Nullable InetAddress target) {
        var url = baseUrl() + "/";
        var key = apiKey(parameters);
        if (key != null) {
            url = withQuery(url, "key", key);
        }
        return target == null ? url : withQuery(url, "ip", Common.canonicalAddress(target));
    }

    @Override
    public boolean supportsTargetLookup() {
        return true;
    }

    @Override
    protected LookupResponse map(@NotNull JSONObject json) throws LookupException {
        var inEurope = bool(json, "is_eu");

        return builder(requireAddress(json, "ip"))
                .continent(Boolean.TRUE.equals(inEurope) ? "Europe" : null)
                .country(string(json, "country_name"))
                .countryCode(string(json, "country_code"))
                .region(string(json, "region_name"))
                .postalCode(string(json, "zip_code"))
                .city(string(json, "city_name"))
                .latitude(number(json, "latitude"))
                .longitude(number(json, "longitude"))
                // A UTC offset such as "-07:00", not a zone name
                .timeZone(string(json, "time_zone"))
                .asn(string(json, "asn"))
                .asnOrg(string(json, "as"))
                .isProxy(bool(json, "is_proxy"))
                .build();
    }
}

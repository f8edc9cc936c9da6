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
 * <a href="https://ipgeolocation.io/documentation">ipgeolocation.io</a>. Requires an API key.
 */
public class IpGeolocationProvider extends JsonProvider {
    private static final String BASE_URL = "https://api.ipgeolocation.io";

    public IpGeolocationProvider(@NotNull LookupProvider identity) {
        super(identity, BASE_URL);
    }

    @Override
    public @NotNull String endpoint(@Nullable Parameters parameters, @Nullable InetAddress target) {
        var key = apiKey(parameters);
        var url = withQuery(baseUrl() + "/ipgeo", "apiKey", key == null ? "" : key);
        return target == null ? url : withQuery(url, "ip", Common.canonicalAddress(target));
    }

    @Override
    public boolean supportsTargetLookup() {
        return true;
    }

    @Override
    protected LookupResponse map(@NotNull JSONObject json) throws LookupException {
        // Coordinates are sent as strings
        return builder(requireAddress(json, "ip"))
                .continent(string(json, "continent_name"))
                .country(string(json, "country_name"))
                .countryCode(string(json, "country_code2"))
                .region(string(json, "state_prov"))
                .regionCode(string(json, "state_code"))
                .postalCode(string(json, "zipcode"))
                .city(string(json, "city"))
                .latitude(number(json, "latitude"))
                .longitude(number(json, "longitude"))
                .timeZone(string(object(json, "time_zone"), "name"))
                .asn(string(json, "isp"))
                .asnOrg(string(json, "organization"))
                .hostname(string(json, "hostname"))
                .build();
    }
}

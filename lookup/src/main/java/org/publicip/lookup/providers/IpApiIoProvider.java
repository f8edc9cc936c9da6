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
 * <a href="https://ip-api.io">ip-api.io</a>. Only the caller's address can be looked up and no key is used.
 */
public class IpApiIoProvider extends JsonProvider {
    private static final String BASE_URL = "https://ip-api.io";

    public IpApiIoProvider(@NotNull LookupProvider identity) {
        super(identity, BASE_URL);
    }

    @Override
    public @NotNull String endpoint(@Nullable Parameters parameters, @Nullable InetAddress target) {
        return baseUrl() + "/json/";
    }

    @Override
    public boolean supportsTargetLookup() {
        return false;
    }

    @Override
    protected LookupResponse map(@NotNull JSONObject json) throws LookupException {
        var inEurope = bool(json, "is_in_european_union");

        return builder(requireAddress(json, "ip"))
                .continent(Boolean.TRUE.equals(inEurope) ? "Europe" : null)
                .country(string(json, "country_name"))
                .countryCode(string(json, "country_code"))
                .region(string(json, "region_name"))
                .regionCode(string(json, "region_code"))
                .postalCode(string(json, "zip_code"))
                .city(string(json, "city"))
                .latitude(number(json, "latitude"))
                .longitude(number(json, "longitude"))
                .timeZone(string(json, "time_zone"))
                .asnOrg(string(json, "organisation"))
                .isProxy(bool(object(json, "suspiciousFactors"), "isProxy"))
                .build();
    }
}

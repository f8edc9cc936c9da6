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
 * <a href="https://ipleak.net">ipleak.net</a>.
 */
public class IpLeakProvider extends JsonProvider {
    private static final String BASE_URL = "https://ipleak.net/json";

    public IpLeakProvider(@NotNull LookupProvider identity) {
        super(identity, BASE_URL);
    }

    @Override
    public @NotNull String endpoint(@Nullable Parameters parameters, @Nullable InetAddress target) {
        return baseUrl() + "/" + (target == null ? "" : Common.canonicalAddress(target));
    }

    @Override
    public boolean supportsTargetLookup() {
        return true;
    }

    @Override
    protected LookupResponse map(@NotNull JSONObject json) throws LookupException {
        return builder(requireAddress(json, "ip"))
                .continent(string(json, "continent_name"))
                .country(string(json, "country_name"))
                .countryCode(string(json, "country_code"))
                .region(string(json, "region_name"))
                .regionCode(string(json, "region_code"))
                .postalCode(string(json, "postal_code"))
                .city(string(json, "city_name"))
                .latitude(number(json, "latitude"))
                .longitude(number(json, "longitude"))
                .timeZone(string(json, "time_zone"))
                .asn(string(json, "as_number"))
                .asnOrg(string(json, "isp_name"))
                .hostname(string(json, "reverse"))
                .build();
    }
}

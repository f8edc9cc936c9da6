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
 * <a href="https://docs.abstractapi.com/ip-geolocation">AbstractAPI IP geolocation</a>. Requires an API key.
 */
public class AbstractApiProvider extends JsonProvider {
    private static final String BASE_URL = "https://ipgeolocation.abstractapi.com/v1";

    public AbstractApiProvider(@NotNull LookupProvider identity) {
        super(identity, BASE_URL);
    }

    @Override
    public @NotNull String endpoint(@Nullable Parameters parameters, @Nullable InetAddress target) {
        var key = apiKey(parameters);
        var url = withQuery(baseUrl() + "/", "api_key", key == null ? "" : key);
        return target == null ? url : withQuery(url, "ip_address", Common.canonicalAddress(target));
    }

    @Override
    public boolean supportsTargetLookup() {
        return true;
    }

    @Override
    protected LookupResponse map(@NotNull JSONObject json) throws LookupException {
        var timezone = object(json, "timezone");
        var connection = object(json, "connection");
        var security = object(json, "security");

        return builder(requireAddress(json, "ip_address"))
                .continent(string(json, "continent"))
                .country(string(json, "country"))
                .countryCode(string(json, "country_code"))
                .region(string(json, "region"))
                .regionCode(string(json, "region_iso_code"))
                .postalCode(string(json, "postal_code"))
                .city(string(json, "city"))
                .latitude(number(json, "latitude"))
                .longitude(number(json, "longitude"))
                .timeZone(string(timezone, "name"))
                .asn(string(connection, "autonomous_system_number"))
                .asnOrg(string(connection, "autonomous_system_organization"))
                .isProxy(bool(security, "is_vpn"))
                .build();
    }
}

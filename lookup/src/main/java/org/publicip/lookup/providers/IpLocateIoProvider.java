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
 * <a href="https://www.iplocate.io/docs">iplocate.io</a>. The API key is optional.
 */
public class IpLocateIoProvider extends JsonProvider {
    private static final String BASE_URL = "https://www.iplocate.io/api/lookup";

    public IpLocateIoProvider(@NotNull LookupProvider identity) {
        super(identity, BASE_URL);
    }

    @Override
    public @NotNull String endpoint(@Nullable Parameters parameters, @Nullable InetAddress target) {
        var url = baseUrl() + "/" + (target == null ? "" : Common.canonicalAddress(target) + "/") + "json";
        var key = apiKey(parameters);
        return key == null ? url : withQuery(url, "apikey", key);
    }

    @Override
    public boolean supportsTargetLookup() {
        return true;
    }

    @Override
    protected LookupResponse map(@NotNull JSONObject json) throws LookupException {
        return builder(requireAddress(json, "ip"))
                .continent(string(json, "continent"))
                .country(string(json, "country"))
                .countryCode(string(json, "country_code"))
                .region(string(json, "subdivision"))
                .postalCode(string(json, "postal_code"))
                .city(string(json, "city"))
                .latitude(number(json, "latitude"))
                .longitude(number(json, "longitude"))
                .timeZone(string(json, "time_zone"))
                .asn(string(json, "asn"))
                .asnOrg(string(json, "org"))
                .isProxy(bool(object(json, "threat"), "is_proxy"))
                .build();
    }
}

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
 * <a href="https://www.my-ip.io/api-usage">my-ip.io</a>.
 */
public class MyIpProvider extends JsonProvider {
    private static final String BASE_URL = "https://api.my-ip.io";

    public MyIpProvider(@NotNull LookupProvider identity) {
        super(identity, BASE_URL);
    }

    @Override
    public @NotNull String endpoint(@Nullable Parameters parameters, @Nullable InetAddress target) {
        return baseUrl() + "/v2/ip.json";
    }

    @Override
    protected LookupResponse map(@NotNull JSONObject json) throws LookupException {
        requireSuccess(json, "success");
        var country = object(json, "country");
        var location = object(json, "location");
        var asn = object(json, "asn");

        return builder(requireAddress(json, "ip"))
                .country(string(country, "name"))
                .countryCode(string(country, "code"))
                .region(string(json, "region"))
                .city(string(json, "city"))
                .latitude(number(location, "lat"))
                .longitude(number(location, "lon"))
                .timeZone(string(json, "timeZone"))
                .asn(string(asn, "number"))
                .asnOrg(string(asn, "name"))
                .build();
    }
}

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
import java.net.http.HttpRequest;

/**
 * <a href="https://ipbase.com/docs/info">ipbase.com</a>. The API key is optional and sent in the {@code apikey} header.
 */
public class IpBaseProvider extends JsonProvider {
    private static final String BASE_URL = "https://api.ipbase.com";

    public IpBaseProvider(@NotNull LookupProvider identity) {
        super(identity, BASE_URL);
    }

    @Override
    public @NotNull String endpoint(@Nullable Parameters parameters, @Nullable InetAddress target) {
        var url = baseUrl() + "/v2/info";
        return target == null ? url : withQuery(url, "ip", Common.canonicalAddress(target));
    }

    @Override
    public HttpRequest.Builder authenticate(@NotNull HttpRequest.Builder request, @Nullable Parameters parameters) {
        var key = apiKey(parameters);
        return key == null ? request : request.header("apikey", key);
    }

    @Override
    public boolean supportsTargetLookup() {
        return true;
    }

    @Override
    protected LookupResponse map(@NotNull JSONObject json) throws LookupException {
        var data = json.getJSONObject("data");
        var connection = object(data, "connection");
        var location = object(data, "location");
        var country = object(location, "country");

        return builder(requireAddress(data, "ip"))
                .continent(string(object(location, "continent"), "name"))
                .country(string(country, "name"))
                .countryCode(string(country, "alpha2"))
                .region(string(object(location, "region"), "name"))
                .postalCode(string(location, "zip"))
                .city(string(object(location, "city"), "name"))
                .latitude(number(location, "latitude"))
                .longitude(number(location, "longitude"))
                .timeZone(string(object(data, "timezone"), "id"))
                .asn(string(connection, "asn"))
                .asnOrg(string(connection, "organization"))
                .hostname(string(data, "hostname"))
                .isProxy(bool(object(data, "security"), "is_proxy"))
                .build();
    }
}

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
 * <a href="https://ipinfo.io/developers">ipinfo.io</a>. The API key (token) is optional.
 */
public class IpInfoProvider extends JsonProvider {
    private static final String BASE_URL = "https://ipinfo.io";

    public IpInfoProvider(@NotNull LookupProvider identity) {
        super(identity, BASE_URL);
    }

    @Override
    public @NotNull String endpoint(@Nullable Parameters parameters, @Nullable InetAddress target) {
        var url = baseUrl() + "/" + (target == null ? "" : Common.canonicalAddress(target) + "/") + "json";
        var key = apiKey(parameters);
        return key == null ? url : withQuery(url, "token", key);
    }

    @Override
    public boolean supportsTargetLookup() {
        return true;
    }

    @Override
    protected LookupResponse map(@NotNull JSONObject json) throws LookupException {
        var builder = builder(requireAddress(json, "ip"))
                // Only the ISO code of the country is reported
                .country(string(json, "country"))
                .countryCode(string(json, "country"))
                .region(string(json, "region"))
                .postalCode(string(json, "postal"))
                .city(string(json, "city"))
                .timeZone(string(json, "timezone"))
                .hostname(string(json, "hostname"));

        // "lat,lon"
        var loc = string(json, "loc");
        if (loc != null) {
            var coordinates = loc.split(",");
            if (coordinates.length == 2) {
                builder.latitude(parseDouble(coordinates[0])).longitude(parseDouble(coordinates[1]));
            }
        }

        // "AS13335 Cloudflare, Inc."
        var org = string(json, "org");
        if (org != null) {
            var parts = org.split(" ", 2);
            if (parts.length == 2 && parts[0].startsWith("AS")) {
                builder.asn(parts[0]).asnOrg(parts[1]);
            } else {
                builder.asnOrg(org);
            }
        }

        return builder.build();
    }
}

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
 * <a href="https://ipwhois.io/documentation">ipwhois.io</a>. Failures are reported in the body with status 200.
 */
public class IpWhoIsProvider extends JsonProvider {
    private static final String BASE_URL = "https://ipwho.is";

    public IpWhoIsProvider(@NotNull LookupProvider identity) {
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
        requireSuccess(json, "success");
        var connection = object(json, "connection");

        return builder(requireAddress(json, "ip"))
                .continent(string(json, "continent"))
                .country(string(json, "country"))
                .countryCode(string(json, "country_code"))
                .region(string(json, "region"))
                .regionCode(string(json, "region_code"))
                .postalCode(string(json, "postal"))
                .city(string(json, "city"))
                .latitude(number(json, "latitude"))
                .longitude(number(json, "longitude"))
                .timeZone(string(object(json, "timezone"), "id"))
                .asn(string(connection, "asn"))
                .asnOrg(string(connection, "org"))
                .build();
    }
}

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
 * <a href="https://ifconfig.co">ifconfig.co</a>, an <a href="https://github.com/mpolden/echoip">echoip</a> instance.
 */
public class IfConfigProvider extends JsonProvider {
    private static final String BASE_URL = "https://ifconfig.co";

    public IfConfigProvider(@NotNull LookupProvider identity) {
        super(identity, BASE_URL);
    }

    @Override
    public @NotNull String endpoint(@Nullable Parameters parameters, @Nullable InetAddress target) {
        var url = baseUrl() + "/json";
        return target == null ? url : withQuery(url, "ip", Common.canonicalAddress(target));
    }

    @Override
    public boolean supportsTargetLookup() {
        return true;
    }

    @Override
    protected LookupResponse map(@NotNull JSONObject json) throws LookupException {
        // echoip only reports EU membership
        var inEurope = bool(json, "country_eu");

        return builder(requireAddress(json, "ip"))
                .continent(Boolean.TRUE.equals(inEurope) ? "Europe" : null)
                .country(string(json, "country"))
                .countryCode(string(json, "country_iso"))
                .region(string(json, "region_name"))
                .regionCode(string(json, "region_code"))
                .postalCode(string(json, "zip_code"))
                .city(string(json, "city"))
                .latitude(number(json, "latitude"))
                .longitude(number(json, "longitude"))
                .timeZone(string(json, "time_zone"))
                .asn(string(json, "asn"))
                .asnOrg(string(json, "asn_org"))
                .hostname(string(json, "hostname"))
                .build();
    }
}

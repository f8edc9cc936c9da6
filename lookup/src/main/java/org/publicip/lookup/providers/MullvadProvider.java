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
 * <a href="https://mullvad.net/en/check">Mullvad connection check</a>. Reports whether the caller uses
 * a Mullvad VPN exit.
 */
public class MullvadProvider extends JsonProvider {
    private static final String BASE_URL = "https://am.i.mullvad.net";

    public MullvadProvider(@NotNull LookupProvider identity) {
        super(identity, BASE_URL);
    }

    @Override
    public @NotNull String endpoint(@Nullable Parameters parameters, @Nullable InetAddress target) {
        return baseUrl() + "/json";
    }

    @Override
    protected LookupResponse map(@NotNull JSONObject json) throws LookupException {
        return builder(requireAddress(json, "ip"))
                .country(string(json, "country"))
                .city(string(json, "city"))
                .latitude(number(json, "latitude"))
                .longitude(number(json, "longitude"))
                .asnOrg(string(json, "organization"))
                .isProxy(bool(json, "mullvad_exit_ip"))
                .build();
    }
}

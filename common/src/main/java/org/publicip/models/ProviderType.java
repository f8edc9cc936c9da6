package org.publicip.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The supported lookup backends. The identifier of each constant is persisted in cache files and must not change.
 */
public enum ProviderType {
    /** <a href="https://abstractapi.com">abstractapi.com</a> */
    ABSTRACT_API("abstractapi"),
    /** <a href="https://freeipapi.com">freeipapi.com</a> */
    FREE_IP_API("freeipapi"),
    /** <a href="https://jsonip.com">jsonip.com</a> */
    GET_JSON_IP("getjsonip"),
    /** <a href="https://ifconfig.co">ifconfig.co</a> */
    IF_CONFIG("ifconfig"),
    /** <a href="https://www.ip2location.io">ip2location.io</a> */
    IP2LOCATION("ip2location"),
    /** <a href="https://ipapi.co">ipapi.co</a> */
    IP_API_CO("ipapico"),
    /** <a href="https://ip-api.com">ip-api.com</a> */
    IP_API_COM("ipapicom"),
    /** <a href="https://ip-api.io">ip-api.io</a> */
    IP_API_IO("ipapiio"),
    /** <a href="https://ipbase.com">ipbase.com</a> */
    IP_BASE("ipbase"),
    /** <a href="https://ipdata.co">ipdata.co</a> */
    IP_DATA("ipdata"),
    /** <a href="https://ipgeolocation.io">ipgeolocation.io</a> */
    IP_GEOLOCATION("ipgeolocation"),
    /** <a href="https://www.ipify.org">ipify.org</a> */
    IPIFY("ipify"),
    /** <a href="https://ipinfo.io">ipinfo.io</a> */
    IP_INFO("ipinfo"),
    /** <a href="https://ipleak.net">ipleak.net</a> */
    IP_LEAK("ipleak"),
    /** <a href="https://iplocate.io">iplocate.io</a> */
    IP_LOCATE_IO("iplocateio"),
    /** <a href="https://ipquery.io">ipquery.io</a> */
    IP_QUERY("ipquery"),
    /** <a href="https://ipwhois.io">ipwhois.io</a> */
    IP_WHO_IS("ipwhois"),
    /** <a href="https://mullvad.net">mullvad.net</a> */
    MULLVAD("mullvad"),
    /** <a href="https://my-ip.io">my-ip.io</a> */
    MY_IP("myip"),
    /** <a href="https://myip.com">myip.com</a> */
    MY_IP_COM("myipcom"),
    /** Synthetic provider returning a configured address, for tests. */
    MOCK("mock");

    private final String _id;

    ProviderType(String id) {
        _id = id;
    }

    @JsonValue
    public @NotNull String id() {
        return _id;
    }

    /**
     * Finds the type with the given identifier.
     *
     * @param id the identifier, matched case-insensitively after trimming
     * @return the type, or null if there is none
     */
    public static @Nullable ProviderType fromId(@Nullable String id) {
        if (id == null) {
            return null;
        }

        var normalized = id.trim().toLowerCase();
        for (var type : values()) {
            if (type._id.equals(normalized)) {
                return type;
            }
        }
        return null;
    }

    @JsonCreator
    static ProviderType fromJson(String id) {
        var type = fromId(id);
        if (type == null) {
            throw new IllegalArgumentException("Unknown provider: " + id);
        }
        return type;
    }

    @Override
    public String toString() {
        return _id;
    }
}

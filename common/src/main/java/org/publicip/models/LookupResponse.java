package org.publicip.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.publicip.Common;

import java.net.InetAddress;
import java.util.Objects;

/**
 * A normalized lookup result. Only the address and the provider are guaranteed; the remaining fields depend on
 * what the provider reports and are null when absent.
 *
 * @param ip          The looked-up public address.
 * @param continent   The continent name.
 * @param country     The country name.
 * @param countryCode The ISO country code.
 * @param region      The region (state, province) name.
 * @param regionCode  The region code.
 * @param postalCode  The postal code.
 * @param city        The city name.
 * @param latitude    The latitude in degrees.
 * @param longitude   The longitude in degrees.
 * @param timeZone    The IANA time zone identifier.
 * @param asn         The autonomous system number (in the provider's notation).
 * @param asnOrg      The autonomous system organization.
 * @param hostname    The reverse DNS name of the address.
 * @param isProxy     Whether the provider considers the address a proxy or VPN exit.
 * @param provider    The provider that produced this response.
 */
public record LookupResponse(
        @JsonProperty("ip") @JsonDeserialize(using = InetAddressLiteralDeserializer.class)
        @NotNull InetAddress ip,
        @JsonProperty("continent") @Nullable String continent,
        @JsonProperty("country") @Nullable String country,
        @JsonProperty("country_code") @Nullable String countryCode,
        @JsonProperty("region") @Nullable String region,
        @JsonProperty("region_code") @Nullable String regionCode,
        @JsonProperty("postal_code") @Nullable String postalCode,
        @JsonProperty("city") @Nullable String city,
        @JsonProperty("latitude") @Nullable Double latitude,
        @JsonProperty("longitude") @Nullable Double longitude,
        @JsonProperty("time_zone") @Nullable String timeZone,
        @JsonProperty("asn") @Nullable String asn,
        @JsonProperty("asn_org") @Nullable String asnOrg,
        @JsonProperty("hostname") @Nullable String hostname,
        @JsonProperty("is_proxy") @Nullable Boolean isProxy,
        @JsonProperty("provider") @NotNull LookupProvider provider
) {
    public LookupResponse {
        Objects.requireNonNull(ip, "ip");
        Objects.requireNonNull(provider, "provider");
    }

    /**
     * Creates a response that carries only the address.
     */
    public static LookupResponse of(@NotNull InetAddress ip, @NotNull LookupProvider provider) {
        return builder(ip, provider).build();
    }

    public static Builder builder(@NotNull InetAddress ip, @NotNull LookupProvider provider) {
        return new Builder(ip, provider);
    }

    /**
     * Renders the response as a multi-line, human-readable text. Absent fields are skipped.
     *
     * @return the text
     */
    public String describe() {
        var sb = new StringBuilder();
        sb.append("IP: ").append(Common.canonicalAddress(ip)).append('\n');
        if (continent != null) {
            sb.append("Continent: ").append(continent).append('\n');
        }
        if (country != null) {
            sb.append("Country: ").append(country);
            if (countryCode != null) {
                sb.append(" (").append(countryCode).append(')');
            }
            sb.append('\n');
        }
        if (region != null) {
            sb.append("Region: ").append(region);
            if (regionCode != null) {
                sb.append(" (").append(regionCode).append(')');
            }
            sb.append('\n');
        }
        if (postalCode != null) {
            sb.append("Postal code: ").append(postalCode).append('\n');
        }
        if (city != null) {
            sb.append("City: ").append(city).append('\n');
        }
        if (latitude != null && longitude != null) {
            sb.append("Coordinates: ").append(latitude).append(", ").append(longitude).append('\n');
        }
        if (timeZone != null) {
            sb.append("Time zone: ").append(timeZone).append('\n');
        }
        if (asnOrg != null) {
            sb.append("Organization: ").append(asnOrg);
            if (asn != null) {
                sb.append(" (").append(asn).append(')');
            }
            sb.append('\n');
        } else if (asn != null) {
            sb.append("ASN: ").append(asn).append('\n');
        }
        if (hostname != null) {
            sb.append("Hostname: ").append(hostname).append('\n');
        }
        if (isProxy != null) {
            sb.append("Proxy: ").append(isProxy).append('\n');
        }
        sb.append("Provider: ").append(provider);
        return sb.toString();
    }

    /**
     * Collects the optional fields of a response. Provider adapters set whatever their backend reports.
     */
    public static final class Builder {
        private final InetAddress _ip;
        private final LookupProvider _provider;
        private String _continent;
        private String _country;
        private String _countryCode;
        private String _region;
        private String _regionCode;
        private String _postalCode;
        private String _city;
        private Double _latitude;
        private Double _longitude;
        private String _timeZone;
        private String _asn;
        private String _asnOrg;
        private String _hostname;
        private Boolean _isProxy;

        private Builder(@NotNull InetAddress ip, @NotNull LookupProvider provider) {
            _ip = ip;
            _provider = provider;
        }

        public Builder continent(@Nullable String continent) {
            _continent = continent;
            return this;
        }

        public Builder country(@Nullable String country) {
            _country = country;
            return this;
        }

        public Builder countryCode(@Nullable String countryCode) {
            _countryCode = countryCode;
            return this;
        }

        public Builder region(@Nullable String region) {
            _region = region;
            return this;
        }

        public Builder regionCode(@Nullable String regionCode) {
            _regionCode = regionCode;
            return this;
        }

        public Builder postalCode(@Nullable String postalCode) {
            _postalCode = postalCode;
            return this;
        }

        public Builder city(@Nullable String city) {
            _city = city;
            return this;
        }

        public Builder latitude(@Nullable Double latitude) {
            _latitude = latitude;
            return this;
        }

        public Builder longitude(@Nullable Double longitude) {
            _longitude = longitude;
            return this;
        }

        public Builder timeZone(@Nullable String timeZone) {
            _timeZone = timeZone;
            return this;
        }

        public Builder asn(@Nullable String asn) {
            _asn = asn;
            return this;
        }

        public Builder asnOrg(@Nullable String asnOrg) {
            _asnOrg = asnOrg;
            return this;
        }

        public Builder hostname(@Nullable String hostname) {
            _hostname = hostname;
            return this;
        }

        public Builder isProxy(@Nullable Boolean isProxy) {
            _isProxy = isProxy;
            return this;
        }

        public LookupResponse build() {
            return new LookupResponse(_ip, _continent, _country, _countryCode, _region, _regionCode, _postalCode,
                    _city, _latitude, _longitude, _timeZone, _asn, _asnOrg, _hostname, _isProxy, _provider);
        }
    }
}

package org.publicip.lookup.providers;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.publicip.Common;
import org.publicip.errors.LookupException;
import org.publicip.lookup.ProviderRegistry;
import org.publicip.models.LookupProvider;
import org.publicip.models.LookupResponse;
import org.publicip.models.ProviderType;

import static org.junit.jupiter.api.Assertions.*;

class ProviderParsingTest {
    private static LookupResponse parse(ProviderType type, String body) throws LookupException {
        return ProviderRegistry.build(LookupProvider.of(type)).parse(body);
    }

    private static LookupException parseError(ProviderType type, String body) {
        var error = assertThrows(LookupException.class, () -> parse(type, body));
        assertEquals(LookupException.Kind.PARSE, error.getKind());
        assertEquals(LookupProvider.of(type), error.getProvider());
        return error;
    }

    @Test
    void ifConfig() throws LookupException {
        var response = parse(ProviderType.IF_CONFIG, """
                {"ip": "81.2.69.160", "ip_decimal": 1359103392, "country": "United Kingdom", "country_iso": "GB",
                 "country_eu": false, "region_name": "England", "region_code": "ENG", "zip_code": "EC1A",
                 "city": "London", "latitude": 51.5142, "longitude": -0.0931, "time_zone": "Europe/London",
                 "asn": "AS20712", "asn_org": "Andrews & Arnold Ltd", "hostname": "host.example.net"}
                """);

        assertEquals(Common.parseAddress("81.2.69.160"), response.ip());
        assertNull(response.continent());
        assertEquals("United Kingdom", response.country());
        assertEquals("GB", response.countryCode());
        assertEquals("England", response.region());
        assertEquals("ENG", response.regionCode());
        assertEquals("EC1A", response.postalCode());
        assertEquals("London", response.city());
        assertEquals(51.5142, response.latitude());
        assertEquals(-0.0931, response.longitude());
        assertEquals("Europe/London", response.timeZone());
        assertEquals("AS20712", response.asn());
        assertEquals("Andrews & Arnold Ltd", response.asnOrg());
        assertEquals("host.example.net", response.hostname());
        assertNull(response.isProxy());
        assertEquals(LookupProvider.of(ProviderType.IF_CONFIG), response.provider());
    }

    @Test
    void ifConfigReportsEuropeanUnion() throws LookupException {
        var response = parse(ProviderType.IF_CONFIG, "{\"ip\": \"2.2.2.2\", \"country_eu\": true}");
        assertEquals("Europe", response.continent());
    }

    @Test
    void ipInfoSplitsLocationAndOrganization() throws LookupException {
        var response = parse(ProviderType.IP_INFO, """
                {"ip": "1.1.1.1", "hostname": "one.one.one.one", "city": "Brisbane", "region": "Queensland",
                 "country": "AU", "loc": "-27.4820,153.0136", "org": "AS13335 Cloudflare, Inc.",
                 "postal": "4101", "timezone": "Australia/Brisbane", "anycast": true}
                """);

        assertEquals("AU", response.country());
        assertEquals("AU", response.countryCode());
        assertEquals(-27.482, response.latitude());
        assertEquals(153.0136, response.longitude());
        assertEquals("AS13335", response.asn());
        assertEquals("Cloudflare, Inc.", response.asnOrg());
        assertEquals("one.one.one.one", response.hostname());
    }

    @Test
    void ipInfoOrganizationWithoutAsn() throws LookupException {
        var response = parse(ProviderType.IP_INFO, "{\"ip\": \"1.1.1.1\", \"org\": \"Somebody\", \"loc\": \"bad\"}");
        assertNull(response.asn());
        assertEquals("Somebody", response.asnOrg());
        assertNull(response.latitude());
    }

    @Test
    void ipWhoIs() throws LookupException {
        var response = parse(ProviderType.IP_WHO_IS, """
                {"ip": "8.8.4.4", "success": true, "type": "IPv4", "continent": "North America",
                 "country": "United States", "country_code": "US", "region": "California", "region_code": "CA",
                 "city": "Mountain View", "latitude": 37.3860517, "longitude": -122.0838511, "postal": "94039",
                 "connection": {"asn": 15169, "org": "Google LLC", "isp": "Google LLC"},
                 "timezone": {"id": "America/Los_Angeles", "utc": "-07:00"}}
                """);

        assertEquals("North America", response.continent());
        assertEquals("CA", response.regionCode());
        assertEquals("94039", response.postalCode());
        assertEquals("15169", response.asn());
        assertEquals("Google LLC", response.asnOrg());
        assertEquals("America/Los_Angeles", response.timeZone());
    }

    @Test
    void ipWhoIsFailureInBody() {
        var error = parseError(ProviderType.IP_WHO_IS,
                "{\"ip\": \"0.0.0.0\", \"success\": false, \"message\": \"Reserved range\"}");
        assertTrue(error.getMessage().contains("Reserved range"));
    }

    @Test
    void ipApiCom() throws LookupException {
        var response = parse(ProviderType.IP_API_COM, """
                {"status": "success", "continent": "Europe", "country": "Germany", "countryCode": "DE",
                 "region": "HE", "regionName": "Hesse", "city": "Frankfurt am Main", "zip": "60313",
                 "lat": 50.1109, "lon": 8.68213, "timezone": "Europe/Berlin", "org": "Hetzner",
                 "as": "AS24940 Hetzner Online GmbH", "reverse": "static.example.de", "proxy": false,
                 "query": "5.9.0.1"}
                """);

        assertEquals(Common.parseAddress("5.9.0.1"), response.ip());
        assertEquals("Hesse", response.region());
        assertEquals("HE", response.regionCode());
        assertEquals("AS24940 Hetzner Online GmbH", response.asn());
        assertEquals("static.example.de", response.hostname());
        assertEquals(Boolean.FALSE, response.isProxy());
    }

    @Test
    void ipApiComFailureInBody() {
        parseError(ProviderType.IP_API_COM, "{\"status\": \"fail\", \"message\": \"private range\", \"query\": \"10.0.0.1\"}");
    }

    @Test
    void ipApiCoFailureInBody() {
        var error = parseError(ProviderType.IP_API_CO,
                "{\"ip\": \"127.0.0.1\", \"error\": true, \"reason\": \"Reserved IP Address\"}");
        assertTrue(error.getMessage().contains("Reserved IP Address"));
    }

    @Test
    void freeIpApi() throws LookupException {
        var response = parse(ProviderType.FREE_IP_API, """
                {"ipVersion": 4, "ipAddress": "9.9.9.9", "latitude": 47.37, "longitude": 8.54,
                 "countryName": "Switzerland", "countryCode": "CH", "timeZone": "+01:00", "zipCode": "8001",
                 "cityName": "Zurich", "regionName": "Zurich", "continent": "Europe", "isProxy": false}
                """);

        assertEquals("Switzerland", response.country());
        assertEquals("Zurich", response.city());
        assertEquals("+01:00", response.timeZone());
        assertEquals(Boolean.FALSE, response.isProxy());
    }

    @Test
    void ipBaseReadsNestedData() throws LookupException {
        var response = parse(ProviderType.IP_BASE, """
                {"data": {"ip": "1.0.0.1", "hostname": null,
                  "connection": {"asn": 13335, "organization": "Cloudflare"},
                  "location": {"continent": {"name": "Oceania"}, "country": {"alpha2": "AU", "name": "Australia"},
                    "region": {"name": "Queensland"}, "city": {"name": "Brisbane"}, "zip": "4000",
                    "latitude": -27.46, "longitude": 153.02},
                  "timezone": {"id": "Australia/Brisbane"},
                  "security": {"is_proxy": true}}}
                """);

        assertEquals("Oceania", response.continent());
        assertEquals("AU", response.countryCode());
        assertEquals("Brisbane", response.city());
        assertEquals("13335", response.asn());
        assertNull(response.hostname());
        assertEquals(Boolean.TRUE, response.isProxy());
    }

    @Test
    void ipBaseWithoutDataIsParseError() {
        parseError(ProviderType.IP_BASE, "{\"message\": \"Invalid API key\"}");
    }

    @Test
    void ipGeolocationReadsStringCoordinates() throws LookupException {
        var response = parse(ProviderType.IP_GEOLOCATION, """
                {"ip": "8.8.8.8", "continent_name": "North America", "country_code2": "US",
                 "country_name": "United States", "state_prov": "California", "city": "Mountain View",
                 "zipcode": "94043-1351", "latitude": "37.42240", "longitude": "-122.08421",
                 "isp": "Google LLC", "organization": "Google LLC", "time_zone": {"name": "America/Los_Angeles"}}
                """);

        assertEquals(37.4224, response.latitude());
        assertEquals(-122.08421, response.longitude());
        assertEquals("America/Los_Angeles", response.timeZone());
    }

    @Test
    void myIpReadsCamelCaseTimeZone() throws LookupException {
        var response = parse(ProviderType.MY_IP, """
                {"success": true, "ip": "2001:db8::1", "type": "IPv6",
                 "country": {"code": "NL", "name": "Netherlands"}, "region": "North Holland", "city": "Amsterdam",
                 "location": {"lat": 52.37, "lon": 4.89}, "timeZone": "Europe/Amsterdam",
                 "asn": {"number": 1136, "name": "KPN B.V."}}
                """);

        assertEquals(Common.parseAddress("2001:db8::1"), response.ip());
        assertEquals("NL", response.countryCode());
        assertEquals(52.37, response.latitude());
        assertEquals("Europe/Amsterdam", response.timeZone());
        assertEquals("1136", response.asn());
    }

    @Test
    void mullvadFlagsExitAddresses() throws LookupException {
        var response = parse(ProviderType.MULLVAD, """
                {"ip": "185.65.135.1", "country": "Sweden", "city": "Stockholm", "longitude": 18.06,
                 "latitude": 59.33, "mullvad_exit_ip": true, "organization": "M247"}
                """);

        assertEquals(Boolean.TRUE, response.isProxy());
        assertEquals("M247", response.asnOrg());
    }

    @Test
    void ipApiIo() throws LookupException {
        var response = parse(ProviderType.IP_API_IO, """
                {"ip": "1.1.1.1", "country_code": "US", "country_name": "United States", "is_in_european_union": false,
                 "region_name": "", "region_code": "", "city": "", "zip_code": "", "time_zone": "America/Chicago",
                 "latitude": 37.751, "longitude": -97.822, "organisation": "GOOGLE",
                 "suspiciousFactors": {"isProxy": false, "isTorNode": false, "isSpam": false, "isSuspicious": false}}
                """);

        assertEquals(Common.parseAddress("1.1.1.1"), response.ip());
        assertNull(response.continent());
        assertEquals("US", response.countryCode());
        assertEquals("United States", response.country());
        assertNull(response.city());
        assertNull(response.region());
        assertEquals(37.751, response.latitude());
        assertEquals("America/Chicago", response.timeZone());
        assertEquals("GOOGLE", response.asnOrg());
        assertEquals(Boolean.FALSE, response.isProxy());
    }

    @Test
    void ipApiIoReportsEuropeanUnion() throws LookupException {
        var response = parse(ProviderType.IP_API_IO, "{\"ip\": \"5.5.5.5\", \"is_in_european_union\": true}");
        assertEquals("Europe", response.continent());
        assertNull(response.isProxy());
    }

    @Test
    void ip2Location() throws LookupException {
        var response = parse(ProviderType.IP2LOCATION, """
                {"ip": "8.8.8.8", "country_code": "US", "country_name": "United States of America",
                 "region_name": "California", "city_name": "Mountain View", "latitude": 37.405992,
                 "longitude": -122.078515, "zip_code": "94043", "time_zone": "-07:00", "asn": "15169",
                 "as": "Google LLC", "is_proxy": false}
                """);

        assertEquals(Common.parseAddress("8.8.8.8"), response.ip());
        assertEquals("United States of America", response.country());
        assertEquals("California", response.region());
        assertEquals("Mountain View", response.city());
        assertEquals("94043", response.postalCode());
        assertEquals(-122.078515, response.longitude());
        assertEquals("-07:00", response.timeZone());
        assertEquals("15169", response.asn());
        assertEquals("Google LLC", response.asnOrg());
        assertEquals(Boolean.FALSE, response.isProxy());
        assertNull(response.continent());
    }

    @Test
    void ip2LocationErrorBodyIsParseError() {
        parseError(ProviderType.IP2LOCATION,
                "{\"error\": {\"error_code\": 10001, \"error_message\": \"Invalid IP address.\"}}");
    }

    @Test
    void myIpCom() throws LookupException {
        var response = parse(ProviderType.MY_IP_COM, "{\"ip\": \"3.3.3.3\", \"country\": \"Spain\", \"cc\": \"ES\"}");
        assertEquals("ES", response.countryCode());
        assertEquals("Spain", response.country());
    }

    @ParameterizedTest
    @EnumSource(value = ProviderType.class, names = {"GET_JSON_IP", "IPIFY", "IP_LEAK", "IP_DATA", "IP_QUERY",
            "IP_LOCATE_IO", "IP_API_CO"})
    void minimalReply(ProviderType type) throws LookupException {
        var response = parse(type, "{\"ip\": \"4.4.4.4\"}");
        assertEquals(Common.parseAddress("4.4.4.4"), response.ip());
        assertNull(response.country());
        assertEquals(LookupProvider.of(type), response.provider());
    }

    @Test
    void abstractApi() throws LookupException {
        var response = parse(ProviderType.ABSTRACT_API, """
                {"ip_address": "166.171.248.255", "city": "San Jose", "region": "California",
                 "region_iso_code": "CA", "postal_code": "95141", "country": "United States", "country_code": "US",
                 "continent": "North America", "longitude": -121.7714, "latitude": 37.1835,
                 "security": {"is_vpn": false}, "timezone": {"name": "America/Los_Angeles"},
                 "connection": {"autonomous_system_number": 20057, "autonomous_system_organization": "AT&T"}}
                """);

        assertEquals("CA", response.regionCode());
        assertEquals("20057", response.asn());
        assertEquals("AT&T", response.asnOrg());
        assertEquals(Boolean.FALSE, response.isProxy());
    }

    @Test
    void unspecifiedAddressIsParseError() {
        parseError(ProviderType.IPIFY, "{\"ip\": \"0.0.0.0\"}");
    }

    @Test
    void missingAddressIsParseError() {
        parseError(ProviderType.IF_CONFIG, "{\"country\": \"Nowhere\"}");
    }

    @Test
    void invalidAddressIsParseError() {
        parseError(ProviderType.GET_JSON_IP, "{\"ip\": \"not-an-ip\"}");
    }

    @Test
    void malformedJsonIsParseError() {
        parseError(ProviderType.IP_LEAK, "<html>rate limited</html>");
        parseError(ProviderType.IP_LEAK, "");
    }

    @Test
    void mockIgnoresBody() throws LookupException {
        var provider = new MockProvider(LookupProvider.mock("11.1.1.1"));
        assertTrue(provider.isOffline());
        assertEquals(Common.parseAddress("11.1.1.1"), provider.parse("anything").ip());

        var online = new MockProvider(LookupProvider.mock("11.1.1.1", "http://localhost:1"));
        assertFalse(online.isOffline());
        assertEquals("http://localhost:1", online.endpoint(null, null));
    }

    @Test
    void mockWithInvalidAddressFails() {
        var provider = new MockProvider(LookupProvider.mock("nope"));
        assertThrows(LookupException.class, () -> provider.parse(""));
    }
}

package org.publicip.lookup;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.json.JSONException;
import org.json.JSONObject;
import org.publicip.Common;
import org.publicip.errors.LookupException;
import org.publicip.models.LookupProvider;
import org.publicip.models.LookupResponse;
import org.publicip.models.Parameters;

import java.net.InetAddress;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * A base class for providers that reply with a JSON object.
 * <p>
 * The class keeps the provider identity and the effective base URL, which is either the provider's default one or
 * the endpoint configured in the identity. Subclasses map the parsed object with the null-safe accessors below.
 */
public abstract class JsonProvider implements Provider {
    private final LookupProvider _identity;
    private final String _baseUrl;

    protected JsonProvider(@NotNull LookupProvider identity, @NotNull String defaultBaseUrl) {
        _identity = identity;
        var base = identity.endpoint() != null ? identity.endpoint() : defaultBaseUrl;
        _baseUrl = base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
    }

    @Override
    public @NotNull LookupProvider identity() {
        return _identity;
    }

    /**
     * @return the base URL without a trailing slash
     */
    protected String baseUrl() {
        return _baseUrl;
    }

    @Override
    public final @NotNull LookupResponse parse(@NotNull String body) throws LookupException {
        JSONObject json;
        try {
            json = new JSONObject(body);
        } catch (JSONException e) {
            throw LookupException.parse(_identity, "Invalid JSON reply: " + e.getMessage(), e);
        }

        try {
            return map(json);
        } catch (JSONException e) {
            throw LookupException.parse(_identity, "Unexpected JSON reply: " + e.getMessage(), e);
        }
    }

    /**
     * Maps the parsed reply onto a response.
     *
     * @param json the reply
     * @return the response
     * @throws LookupException if the reply does not describe an address
     */
    protected abstract LookupResponse map(@NotNull JSONObject json) throws LookupException;

    protected LookupResponse.Builder builder(@NotNull InetAddress ip) {
        return LookupResponse.builder(ip, _identity);
    }

    /**
     * Reads the mandatory address field.
     *
     * @throws LookupException if the field is missing, not an IP literal, or the unspecified address
     */
    protected InetAddress requireAddress(@Nullable JSONObject json, @NotNull String key) throws LookupException {
        var value = string(json, key);
        if (value == null) {
            throw LookupException.parse(_identity, "Missing field '" + key + "'", null);
        }

        var address = Common.parseAddress(value);
        if (address == null) {
            throw LookupException.parse(_identity, "Invalid IP address: " + value, null);
        }
        if (address.isAnyLocalAddress()) {
            throw LookupException.parse(_identity, "The reply contains no address: " + value, null);
        }
        return address;
    }

    /**
     * Fails with the message of the reply if it reports an unsuccessful lookup in its body.
     *
     * @param json       the reply
     * @param successKey the field holding the success flag
     */
    protected void requireSuccess(@NotNull JSONObject json, @NotNull String successKey) throws LookupException {
        var value = json.opt(successKey);
        var success = value instanceof Boolean bool ? bool : !"fail".equals(value);
        if (!success) {
            var message = string(json, "message");
            throw LookupException.parse(_identity, "Lookup failed: " + (message == null ? "no details" : message),
                    null);
        }
    }

    /**
     * Appends a query parameter, URL-encoding its value.
     */
    protected static String withQuery(@NotNull String url, @NotNull String name, @NotNull String value) {
        var separator = url.contains("?") ? '&' : '?';
        return url + separator + name + "=" + URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    protected static @Nullable String apiKey(@Nullable Parameters parameters) {
        if (parameters == null || parameters.apiKey().isBlank()) {
            return null;
        }
        return parameters.apiKey();
    }

    protected static @Nullable JSONObject object(@Nullable JSONObject json, @NotNull String key) {
        return json == null ? null : json.optJSONObject(key);
    }

    /**
     * Reads a string field. Numbers are converted to their textual form; empty strings are treated as absent.
     */
    protected static @Nullable String string(@Nullable JSONObject json, @NotNull String key) {
        if (json == null || json.isNull(key)) {
            return null;
        }

        var value = json.opt(key);
        if (value instanceof String str) {
            return str.isBlank() ? null : str;
        } else if (value instanceof Number || value instanceof Boolean) {
            return value.toString();
        }
        return null;
    }

    /**
     * Reads a numeric field. Numeric strings are accepted too.
     */
    protected static @Nullable Double number(@Nullable JSONObject json, @NotNull String key) {
        if (json == null || json.isNull(key)) {
            return null;
        }

        var value = json.opt(key);
        if (value instanceof Number num) {
            return num.doubleValue();
        } else if (value instanceof String str) {
            return parseDouble(str);
        }
        return null;
    }

    protected static @Nullable Double parseDouble(@Nullable String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    protected static @Nullable Boolean bool(@Nullable JSONObject json, @NotNull String key) {
        if (json == null || json.isNull(key)) {
            return null;
        }

        var value = json.opt(key);
        if (value instanceof Boolean b) {
            return b;
        } else if (value instanceof String str) {
            if ("true".equalsIgnoreCase(str)) {
                return true;
            } else if ("false".equalsIgnoreCase(str)) {
                return false;
            }
        }
        return null;
    }
}

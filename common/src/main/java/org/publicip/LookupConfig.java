package org.publicip;

/**
 * The configuration keys, descriptions and default values for the lookups and the response cache.
 */
@SuppressWarnings("ALL")
public class LookupConfig {
    /* --- Providers --- */
    public static final String PROVIDERS_CONFIG = "lookup.providers";
    public static final String PROVIDERS_DOC = "Comma-separated provider list, tried in order. Each item is a provider " +
            "name optionally followed by a space and an API key.";
    public static final String PROVIDERS_DEFAULT = "ifconfig, ipinfo, ipwhois, ipapicom, freeipapi";

    public static final String TTL_CONFIG = "lookup.ttl";
    public static final String TTL_DOC = "The number of seconds a cached response stays valid. Empty means forever.";
    public static final String TTL_DEFAULT = "2";

    /* --- HTTP --- */
    public static final String HTTP_TIMEOUT_CONFIG = "lookup.http.timeout";
    public static final String HTTP_TIMEOUT_DOC = "The connect and request timeout of a provider call (seconds).";
    public static final String HTTP_TIMEOUT_DEFAULT = "5";

    public static final String HTTP_BLOCKING_CONFIG = "lookup.http.blocking";
    public static final String HTTP_BLOCKING_DOC = "If true, requests block the calling thread instead of using " +
            "the asynchronous client.";
    public static final String HTTP_BLOCKING_DEFAULT = "false";

    /* --- Cache --- */
    public static final String CACHE_DIR_CONFIG = "cache.dir";
    public static final String CACHE_DIR_DOC = "The directory of the cache file. Empty means the platform cache " +
            "directory, with the data, home and working directories as fallbacks.";
    public static final String CACHE_DIR_DEFAULT = "";

    public static final String CACHE_FILE_CONFIG = "cache.file";
    public static final String CACHE_FILE_DOC = "The name of the cache file.";
    public static final String CACHE_FILE_DEFAULT = "lookup.cache";

    public static final String CACHE_ENCRYPT_CONFIG = "cache.encrypt";
    public static final String CACHE_ENCRYPT_DOC = "If true, the cache file is encrypted with a key derived from " +
            "the machine passphrase.";
    public static final String CACHE_ENCRYPT_DEFAULT = "false";

    public static final String CACHE_PASSPHRASE_CONFIG = "cache.passphrase";
    public static final String CACHE_PASSPHRASE_DOC = "Overrides the machine-identifying passphrase used to derive " +
            "the cache encryption key.";
    public static final String CACHE_PASSPHRASE_DEFAULT = "";
}

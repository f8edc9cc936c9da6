package org.publicip;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.publicip.errors.CacheException;
import org.publicip.errors.ConfigurationException;
import org.publicip.errors.PublicIpException;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;


public class CommonTest {

    @ParameterizedTest(name = "{index} => input={0}, expected={1}")
    @MethodSource("parseAddressTestCases")
    void testParseAddress(String input, String expected, String description) {
        var actual = Common.parseAddress(input);
        if (expected == null) {
            assertNull(actual, description);
        } else {
            assertNotNull(actual, description);
            assertEquals(expected, Common.canonicalAddress(actual), description);
        }
    }

    private static Stream<Arguments> parseAddressTestCases() {
        return Stream.of(
                Arguments.of("1.1.1.1", "1.1.1.1", "Should parse a plain IPv4 literal."),
                Arguments.of("  8.8.8.8 ", "8.8.8.8", "Should trim surrounding whitespace."),
                Arguments.of("2001:0db8:0000:0000:0000:0000:0000:0001", "2001:db8::1",
                        "Should canonicalize a full IPv6 literal."),
                Arguments.of("::ffff:1.2.3.4", "1.2.3.4", "Should map an IPv4-mapped IPv6 literal to IPv4."),
                Arguments.of("example.com", null, "Should reject a host name instead of resolving it."),
                Arguments.of("256.1.1.1", null, "Should reject an out-of-range octet."),
                Arguments.of("", null, "Should reject an empty string."),
                Arguments.of(null, null, "Should return null for null.")
        );
    }

    @Test
    void testAwaitReturnsValue() throws PublicIpException {
        assertEquals("ok", Common.await(CompletableFuture.completedFuture("ok")));
    }

    @Test
    void testAwaitUnwrapsLibraryException() {
        var cause = new ConfigurationException(ConfigurationException.Kind.NO_PROVIDERS, "none");
        var future = CompletableFuture.<String>failedFuture(new CompletionException(cause));

        var thrown = assertThrows(ConfigurationException.class, () -> Common.await(future));
        assertSame(cause, thrown);
    }

    @Test
    void testAwaitRethrowsRuntimeException() {
        var future = CompletableFuture.<String>failedFuture(new IllegalStateException("boom"));

        var thrown = assertThrows(IllegalStateException.class, () -> Common.await(future));
        assertEquals("boom", thrown.getMessage());
    }

    @Test
    void testUnwrapNestedCompletionExceptions() {
        var cause = new CacheException(CacheException.Kind.IO, "disk");
        var wrapped = new CompletionException(new CompletionException(cause));

        assertSame(cause, Common.unwrap(wrapped));
    }

    @Test
    void testPropertiesBuilderKeepsExistingOnAddIfAbsent() {
        var props = new PropertiesBuilder()
                .add(LookupConfig.TTL_CONFIG, "10")
                .addIfAbsent(LookupConfig.TTL_CONFIG, "20")
                .addIfAbsent(LookupConfig.CACHE_FILE_CONFIG, "other.cache")
                .get();

        assertEquals("10", props.getProperty(LookupConfig.TTL_CONFIG));
        assertEquals("other.cache", props.getProperty(LookupConfig.CACHE_FILE_CONFIG));
    }
}

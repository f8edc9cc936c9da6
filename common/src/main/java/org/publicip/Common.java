package org.publicip;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.cfg.MapperBuilder;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.google.common.net.InetAddresses;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.publicip.errors.PublicIpException;
import org.slf4j.Logger;

import java.net.InetAddress;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Common utility functions and constants.
 */
public final class Common {
    private Common() {
    }

    /**
     * Creates a new Jackson JSON {@link ObjectMapper} builder with the following settings:
     * <ul>
     *     <li>Include the JavaTimeModule to support Java 8 date/time datatypes.</li>
     *     <li>Include source locations in exceptions.</li>
     *     <li>Read/write date timestamps as milliseconds.</li>
     *     <li>Do not fail on unknown properties.</li>
     *     <li>Do not write null-valued properties.</li>
     * </ul>
     *
     * @return a new {@link MapperBuilder} instance
     */
    public static MapperBuilder<? extends ObjectMapper, ?> makeMapper() {
        return JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .configure(JsonParser.Feature.INCLUDE_SOURCE_IN_LOCATION, true)
                .configure(SerializationFeature.WRITE_DATE_TIMESTAMPS_AS_NANOSECONDS, false)
                .configure(DeserializationFeature.READ_DATE_TIMESTAMPS_AS_NANOSECONDS, false)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .serializationInclusion(JsonInclude.Include.NON_NULL);
    }

    /**
     * Creates a logger for a specific component. The logger name will be created by concatenating
     * the class name, a dot, and the value of the static field {@code COMPONENT_NAME} in the class.
     *
     * @param clazz the class to get the logger for
     * @return a SLF4J {@link Logger} instance
     */
    public static Logger getComponentLogger(Class<?> clazz) {
        try {
            final String componentName = clazz.getField("COMPONENT_NAME")
                    .get(null).toString();
            return org.slf4j.LoggerFactory.getLogger(clazz.getName() + "." + componentName);
        } catch (IllegalAccessException | NoSuchFieldException e) {
            throw new RuntimeException(e);
        }
    }

    /**
     * Parses a textual IP address literal without ever touching DNS.
     *
     * @param value the IPv4 or IPv6 literal
     * @return the parsed address, or null if the value is null or not an IP literal
     */
    public static @Nullable InetAddress parseAddress(@Nullable String value) {
        if (value == null) {
            return null;
        }

        var trimmed = value.trim();
        if (!InetAddresses.isInetAddress(trimmed)) {
            return null;
        }
        return InetAddresses.forString(trimmed);
    }

    /**
     * Returns the canonical textual form of an address (RFC 5952 for IPv6), used as a stable key.
     *
     * @param address the address
     * @return the canonical string
     */
    public static @NotNull String canonicalAddress(@NotNull InetAddress address) {
        return InetAddresses.toAddrString(address);
    }

    /**
     * Waits for a future and unwraps its failure.
     * <p>
     * A {@link PublicIpException} that completed the future exceptionally is rethrown as is; runtime exceptions
     * and errors are rethrown unchanged; anything else is wrapped in a {@link RuntimeException}.
     *
     * @param future the future to wait for
     * @param <T>    the result type
     * @return the result of the future
     * @throws PublicIpException if the future failed with a library exception
     */
    public static <T> T await(@NotNull CompletableFuture<T> future) throws PublicIpException {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while waiting for the lookup");
        } catch (ExecutionException e) {
            throw rethrow(e.getCause());
        }
    }

    /**
     * Strips {@link CompletionException} and {@link ExecutionException} wrappers off a throwable.
     *
     * @param error the throwable as seen by a future stage
     * @return the innermost meaningful cause
     */
    public static Throwable unwrap(Throwable error) {
        var current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static PublicIpException rethrow(Throwable error) {
        var cause = unwrap(error);
        if (cause instanceof PublicIpException publicIpException) {
            return publicIpException;
        } else if (cause instanceof RuntimeException runtimeException) {
            throw runtimeException;
        } else if (cause instanceof Error err) {
            throw err;
        }
        throw new RuntimeException(cause);
    }
}

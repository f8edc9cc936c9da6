package org.publicip.cache;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.publicip.models.LookupResponse;

import java.net.InetAddress;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * One cached response together with the time it was stored and its time-to-live.
 *
 * @param response     The cached response.
 * @param responseTime The time the response was stored, with millisecond precision.
 * @param ttl          The time-to-live in seconds, or null if the record never expires.
 */
public record ResponseRecord(
        @JsonProperty("response") @NotNull LookupResponse response,
        @JsonProperty("response_time") @NotNull Instant responseTime,
        @JsonProperty("ttl") @JsonInclude(JsonInclude.Include.ALWAYS) @Nullable Long ttl
) {
    public ResponseRecord {
        Objects.requireNonNull(response, "response");
        Objects.requireNonNull(responseTime, "responseTime");
        if (ttl != null && ttl < 0) {
            throw new IllegalArgumentException("TTL must not be negative");
        }
    }

    /**
     * Creates a record stamped with the current time of the clock. The timestamp is truncated to milliseconds,
     * the precision of the cache file.
     */
    public static ResponseRecord now(@NotNull LookupResponse response, @Nullable Long ttl, @NotNull Clock clock) {
        return new ResponseRecord(response, clock.instant().truncatedTo(ChronoUnit.MILLIS), ttl);
    }

    /**
     * Checks whether the TTL has elapsed. A record without a TTL never expires.
     *
     * @param clock the clock providing the current time
     * @return true if {@code now - responseTime >= ttl}
     */
    public boolean isExpired(@NotNull Clock clock) {
        if (ttl == null) {
            return false;
        }

        var age = Duration.between(responseTime, clock.instant());
        // A clock that went backwards counts as zero age
        if (age.isNegative()) {
            age = Duration.ZERO;
        }
        return age.compareTo(Duration.ofSeconds(ttl)) >= 0;
    }

    @JsonIgnore
    public InetAddress ip() {
        return response.ip();
    }
}

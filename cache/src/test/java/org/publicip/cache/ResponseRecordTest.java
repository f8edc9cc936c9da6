package org.publicip.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.publicip.Common;
import org.publicip.models.LookupProvider;
import org.publicip.models.LookupResponse;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class ResponseRecordTest {
    private static final LookupResponse RESPONSE =
            LookupResponse.of(Common.parseAddress("1.1.1.1"), LookupProvider.mock("1.1.1.1"));

    private final ObjectMapper mapper = Common.makeMapper().build();

    @Test
    void recordWithoutTtlNeverExpires() {
        var clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        var record = ResponseRecord.now(RESPONSE, null, clock);

        clock.advance(Duration.ofDays(3650));
        assertFalse(record.isExpired(clock));
    }

    @Test
    void recordExpiresWhenTtlElapsed() {
        var clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        var record = ResponseRecord.now(RESPONSE, 2L, clock);

        clock.advance(Duration.ofMillis(1999));
        assertFalse(record.isExpired(clock));
        clock.advance(Duration.ofMillis(1));
        assertTrue(record.isExpired(clock));
    }

    @Test
    void zeroTtlIsExpiredImmediately() {
        var clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));

        assertTrue(ResponseRecord.now(RESPONSE, 0L, clock).isExpired(clock));
    }

    @Test
    void clockGoingBackwardsDoesNotExpire() {
        var clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        var record = ResponseRecord.now(RESPONSE, 1L, clock);

        clock.advance(Duration.ofHours(-1));
        assertFalse(record.isExpired(clock));
    }

    @Test
    void timestampIsTruncatedToMillis() {
        var clock = new MutableClock(Instant.parse("2024-01-01T00:00:00.123456789Z"));

        assertEquals(Instant.parse("2024-01-01T00:00:00.123Z"), ResponseRecord.now(RESPONSE, 1L, clock).responseTime());
    }

    @Test
    void negativeTtlIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ResponseRecord(RESPONSE, Instant.EPOCH, -1L));
    }

    @Test
    void serializesTimeAsEpochMillisAndKeepsNullTtl() throws Exception {
        var record = new ResponseRecord(RESPONSE, Instant.ofEpochMilli(1_700_000_000_123L), null);
        var json = mapper.readTree(mapper.writeValueAsString(record));

        assertEquals(1_700_000_000_123L, json.get("response_time").asLong());
        assertTrue(json.has("ttl"));
        assertTrue(json.get("ttl").isNull());
        assertEquals(record, mapper.readValue(mapper.writeValueAsString(record), ResponseRecord.class));
    }
}

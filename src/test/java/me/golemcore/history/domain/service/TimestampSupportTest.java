package me.golemcore.history.domain.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TimestampSupportTest {

    private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    @Test
    void shouldTreatSmallNumbersAsSeconds() {
        assertEquals(Instant.ofEpochSecond(1_700_000_000L), TimestampSupport.resolve(1_700_000_000L, CLOCK));
    }

    @Test
    void shouldTreatLargeNumbersAsMilliseconds() {
        assertEquals(Instant.ofEpochSecond(1_700_000_000L), TimestampSupport.resolve(1_700_000_000_000L, CLOCK));
    }

    @Test
    void shouldKeepFractionalSeconds() {
        assertEquals(Instant.ofEpochMilli(1_500L), TimestampSupport.resolve(1.5d, CLOCK));
    }

    @Test
    void shouldParseNumericStrings() {
        assertEquals(Instant.ofEpochSecond(1_700_000_000L), TimestampSupport.resolve("1700000000", CLOCK));
        assertEquals(Instant.ofEpochSecond(1_700_000_000L), TimestampSupport.resolve("1700000000000", CLOCK));
    }

    @Test
    void shouldParseIsoInstant() {
        assertEquals(Instant.parse("2024-01-15T10:30:00Z"), TimestampSupport.resolve("2024-01-15T10:30:00Z", CLOCK));
    }

    @Test
    void shouldParseOffsetDateTime() {
        assertEquals(Instant.parse("2024-01-15T08:30:00Z"),
                TimestampSupport.resolve("2024-01-15T10:30:00+02:00", CLOCK));
    }

    @Test
    void shouldParseLocalDateTimeAsUtc() {
        assertEquals(Instant.parse("2024-01-15T10:30:00Z"), TimestampSupport.resolve("2024-01-15 10:30:00", CLOCK));
    }

    @Test
    void shouldParseDateAsStartOfDay() {
        assertEquals(Instant.parse("2024-01-15T00:00:00Z"), TimestampSupport.resolve("2024-01-15", CLOCK));
    }

    @Test
    void shouldParseRfc1123() {
        assertEquals(Instant.parse("2024-01-15T10:30:00Z"),
                TimestampSupport.resolve("Mon, 15 Jan 2024 10:30:00 GMT", CLOCK));
    }

    @ParameterizedTest
    @ValueSource(strings = { "garbage", "", "  ", "yesterday" })
    void shouldFallBackToClockForUnparseableText(String raw) {
        assertEquals(NOW, TimestampSupport.resolve(raw, CLOCK));
    }

    @Test
    void shouldFallBackToClockForMissingValue() {
        assertEquals(NOW, TimestampSupport.resolve(null, CLOCK));
        assertEquals(NOW, TimestampSupport.resolve(Boolean.TRUE, CLOCK));
    }

    @Test
    void parse_returnsEmptyForUnknownTypes() {
        Optional<Instant> parsed = TimestampSupport.parse(new Object());

        assertTrue(parsed.isEmpty());
    }
}

package me.golemcore.history.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Converts raw timestamp values of unknown scale and shape into instants.
 *
 * <p>
 * Numbers above {@value #MILLIS_THRESHOLD} are epoch milliseconds, smaller
 * numbers are epoch seconds. Strings holding a number follow the same rule;
 * other strings are parsed as ISO-8601 or RFC-1123 calendar values, local
 * date-times being read as UTC.
 */
public final class TimestampSupport {

    public static final double MILLIS_THRESHOLD = 1e12;

    private static final Pattern NUMERIC = Pattern.compile("^-?\\d+(\\.\\d+)?$");
    private static final Pattern SPACE_SEPARATED = Pattern.compile("^(\\d{4}-\\d{2}-\\d{2}) (\\d{2}:\\d{2}.*)$");

    private static final List<Function<String, Instant>> CALENDAR_PARSERS = List.of(
            Instant::parse,
            text -> OffsetDateTime.parse(text).toInstant(),
            text -> LocalDateTime.parse(text).toInstant(ZoneOffset.UTC),
            text -> LocalDate.parse(text).atStartOfDay().toInstant(ZoneOffset.UTC),
            text -> ZonedDateTime.parse(text, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant());

    private TimestampSupport() {
    }

    /**
     * Parses the value, falling back to the clock's current instant.
     */
    public static Instant resolve(Object raw, Clock clock) {
        return parse(raw).orElseGet(clock::instant);
    }

    public static Optional<Instant> parse(Object raw) {
        if (raw instanceof Number number) {
            return Optional.of(fromEpoch(number.doubleValue()));
        }
        if (raw instanceof CharSequence sequence) {
            return parseText(sequence.toString().trim());
        }
        return Optional.empty();
    }

    public static Instant fromEpoch(double value) {
        if (value > MILLIS_THRESHOLD) {
            return Instant.ofEpochMilli((long) value);
        }
        return Instant.ofEpochMilli(Math.round(value * 1000d));
    }

    private static Optional<Instant> parseText(String text) {
        if (text.isEmpty()) {
            return Optional.empty();
        }
        if (NUMERIC.matcher(text).matches()) {
            try {
                return Optional.of(fromEpoch(Double.parseDouble(text)));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        String candidate = SPACE_SEPARATED.matcher(text).replaceFirst("$1T$2");
        for (Function<String, Instant> parser : CALENDAR_PARSERS) {
            try {
                return Optional.of(parser.apply(candidate));
            } catch (DateTimeParseException e) {
                // next format
            }
        }
        return Optional.empty();
    }
}

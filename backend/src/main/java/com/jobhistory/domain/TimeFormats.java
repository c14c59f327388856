package com.jobhistory.domain;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * ISO-8601 timestamps as exchanged with workflow notifications and stored records.
 * Parsing accepts any offset and optional fraction; formatting emits whole seconds in UTC.
 */
public final class TimeFormats {

    private static final DateTimeFormatter OUTPUT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ssXXX")
            .withZone(ZoneOffset.UTC);

    private TimeFormats() {
    }

    /**
     * @throws TimeFormatException if the value is null or not an ISO-8601 date-time with offset
     */
    public static Instant parse(String value) {
        if (value == null) {
            throw new TimeFormatException("missing timestamp");
        }
        try {
            return OffsetDateTime.parse(value.strip(), DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant();
        } catch (DateTimeParseException e) {
            throw new TimeFormatException("cannot parse timestamp \"" + value + "\": " + e.getMessage(), e);
        }
    }

    public static String format(Instant instant) {
        return OUTPUT.format(instant);
    }

    /** Nanoseconds since the epoch; used to build execution record keys. */
    public static long epochNanos(Instant instant) {
        return Math.addExact(Math.multiplyExact(instant.getEpochSecond(), 1_000_000_000L), instant.getNano());
    }
}

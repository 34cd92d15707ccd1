package com.project.attest.io;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;

/**
 * The one timestamp format used in signed payloads and exported artifacts:
 * UTC, millisecond precision, e.g. {@code 2025-10-30T08:15:00.000Z}.
 */
public final class Timestamps {

    private static final DateTimeFormatter FORMAT =
            DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    private Timestamps() {
    }

    public static Instant normalize(Instant instant) {
        return instant.truncatedTo(ChronoUnit.MILLIS);
    }

    public static String format(Instant instant) {
        return FORMAT.format(normalize(instant));
    }

    /**
     * Parses any ISO-8601 instant and normalizes it to millisecond precision.
     */
    public static Instant parse(String text) {
        try {
            return normalize(Instant.parse(text));
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid timestamp: " + text, e);
        }
    }
}

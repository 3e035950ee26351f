package com.linked.util;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Conversions between {@link Instant} and the two text forms it travels in.
 *
 * <p>Storage text is fixed-width UTC with milliseconds so that string ordering in SQL
 * ({@code MAX}, {@code ORDER BY}) matches time ordering. Wire text is RFC 3339 UTC.
 */
public final class TimeFormats {

    private static final DateTimeFormatter STORAGE =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    // format of SQLite's CURRENT_TIMESTAMP column default
    private static final DateTimeFormatter SQLITE_DEFAULT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private TimeFormats() {}

    public static String toStorage(Instant instant) {
        return STORAGE.format(instant);
    }

    /**
     * Accepts RFC 3339 (with or without fraction) and {@code yyyy-MM-dd HH:mm:ss} as UTC.
     *
     * @return {@code null} for a {@code null} column
     */
    public static Instant fromStorage(String text) {
        if (text == null) {
            return null;
        }
        try {
            return OffsetDateTime.parse(text).toInstant();
        } catch (DateTimeParseException e) {
            return LocalDateTime.parse(text, SQLITE_DEFAULT).toInstant(ZoneOffset.UTC);
        }
    }

    public static String toWire(Instant instant) {
        return instant == null ? null : DateTimeFormatter.ISO_INSTANT.format(instant);
    }
}

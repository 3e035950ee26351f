package com.linked.util;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class TimeFormatsTest {

    @Test
    void storageTextIsFixedWidthSoItSortsChronologically() {
        String whole = TimeFormats.toStorage(Instant.parse("2026-01-01T10:00:00Z"));
        String fraction = TimeFormats.toStorage(Instant.parse("2026-01-01T10:00:00.500Z"));

        assertEquals("2026-01-01T10:00:00.000Z", whole);
        assertEquals(whole.length(), fraction.length());
        assertTrue(whole.compareTo(fraction) < 0);
    }

    @Test
    void readsEveryStoredForm() {
        Instant expected = Instant.parse("2026-01-01T10:00:00Z");

        assertEquals(expected, TimeFormats.fromStorage("2026-01-01T10:00:00.000Z"));
        assertEquals(expected, TimeFormats.fromStorage("2026-01-01T10:00:00Z"));
        assertEquals(expected, TimeFormats.fromStorage("2026-01-01T12:00:00+02:00"));
        assertEquals(expected, TimeFormats.fromStorage("2026-01-01 10:00:00"));
        assertNull(TimeFormats.fromStorage(null));
    }

    @Test
    void wireTextIsRfc3339Utc() {
        assertEquals("2026-01-01T10:00:00Z", TimeFormats.toWire(Instant.parse("2026-01-01T10:00:00Z")));
        assertNull(TimeFormats.toWire(null));
    }
}

package com.mktsim.common;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Virtual time helpers. Simulated time is a long count of nanoseconds since
 * the epoch (UTC); it is advanced only by the kernel.
 */
public final class SimTime {

    public static final long NANOS_PER_SECOND = 1_000_000_000L;

    private static final DateTimeFormatter FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSSSSSSSS").withZone(ZoneOffset.UTC);

    private SimTime() {}

    public static long ofSeconds(double seconds) {
        return Math.round(seconds * NANOS_PER_SECOND);
    }

    /** Parses {@code 2021-03-22T10:30:00Z} or a zone-less {@code 2021-03-22T10:30:00} (taken as UTC). */
    public static long parse(String text) {
        String s = text.trim().replace(' ', 'T');
        Instant instant;
        try {
            instant = Instant.parse(s);
        } catch (DateTimeParseException e) {
            instant = LocalDateTime.parse(s).toInstant(ZoneOffset.UTC);
        }
        return instant.getEpochSecond() * NANOS_PER_SECOND + instant.getNano();
    }

    public static String format(long nanos) {
        Instant instant = Instant.ofEpochSecond(Math.floorDiv(nanos, NANOS_PER_SECOND), Math.floorMod(nanos, NANOS_PER_SECOND));
        return FORMAT.format(instant);
    }
}

package com.phillippitts.octvol.util;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Utility methods for time conversions and elapsed time calculations.
 *
 * <p>Besides the elapsed-time helpers used for timing with {@link System#nanoTime()}, this
 * class converts the two date encodings found in .vol headers:
 * <ul>
 *   <li>Windows FILETIME: unsigned count of 100 ns ticks since 1601-01-01 UTC</li>
 *   <li>OLE automation date: fractional days since 1899-12-30</li>
 * </ul>
 *
 * @since 1.0
 */
public final class TimeUtils {

    /**
     * Number of nanoseconds in one millisecond.
     */
    public static final long NANOS_PER_MILLI = 1_000_000L;

    /** Seconds between 1601-01-01 and 1970-01-01. */
    static final long FILETIME_EPOCH_OFFSET_SECONDS = 11_644_473_600L;

    private static final long FILETIME_TICKS_PER_SECOND = 10_000_000L;
    private static final long NANOS_PER_FILETIME_TICK = 100L;
    private static final long MILLIS_PER_DAY = 86_400_000L;
    private static final LocalDateTime OLE_EPOCH = LocalDateTime.of(1899, 12, 30, 0, 0);

    private TimeUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Converts nanoseconds to milliseconds.
     *
     * @param nanos time in nanoseconds
     * @return time in milliseconds (truncated)
     */
    public static long nanosToMillis(long nanos) {
        return nanos / NANOS_PER_MILLI;
    }

    /**
     * Converts a FILETIME tick count (read as an unsigned 64-bit value) to an instant.
     *
     * @param ticks 100 ns intervals since 1601-01-01 UTC
     * @return the corresponding instant
     */
    public static Instant fileTimeToInstant(long ticks) {
        long seconds = Long.divideUnsigned(ticks, FILETIME_TICKS_PER_SECOND);
        long nanos = Long.remainderUnsigned(ticks, FILETIME_TICKS_PER_SECOND) * NANOS_PER_FILETIME_TICK;
        return Instant.ofEpochSecond(seconds - FILETIME_EPOCH_OFFSET_SECONDS, nanos);
    }

    /**
     * Converts an OLE automation date to a local date-time, rounded to the millisecond.
     *
     * @param days fractional days since 1899-12-30
     * @return the corresponding date-time
     */
    public static LocalDateTime oleDateToLocalDateTime(double days) {
        return OLE_EPOCH.plus(Duration.ofMillis(Math.round(days * MILLIS_PER_DAY)));
    }

    /**
     * Converts an OLE automation date to the calendar date it falls on.
     *
     * @param days fractional days since 1899-12-30
     * @return the date, time of day dropped
     */
    public static LocalDate oleDateToLocalDate(double days) {
        return oleDateToLocalDateTime(days).toLocalDate();
    }
}

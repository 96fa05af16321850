package com.phillippitts.slawatch.util;

import java.time.Duration;

/**
 * Utility methods for time conversions and elapsed time calculations.
 *
 * <p>Response times arrive as fractional seconds from callers and are reported the same way in
 * telemetry payloads; internally they are carried as {@link Duration}.
 *
 * @since 1.0
 */
public final class TimeUtils {

    /**
     * Number of nanoseconds in one millisecond.
     */
    public static final long NANOS_PER_MILLI = 1_000_000L;

    private static final double NANOS_PER_SECOND = 1_000_000_000.0;

    private TimeUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Calculates elapsed milliseconds since a nanosecond timestamp.
     *
     * @param startNanos start time from {@link System#nanoTime()}
     * @return elapsed milliseconds since startNanos
     */
    public static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / NANOS_PER_MILLI;
    }

    /**
     * Converts a duration to fractional seconds.
     *
     * @param duration duration to convert
     * @return seconds, including the sub-second fraction
     */
    public static double toSeconds(Duration duration) {
        return duration.toNanos() / NANOS_PER_SECOND;
    }

    /**
     * Converts fractional seconds to a duration, rounded to the nearest nanosecond.
     *
     * @param seconds non-negative finite seconds
     * @return the equivalent duration
     * @throws IllegalArgumentException if seconds is negative, NaN or infinite
     */
    public static Duration fromSeconds(double seconds) {
        if (Double.isNaN(seconds) || Double.isInfinite(seconds) || seconds < 0) {
            throw new IllegalArgumentException("Seconds must be a non-negative finite number, got: " + seconds);
        }
        return Duration.ofNanos(Math.round(seconds * NANOS_PER_SECOND));
    }
}

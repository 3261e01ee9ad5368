package com.phillippitts.lifecycle.util;

import java.time.Duration;
import java.time.Instant;

/**
 * Utility methods for elapsed time calculations.
 *
 * <p>Used for validation timing with {@link System#nanoTime()} and for rate calculations
 * over wall-clock windows.
 */
public final class TimeUtils {

    public static final long NANOS_PER_MILLI = 1_000_000L;

    private static final double MILLIS_PER_MINUTE = 60_000.0;

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
     * Minutes between two instants, never less than one minute, so rates computed over
     * a very short window stay finite.
     */
    public static double minutesAtLeastOne(Instant from, Instant to) {
        double minutes = Duration.between(from, to).toMillis() / MILLIS_PER_MINUTE;
        return Math.max(1.0, minutes);
    }
}

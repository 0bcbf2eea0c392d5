package com.phillippitts.radflow.util;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Utility methods for time conversions and elapsed time checks.
 *
 * @since 1.0
 */
public final class TimeUtils {

    /**
     * Number of nanoseconds in one millisecond.
     */
    public static final long NANOS_PER_MILLI = 1_000_000L;

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
     * Returns true if at least {@code window} has passed between {@code since} and the clock's now.
     * A null {@code since} counts as elapsed.
     */
    public static boolean hasElapsed(Clock clock, Instant since, Duration window) {
        if (since == null) {
            return true;
        }
        return Duration.between(since, clock.instant()).compareTo(window) >= 0;
    }
}

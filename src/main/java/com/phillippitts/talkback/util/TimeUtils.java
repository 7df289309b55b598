package com.phillippitts.talkback.util;

import java.time.Duration;

/**
 * Utility methods for time conversions and elapsed time calculations.
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
     * Multiplies a duration by a factor, rounding to the nearest millisecond.
     *
     * @param duration base duration
     * @param factor   scale factor
     * @return scaled duration
     */
    public static Duration scale(Duration duration, double factor) {
        return Duration.ofMillis(Math.round(duration.toMillis() * factor));
    }

    /**
     * Sleeps for the given duration, restoring the interrupt flag when interrupted.
     *
     * @param duration how long to sleep
     * @return false if the thread was interrupted
     */
    public static boolean sleepQuietly(Duration duration) {
        if (duration.isZero() || duration.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(duration.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}

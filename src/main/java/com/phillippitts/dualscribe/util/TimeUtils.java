package com.phillippitts.dualscribe.util;

/**
 * Utility methods for time conversions and elapsed time calculations.
 *
 * <p>Provides conversions between nanoseconds and milliseconds for latency measurements
 * taken with {@link System#nanoTime()}, and the {@code HH:MM:SS,mmm} clock format used by
 * subtitle exports.
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
     * Converts nanoseconds to milliseconds.
     *
     * @param nanos time in nanoseconds
     * @return time in milliseconds (truncated)
     */
    public static long nanosToMillis(long nanos) {
        return nanos / NANOS_PER_MILLI;
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
     * Formats a non-negative offset as {@code HH:MM:SS,mmm}. Negative input is treated as zero.
     *
     * @param offsetMs offset in milliseconds
     * @return SubRip style clock string
     */
    public static String formatSubtitleClock(long offsetMs) {
        long ms = Math.max(0L, offsetMs);
        long hours = ms / 3_600_000L;
        long minutes = (ms / 60_000L) % 60;
        long seconds = (ms / 1000L) % 60;
        long millis = ms % 1000L;
        return String.format("%02d:%02d:%02d,%03d", hours, minutes, seconds, millis);
    }
}

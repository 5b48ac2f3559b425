package com.phillippitts.dualscribe.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TimeUtilsTest {

    @Test
    void shouldConvertNanosToMillis() {
        assertThat(TimeUtils.nanosToMillis(1_000_000L)).isEqualTo(1L);
        assertThat(TimeUtils.nanosToMillis(100_000_000L)).isEqualTo(100L);
    }

    @Test
    void shouldTruncateNanosToMillis() {
        // 2.999 milliseconds truncates to 2 milliseconds
        assertThat(TimeUtils.nanosToMillis(2_999_999L)).isEqualTo(2L);
    }

    @Test
    void shouldCalculateElapsedMillisFromPastTimestamp() {
        long startNanos = System.nanoTime() - (1_000L * TimeUtils.NANOS_PER_MILLI);

        long elapsedMs = TimeUtils.elapsedMillis(startNanos);

        assertThat(elapsedMs).isBetween(1000L, 1100L);
    }

    @Test
    void shouldFormatSubtitleClock() {
        assertThat(TimeUtils.formatSubtitleClock(0L)).isEqualTo("00:00:00,000");
        assertThat(TimeUtils.formatSubtitleClock(1_500L)).isEqualTo("00:00:01,500");
        assertThat(TimeUtils.formatSubtitleClock(3_723_004L)).isEqualTo("01:02:03,004");
    }

    @Test
    void shouldClampNegativeOffsetToZero() {
        assertThat(TimeUtils.formatSubtitleClock(-250L)).isEqualTo("00:00:00,000");
    }
}

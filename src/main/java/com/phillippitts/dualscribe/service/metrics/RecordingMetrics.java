package com.phillippitts.dualscribe.service.metrics;

import com.phillippitts.dualscribe.domain.StreamId;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for recording sessions and the transcript engine.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Accepted final transcripts per speaker</li>
 *   <li>Suppressed duplicates per reason, and replacements of stored entries</li>
 *   <li>Dropped audio frames per stream and pipeline stage</li>
 *   <li>Reconnect attempts per outcome, and recognition session open latency</li>
 * </ul>
 *
 * <p>A {@code null} registry turns every method into a no-op; {@link #NOOP} is the shared instance
 * used by components built outside Spring (mostly tests).
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class RecordingMetrics {

    private static final Logger LOG = LogManager.getLogger(RecordingMetrics.class);

    static final String METRIC_PREFIX = "dualscribe.recording";

    /** Metrics sink that records nothing. */
    public static final RecordingMetrics NOOP = new RecordingMetrics(null);

    private final MeterRegistry registry;

    public RecordingMetrics(MeterRegistry registry) {
        this.registry = registry;
        if (registry == null) {
            LOG.debug("RecordingMetrics created without a registry; metrics disabled");
        }
    }

    public boolean isEnabled() {
        return registry != null;
    }

    /**
     * Counts a final transcript stored in the log.
     *
     * @param speaker speaker label (Me / Other)
     */
    public void incrementFinalAccepted(String speaker) {
        if (registry == null) {
            return;
        }
        Counter.builder(METRIC_PREFIX + ".finals.accepted")
                .description("Final transcripts stored in the log")
                .tag("speaker", speaker)
                .register(registry)
                .increment();
    }

    /**
     * Counts a final transcript discarded as a duplicate.
     *
     * @param reason suppression reason tag
     */
    public void incrementSuppressed(String reason) {
        if (registry == null) {
            return;
        }
        Counter.builder(METRIC_PREFIX + ".finals.suppressed")
                .description("Final transcripts discarded by duplicate suppression")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /** Counts a stored transcript replaced by a preferred-stream duplicate. */
    public void incrementReplaced() {
        if (registry == null) {
            return;
        }
        Counter.builder(METRIC_PREFIX + ".finals.replaced")
                .description("Stored transcripts replaced by a preferred-source duplicate")
                .register(registry)
                .increment();
    }

    /**
     * Counts audio frames dropped on the way to the recognizer.
     *
     * @param stream stream that lost the frames
     * @param stage  where they were dropped (capture, loop, session)
     * @param count  number of frames
     */
    public void incrementFramesDropped(StreamId stream, String stage, long count) {
        if (registry == null || count <= 0) {
            return;
        }
        Counter.builder(METRIC_PREFIX + ".frames.dropped")
                .description("Audio frames dropped before reaching the recognizer")
                .tag("stream", stream.wireName())
                .tag("stage", stage)
                .register(registry)
                .increment(count);
    }

    /**
     * Counts a reconnect attempt.
     *
     * @param stream  stream being reopened
     * @param outcome success, retry or exhausted
     */
    public void incrementReconnect(StreamId stream, String outcome) {
        if (registry == null) {
            return;
        }
        Counter.builder(METRIC_PREFIX + ".reconnects")
                .description("Recognition session reconnect attempts")
                .tag("stream", stream.wireName())
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    /**
     * Records how long opening a recognition session took.
     *
     * @param stream        stream opened
     * @param durationNanos elapsed time in nanoseconds
     */
    public void recordSessionOpen(StreamId stream, long durationNanos) {
        if (registry == null) {
            return;
        }
        Timer.builder(METRIC_PREFIX + ".session.open")
                .description("Time taken to open a recognition session")
                .tag("stream", stream.wireName())
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }
}

package com.phillippitts.dualscribe.service.orchestration;

import com.phillippitts.dualscribe.config.properties.RecognitionProperties;
import com.phillippitts.dualscribe.domain.StreamId;
import com.phillippitts.dualscribe.exception.RecognitionException;
import com.phillippitts.dualscribe.service.metrics.RecordingMetrics;
import com.phillippitts.dualscribe.service.orchestration.event.RecognitionSessionRecoveredEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded, backed-off reopening of recognition sessions that failed while recording.
 *
 * <p>Detection model:
 * <ul>
 *   <li>Transient failures ({@link RecognitionException#isTransient()}) mark the stream
 *       RECONNECTING and schedule a reopen after {@code min(max, initial * 2^(attempt-1))} ms.</li>
 *   <li>Each failed attempt schedules the next one until {@code reconnect.max-attempts} is used up;
 *       the stream is then DISABLED.</li>
 *   <li>Non-transient failures (authentication, protocol, missing model) disable the stream at once.</li>
 * </ul>
 *
 * <p>{@link #reset()} re-enables every stream and invalidates attempts scheduled for the previous
 * recording, so a late attempt can never reopen a stream after stop.
 */
public class StreamReconnector {

    private static final Logger LOG = LogManager.getLogger(StreamReconnector.class);

    /** Reopens one stream; throws when the attempt failed. */
    @FunctionalInterface
    public interface ReopenAction {
        void reopen(StreamId streamId);
    }

    private final int maxAttempts;
    private final long initialBackoffMs;
    private final long maxBackoffMs;
    private final ScheduledExecutorService scheduler;
    private final ApplicationEventPublisher publisher;
    private final RecordingMetrics metrics;
    private final Clock clock;

    private final ConcurrentMap<StreamId, StreamHealth> health = new ConcurrentHashMap<>();
    private final Map<StreamId, ReentrantLock> attemptLocks = new EnumMap<>(StreamId.class);
    private final AtomicLong epoch = new AtomicLong();

    public StreamReconnector(RecognitionProperties.Reconnect props,
                             ScheduledExecutorService scheduler,
                             ApplicationEventPublisher publisher,
                             RecordingMetrics metrics,
                             Clock clock) {
        this.maxAttempts = props.getMaxAttempts();
        this.initialBackoffMs = props.getInitialBackoffMs();
        this.maxBackoffMs = props.getMaxBackoffMs();
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.metrics = metrics == null ? RecordingMetrics.NOOP : metrics;
        this.clock = Objects.requireNonNull(clock, "clock");
        for (StreamId id : StreamId.values()) {
            health.put(id, StreamHealth.HEALTHY);
            attemptLocks.put(id, new ReentrantLock());
        }
    }

    /** Backoff before attempt {@code attempt} (1-based). */
    long backoffMs(int attempt) {
        int shift = Math.min(Math.max(attempt - 1, 0), 30);
        long delay = initialBackoffMs << shift;
        return delay < 0 ? maxBackoffMs : Math.min(maxBackoffMs, delay);
    }

    public StreamHealth health(StreamId streamId) {
        return health.get(streamId);
    }

    public Map<StreamId, StreamHealth> snapshot() {
        Map<StreamId, StreamHealth> copy = new EnumMap<>(StreamId.class);
        copy.putAll(health);
        return copy;
    }

    /**
     * Reacts to a session failure while recording.
     *
     * @param streamId failed stream
     * @param error    failure reported by the session
     * @param action   how to reopen the stream
     */
    public void onFailure(StreamId streamId, RecognitionException error, ReopenAction action) {
        if (!error.isTransient()) {
            markDisabled(streamId, error.getMessage());
            return;
        }
        if (health.get(streamId) != StreamHealth.HEALTHY) {
            LOG.debug("Stream {} already {}; ignoring failure: {}", streamId, health.get(streamId), error.getMessage());
            return;
        }
        health.put(streamId, StreamHealth.RECONNECTING);
        LOG.warn("Recognition stream {} failed ({}); reconnecting", streamId, error.getMessage());
        schedule(streamId, 1, epoch.get(), action);
    }

    /** Stops reconnecting {@code streamId} until the next {@link #reset()}. */
    public void markDisabled(StreamId streamId, String reason) {
        health.put(streamId, StreamHealth.DISABLED);
        LOG.error("Recognition stream {} disabled: {}", streamId, reason);
    }

    /** Re-enables all streams and cancels pending attempts. */
    public void reset() {
        epoch.incrementAndGet();
        for (StreamId id : StreamId.values()) {
            health.put(id, StreamHealth.HEALTHY);
        }
    }

    private void schedule(StreamId streamId, int attempt, long scheduledEpoch, ReopenAction action) {
        long delay = backoffMs(attempt);
        Map<String, String> context = ThreadContext.getImmutableContext();
        try {
            scheduler.schedule(() -> withContext(context, streamId, () -> attempt(streamId, attempt, scheduledEpoch, action)),
                    delay, TimeUnit.MILLISECONDS);
            LOG.debug("Reconnect attempt {} for {} in {} ms", attempt, streamId, delay);
        } catch (RejectedExecutionException e) {
            markDisabled(streamId, "reconnect scheduler unavailable: " + e.getMessage());
        }
    }

    /** Runs {@code task} under the scheduling thread's ThreadContext plus the stream key, then restores the worker's. */
    private static void withContext(Map<String, String> context, StreamId streamId, Runnable task) {
        Map<String, String> previous = ThreadContext.getImmutableContext();
        try {
            if (context != null && !context.isEmpty()) {
                ThreadContext.putAll(context);
            }
            ThreadContext.put("stream", streamId.wireName());
            task.run();
        } finally {
            ThreadContext.clearAll();
            if (previous != null && !previous.isEmpty()) {
                ThreadContext.putAll(previous);
            }
        }
    }

    private void attempt(StreamId streamId, int attempt, long scheduledEpoch, ReopenAction action) {
        ReentrantLock lock = attemptLocks.get(streamId);
        if (!lock.tryLock()) {
            LOG.debug("Reconnect already in progress for {}", streamId);
            return;
        }
        try {
            if (scheduledEpoch != epoch.get()) {
                LOG.debug("Discarding stale reconnect attempt for {}", streamId);
                return;
            }
            try {
                action.reopen(streamId);
            } catch (RecognitionException e) {
                handleAttemptFailure(streamId, attempt, scheduledEpoch, action, e.isTransient(), e.getMessage());
                return;
            } catch (RuntimeException e) {
                handleAttemptFailure(streamId, attempt, scheduledEpoch, action, true, e.toString());
                return;
            }
            if (scheduledEpoch != epoch.get()) {
                return;
            }
            health.put(streamId, StreamHealth.HEALTHY);
            metrics.incrementReconnect(streamId, "success");
            LOG.info("Recognition stream {} reconnected after {} attempt(s)", streamId, attempt);
            publisher.publishEvent(new RecognitionSessionRecoveredEvent(streamId, attempt, clock.instant()));
        } finally {
            lock.unlock();
        }
    }

    private void handleAttemptFailure(StreamId streamId, int attempt, long scheduledEpoch,
                                      ReopenAction action, boolean transientFailure, String message) {
        if (scheduledEpoch != epoch.get()) {
            LOG.debug("Ignoring failure of stale reconnect attempt for {}: {}", streamId, message);
            return;
        }
        if (!transientFailure) {
            metrics.incrementReconnect(streamId, "fatal");
            markDisabled(streamId, message);
            return;
        }
        if (attempt >= maxAttempts) {
            metrics.incrementReconnect(streamId, "exhausted");
            markDisabled(streamId, "gave up after " + attempt + " attempts: " + message);
            return;
        }
        metrics.incrementReconnect(streamId, "retry");
        LOG.warn("Reconnect attempt {} for {} failed: {}", attempt, streamId, message);
        schedule(streamId, attempt + 1, scheduledEpoch, action);
    }
}

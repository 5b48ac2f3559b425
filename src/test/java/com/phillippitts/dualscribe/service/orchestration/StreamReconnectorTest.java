package com.phillippitts.dualscribe.service.orchestration;

import com.phillippitts.dualscribe.config.properties.RecognitionProperties;
import com.phillippitts.dualscribe.domain.StreamId;
import com.phillippitts.dualscribe.exception.AuthenticationException;
import com.phillippitts.dualscribe.exception.ConnectivityException;
import com.phillippitts.dualscribe.service.metrics.RecordingMetrics;
import com.phillippitts.dualscribe.service.orchestration.event.RecognitionSessionRecoveredEvent;
import com.phillippitts.dualscribe.testutil.EventCapturingPublisher;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Drives {@link StreamReconnector} with a scheduler mock that queues tasks, so each attempt runs
 * exactly when the test says.
 */
class StreamReconnectorTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);

    private final List<Runnable> scheduled = new ArrayList<>();
    private final List<Long> delays = new ArrayList<>();
    private ScheduledExecutorService scheduler;
    private EventCapturingPublisher publisher;
    private SimpleMeterRegistry registry;
    private StreamReconnector reconnector;

    @BeforeEach
    void setUp() {
        scheduler = mock(ScheduledExecutorService.class);
        when(scheduler.schedule(any(Runnable.class), anyLong(), eq(TimeUnit.MILLISECONDS))).thenAnswer(inv -> {
            scheduled.add(inv.getArgument(0));
            delays.add(inv.getArgument(1));
            return null;
        });
        publisher = new EventCapturingPublisher();
        registry = new SimpleMeterRegistry();
        reconnector = new StreamReconnector(new RecognitionProperties.Reconnect(3, 100L, 300L), scheduler,
                publisher, new RecordingMetrics(registry), CLOCK);
    }

    @AfterEach
    void clearContext() {
        ThreadContext.clearAll();
    }

    @Test
    void backoffDoublesAndIsCapped() {
        assertThat(reconnector.backoffMs(1)).isEqualTo(100);
        assertThat(reconnector.backoffMs(2)).isEqualTo(200);
        assertThat(reconnector.backoffMs(3)).isEqualTo(300);
        assertThat(reconnector.backoffMs(40)).isEqualTo(300);
    }

    @Test
    void nonTransientFailureDisablesImmediately() {
        reconnector.onFailure(StreamId.MICROPHONE, new AuthenticationException("bad key", StreamId.MICROPHONE),
                id -> { });

        assertThat(reconnector.health(StreamId.MICROPHONE)).isEqualTo(StreamHealth.DISABLED);
        assertThat(reconnector.health(StreamId.SYSTEM_AUDIO)).isEqualTo(StreamHealth.HEALTHY);
        assertThat(scheduled).isEmpty();
    }

    @Test
    void retriesUntilReopenSucceeds() {
        // Arrange
        AtomicInteger calls = new AtomicInteger();
        StreamReconnector.ReopenAction flaky = id -> {
            if (calls.incrementAndGet() == 1) {
                throw new ConnectivityException("still down", id);
            }
        };

        // Act
        reconnector.onFailure(StreamId.SYSTEM_AUDIO, new ConnectivityException("dropped", StreamId.SYSTEM_AUDIO), flaky);
        assertThat(reconnector.health(StreamId.SYSTEM_AUDIO)).isEqualTo(StreamHealth.RECONNECTING);
        runNext();
        runNext();

        // Assert
        assertThat(delays).containsExactly(100L, 200L);
        assertThat(reconnector.health(StreamId.SYSTEM_AUDIO)).isEqualTo(StreamHealth.HEALTHY);
        RecognitionSessionRecoveredEvent recovered = publisher.first(RecognitionSessionRecoveredEvent.class);
        assertThat(recovered).isNotNull();
        assertThat(recovered.streamId()).isEqualTo(StreamId.SYSTEM_AUDIO);
        assertThat(recovered.attempts()).isEqualTo(2);
        assertThat(recovered.at()).isEqualTo(CLOCK.instant());
        assertThat(registry.get("dualscribe.recording.reconnects").tag("outcome", "retry").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.get("dualscribe.recording.reconnects").tag("outcome", "success").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void disablesAfterMaxAttempts() {
        StreamReconnector.ReopenAction alwaysDown = id -> {
            throw new ConnectivityException("down", id);
        };

        reconnector.onFailure(StreamId.MICROPHONE, new ConnectivityException("dropped", StreamId.MICROPHONE), alwaysDown);
        runNext();
        runNext();
        runNext();

        assertThat(scheduled).isEmpty();
        assertThat(reconnector.health(StreamId.MICROPHONE)).isEqualTo(StreamHealth.DISABLED);
        assertThat(publisher.eventsOfType(RecognitionSessionRecoveredEvent.class)).isEmpty();
    }

    @Test
    void fatalErrorDuringAttemptDisablesStream() {
        reconnector.onFailure(StreamId.MICROPHONE, new ConnectivityException("dropped", StreamId.MICROPHONE), id -> {
            throw new AuthenticationException("revoked", id);
        });
        runNext();

        assertThat(scheduled).isEmpty();
        assertThat(reconnector.health(StreamId.MICROPHONE)).isEqualTo(StreamHealth.DISABLED);
    }

    @Test
    void repeatedFailureWhileReconnectingIsIgnored() {
        reconnector.onFailure(StreamId.MICROPHONE, new ConnectivityException("a", StreamId.MICROPHONE), id -> { });
        reconnector.onFailure(StreamId.MICROPHONE, new ConnectivityException("b", StreamId.MICROPHONE), id -> { });

        assertThat(scheduled).hasSize(1);
    }

    @Test
    void resetDiscardsAttemptsScheduledBeforeIt() {
        AtomicInteger calls = new AtomicInteger();
        reconnector.onFailure(StreamId.MICROPHONE, new ConnectivityException("dropped", StreamId.MICROPHONE),
                id -> calls.incrementAndGet());

        reconnector.reset();
        runNext();

        assertThat(calls).hasValue(0);
        assertThat(reconnector.snapshot()).containsValues(StreamHealth.HEALTHY, StreamHealth.HEALTHY);
        assertThat(publisher.eventsOfType(RecognitionSessionRecoveredEvent.class)).isEmpty();
    }

    @Test
    void rejectedSchedulingDisablesStream() {
        doThrow(new RejectedExecutionException("shut down"))
                .when(scheduler).schedule(any(Runnable.class), anyLong(), eq(TimeUnit.MILLISECONDS));

        reconnector.onFailure(StreamId.MICROPHONE, new ConnectivityException("dropped", StreamId.MICROPHONE), id -> { });

        assertThat(reconnector.health(StreamId.MICROPHONE)).isEqualTo(StreamHealth.DISABLED);
    }

    private void runNext() {
        assertThat(scheduled).as("a scheduled attempt").isNotEmpty();
        scheduled.remove(0).run();
    }

    @Test
    void reopenRunsWithSchedulingThreadContext() {
        AtomicReference<String> requestId = new AtomicReference<>();
        AtomicReference<String> stream = new AtomicReference<>();
        ThreadContext.put("requestId", "req-9");
        reconnector.onFailure(StreamId.SYSTEM_AUDIO, new ConnectivityException("dropped", StreamId.SYSTEM_AUDIO), id -> {
            requestId.set(ThreadContext.get("requestId"));
            stream.set(ThreadContext.get("stream"));
        });
        ThreadContext.clearAll();
        ThreadContext.put("worker", "reconnect-1");

        runNext();

        assertThat(requestId.get()).isEqualTo("req-9");
        assertThat(stream.get()).isEqualTo(StreamId.SYSTEM_AUDIO.wireName());
        assertThat(ThreadContext.get("requestId")).isNull();
        assertThat(ThreadContext.get("worker")).isEqualTo("reconnect-1");
    }
}

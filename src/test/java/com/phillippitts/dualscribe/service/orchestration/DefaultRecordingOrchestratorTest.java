package com.phillippitts.dualscribe.service.orchestration;

import com.phillippitts.dualscribe.config.properties.AudioCaptureProperties;
import com.phillippitts.dualscribe.config.properties.RecognitionProperties;
import com.phillippitts.dualscribe.domain.SessionSummary;
import com.phillippitts.dualscribe.domain.StreamId;
import com.phillippitts.dualscribe.domain.Transcript;
import com.phillippitts.dualscribe.exception.RecordingStartException;
import com.phillippitts.dualscribe.service.audio.SampleFormat;
import com.phillippitts.dualscribe.service.audio.capture.AudioSourceCapture;
import com.phillippitts.dualscribe.service.audio.capture.PushAudioSourceCapture;
import com.phillippitts.dualscribe.service.orchestration.event.RecognitionSessionRecoveredEvent;
import com.phillippitts.dualscribe.service.orchestration.event.RecordingStartedEvent;
import com.phillippitts.dualscribe.service.orchestration.event.RecordingStoppedEvent;
import com.phillippitts.dualscribe.service.recognition.RecognitionErrorKind;
import com.phillippitts.dualscribe.service.recognition.SessionState;
import com.phillippitts.dualscribe.service.transcript.DefaultTranscriptEngine;
import com.phillippitts.dualscribe.service.transcript.DuplicatePolicy;
import com.phillippitts.dualscribe.service.transcript.DuplicateSuppressor;
import com.phillippitts.dualscribe.service.transcript.TranscriptExporter;
import com.phillippitts.dualscribe.service.transcript.event.SessionEndedEvent;
import com.phillippitts.dualscribe.testutil.EventCapturingPublisher;
import com.phillippitts.dualscribe.testutil.FakeRecognitionClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

/**
 * Runs the orchestrator against push captures, a scripted recognizer and the real transcript engine.
 */
class DefaultRecordingOrchestratorTest {

    private static final Duration WAIT = Duration.ofSeconds(5);

    private final Clock clock = Clock.systemUTC();
    private FakeRecognitionClient client;
    private EventCapturingPublisher publisher;
    private Map<StreamId, PushAudioSourceCapture> captures;
    private DefaultTranscriptEngine engine;
    private ScheduledExecutorService scheduler;
    private DefaultRecordingOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        client = new FakeRecognitionClient();
        publisher = new EventCapturingPublisher();
        captures = new EnumMap<>(StreamId.class);
        for (StreamId id : StreamId.values()) {
            captures.put(id, new PushAudioSourceCapture(id, 50, publisher, clock));
        }
        engine = new DefaultTranscriptEngine(1000, 10, DuplicatePolicy.defaults(), new DuplicateSuppressor(),
                null, new TranscriptExporter(clock, 3000L, true), publisher, null, clock);
        scheduler = Executors.newSingleThreadScheduledExecutor();
        orchestrator = newOrchestrator(new EnumMap<>(captures));
    }

    @AfterEach
    void tearDown() {
        orchestrator.shutdown();
        scheduler.shutdownNow();
    }

    private DefaultRecordingOrchestrator newOrchestrator(Map<StreamId, AudioSourceCapture> sources) {
        AudioCaptureProperties.Source push = new AudioCaptureProperties.Source(AudioCaptureProperties.SourceMode.PUSH, null);
        AudioCaptureProperties captureProps = new AudioCaptureProperties(20, 50, push, push, null);
        RecognitionProperties recognitionProps = new RecognitionProperties(null, "en-US", true, 500L, 500L, 16,
                new RecognitionProperties.Reconnect(3, 10L, 50L), null, null);
        StreamReconnector reconnector = new StreamReconnector(recognitionProps.getReconnect(), scheduler,
                publisher, null, clock);
        return new DefaultRecordingOrchestrator(client, sources, captureProps, recognitionProps, CaptureMode.DUAL,
                0, 64, engine, reconnector, publisher, null, clock);
    }

    @Test
    void routesAudioAndFinalsForBothStreams() {
        // Arrange
        String sessionId = orchestrator.startRecording(RecordingOptions.defaults());

        // Act
        captures.get(StreamId.MICROPHONE).accept(new byte[640], SampleFormat.PCM_S16LE, 1, 16000);
        captures.get(StreamId.SYSTEM_AUDIO).accept(new byte[640], SampleFormat.PCM_S16LE, 1, 16000);
        await().atMost(WAIT).until(() -> client.handle(StreamId.MICROPHONE).sentBytes() == 640
                && client.handle(StreamId.SYSTEM_AUDIO).sentBytes() == 640);
        client.listener(StreamId.MICROPHONE).onFinal("can you hear me", 0.9, 100);
        client.listener(StreamId.SYSTEM_AUDIO).onFinal("yes loud and clear", 0.8, 200);
        await().atMost(WAIT).until(() -> engine.getSessionTranscripts().size() == 2);

        // Assert
        assertThat(orchestrator.isRecording()).isTrue();
        assertThat(engine.getSessionTranscripts()).extracting(Transcript::taggedText)
                .containsExactly("[Me] can you hear me", "[Other] yes loud and clear");
        RecordingStartedEvent started = publisher.first(RecordingStartedEvent.class);
        assertThat(started.sessionId()).isEqualTo(sessionId);
        assertThat(started.captureMode()).isEqualTo(CaptureMode.DUAL);
        assertThat(engine.currentSession()).get()
                .satisfies(s -> assertThat(s.metadata()).containsEntry("captureMode", "dual"));
    }

    @Test
    void stopSealsSessionWithFinalsFlushedOnClose() {
        orchestrator.startRecording(RecordingOptions.defaults());
        client.finalOnClose(StreamId.MICROPHONE, "last words");

        Optional<SessionSummary> summary = orchestrator.stopRecording();

        assertThat(summary).isPresent();
        assertThat(summary.get().totalTranscripts()).isEqualTo(1);
        assertThat(client.handle(StreamId.MICROPHONE).isClosed()).isTrue();
        assertThat(client.handle(StreamId.SYSTEM_AUDIO).isClosed()).isTrue();
        assertThat(captures.get(StreamId.MICROPHONE).isActive()).isFalse();
        assertThat(orchestrator.status().state()).isEqualTo(RecordingState.IDLE);
    }

    @Test
    void secondStopIsNoOp() {
        orchestrator.startRecording(RecordingOptions.defaults());

        orchestrator.stopRecording();
        Optional<SessionSummary> second = orchestrator.stopRecording();

        assertThat(second).isEmpty();
        assertThat(publisher.eventsOfType(SessionEndedEvent.class)).hasSize(1);
        assertThat(publisher.eventsOfType(RecordingStoppedEvent.class)).hasSize(1);
    }

    @Test
    void startWhileRecordingIsRejected() {
        orchestrator.startRecording(RecordingOptions.defaults());

        assertThatThrownBy(() -> orchestrator.startRecording(RecordingOptions.defaults()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("recording");
        assertThat(client.openCount(StreamId.MICROPHONE)).isEqualTo(1);
    }

    @Test
    void failedSecondOpenRollsBackFirstStream() {
        // Arrange
        client.failNextOpen(StreamId.SYSTEM_AUDIO, new IOException("connection refused"));

        // Act + Assert
        assertThatThrownBy(() -> orchestrator.startRecording(RecordingOptions.defaults()))
                .isInstanceOfSatisfying(RecordingStartException.class,
                        e -> assertThat(e.getFailedStreams()).containsExactly("system"));
        assertThat(client.handle(StreamId.MICROPHONE).isClosed()).isTrue();
        assertThat(captures.get(StreamId.MICROPHONE).isActive()).isFalse();
        assertThat(orchestrator.isRecording()).isFalse();
        assertThat(engine.getStatus().sessionActive()).isFalse();
        assertThat(publisher.eventsOfType(RecordingStartedEvent.class)).isEmpty();

        // A later start works once the recognizer recovers
        assertThat(orchestrator.startRecording(RecordingOptions.defaults())).isNotBlank();
    }

    @Test
    void missingCaptureFailsStartAndClosesSessions() {
        orchestrator.shutdown();
        Map<StreamId, AudioSourceCapture> micOnly = new EnumMap<>(StreamId.class);
        micOnly.put(StreamId.MICROPHONE, captures.get(StreamId.MICROPHONE));
        orchestrator = newOrchestrator(micOnly);

        assertThatThrownBy(() -> orchestrator.startRecording(RecordingOptions.defaults()))
                .isInstanceOf(RecordingStartException.class)
                .hasMessageContaining("No audio source configured for system");
        assertThat(client.handle(StreamId.MICROPHONE).isClosed()).isTrue();
    }

    @Test
    void microphoneOnlyModeOpensOneStream() {
        orchestrator.startRecording(new RecordingOptions(CaptureMode.MICROPHONE_ONLY, "de-DE", Map.of("topic", "standup")));

        assertThat(client.openCount(StreamId.MICROPHONE)).isEqualTo(1);
        assertThat(client.openCount(StreamId.SYSTEM_AUDIO)).isZero();
        assertThat(client.languages()).extracting(l -> l.language()).containsExactly("de-DE");
        assertThat(engine.currentSession()).get().satisfies(s -> assertThat(s.metadata())
                .containsEntry("captureMode", "microphone")
                .containsEntry("language", "de-DE")
                .containsEntry("topic", "standup"));
        RecordingStatus status = orchestrator.status();
        assertThat(status.captureMode()).isEqualTo(CaptureMode.MICROPHONE_ONLY);
        assertThat(status.streams().get(StreamId.SYSTEM_AUDIO).sessionState()).isEqualTo(SessionState.IDLE);
    }

    @Test
    void transientFailureReopensOnlyTheFailedStream() {
        orchestrator.startRecording(RecordingOptions.defaults());

        client.listener(StreamId.SYSTEM_AUDIO).onError(RecognitionErrorKind.CONNECTIVITY, "socket reset");

        await().atMost(WAIT).until(() -> publisher.first(RecognitionSessionRecoveredEvent.class) != null);
        assertThat(client.openCount(StreamId.SYSTEM_AUDIO)).isEqualTo(2);
        assertThat(client.openCount(StreamId.MICROPHONE)).isEqualTo(1);
        assertThat(orchestrator.isRecording()).isTrue();
        assertThat(orchestrator.status().streams().get(StreamId.SYSTEM_AUDIO).health()).isEqualTo(StreamHealth.HEALTHY);
    }

    @Test
    void toggleStartsThenStops() {
        RecordingStatus started = orchestrator.toggleRecording(null);
        assertThat(started.recording()).isTrue();
        assertThat(started.sessionId()).isNotNull();

        RecordingStatus stopped = orchestrator.toggleRecording(null);
        assertThat(stopped.recording()).isFalse();
        assertThat(publisher.eventsOfType(RecordingStoppedEvent.class)).hasSize(1);
    }

    @Test
    void stopWithoutRecordingReturnsEmpty() {
        assertThat(orchestrator.stopRecording()).isEmpty();
        assertThat(publisher.eventsOfType(RecordingStoppedEvent.class)).isEqualTo(List.of());
    }
}

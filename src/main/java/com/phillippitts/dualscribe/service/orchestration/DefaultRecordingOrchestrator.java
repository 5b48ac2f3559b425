package com.phillippitts.dualscribe.service.orchestration;

import com.phillippitts.dualscribe.config.properties.AudioCaptureProperties;
import com.phillippitts.dualscribe.config.properties.RecognitionProperties;
import com.phillippitts.dualscribe.domain.AudioFrame;
import com.phillippitts.dualscribe.domain.RecognitionResult;
import com.phillippitts.dualscribe.domain.SessionSummary;
import com.phillippitts.dualscribe.domain.StreamId;
import com.phillippitts.dualscribe.exception.RecognitionException;
import com.phillippitts.dualscribe.exception.RecordingStartException;
import com.phillippitts.dualscribe.service.audio.capture.AudioSourceCapture;
import com.phillippitts.dualscribe.service.audio.capture.SourceSpec;
import com.phillippitts.dualscribe.service.metrics.RecordingMetrics;
import com.phillippitts.dualscribe.service.orchestration.event.RecordingStartedEvent;
import com.phillippitts.dualscribe.service.orchestration.event.RecordingStoppedEvent;
import com.phillippitts.dualscribe.service.recognition.LanguageConfig;
import com.phillippitts.dualscribe.service.recognition.RecognitionClient;
import com.phillippitts.dualscribe.service.recognition.RecognitionSessionListener;
import com.phillippitts.dualscribe.service.recognition.StreamingRecognitionSession;
import com.phillippitts.dualscribe.service.transcript.TranscriptEngine;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Default {@link RecordingOrchestrator}: one {@link StreamPipeline} per stream, a single
 * {@link OrchestrationLoop} carrying frames and results, and a {@link StreamReconnector} for
 * transient mid-recording failures.
 *
 * <p><b>Routing:</b> capture dispatcher threads submit frames to the loop; the loop forwards each
 * frame verbatim to its stream's session. Session callbacks submit results to the loop, which
 * applies them to the {@link TranscriptEngine}. Opening and sealing the transcript session also
 * run on the loop, so the engine has a single writer while recording.
 *
 * <p><b>Failure Handling:</b> a start failure on any stream rolls back every stream already opened
 * and surfaces one {@link RecordingStartException}; secondary rollback failures are attached as
 * suppressed exceptions. A stream failing mid-recording never aborts the others. Stop always tears
 * everything down and logs, rather than throws, partial failures.
 */
public class DefaultRecordingOrchestrator implements RecordingOrchestrator {

    private static final Logger LOG = LogManager.getLogger(DefaultRecordingOrchestrator.class);

    private static final long CONTROL_TIMEOUT_MS = 10_000;

    private final Map<StreamId, StreamPipeline> pipelines = new EnumMap<>(StreamId.class);
    private final AudioCaptureProperties captureProps;
    private final RecognitionProperties recognitionProps;
    private final CaptureMode defaultMode;
    private final long stopGraceMs;
    private final TranscriptEngine engine;
    private final StreamReconnector reconnector;
    private final ApplicationEventPublisher publisher;
    private final RecordingMetrics metrics;
    private final Clock clock;
    private final RecordingStateMachine stateMachine = new RecordingStateMachine();
    private final OrchestrationLoop loop;
    private final Map<StreamId, Long> captureDropBaseline = new EnumMap<>(StreamId.class);

    private volatile List<StreamId> activeStreams = List.of();
    private volatile LanguageConfig activeLanguage;

    /**
     * @param client           recognizer used for every stream
     * @param captures         one capture per stream; only streams of the requested mode are used
     * @param captureProps     device selection
     * @param recognitionProps session timeouts and default language
     * @param defaultMode      mode used when a request does not specify one
     * @param stopGraceMs      wait for in-flight finals after the streams are closed
     * @param loopCapacity     orchestration queue capacity
     * @param engine           transcript engine
     * @param reconnector      mid-recording recovery
     * @param publisher        event sink
     * @param metrics          metrics sink, or {@code null}
     * @param clock            time source
     */
    public DefaultRecordingOrchestrator(RecognitionClient client,
                                        Map<StreamId, AudioSourceCapture> captures,
                                        AudioCaptureProperties captureProps,
                                        RecognitionProperties recognitionProps,
                                        CaptureMode defaultMode,
                                        long stopGraceMs,
                                        int loopCapacity,
                                        TranscriptEngine engine,
                                        StreamReconnector reconnector,
                                        ApplicationEventPublisher publisher,
                                        RecordingMetrics metrics,
                                        Clock clock) {
        Objects.requireNonNull(client, "client");
        this.captureProps = Objects.requireNonNull(captureProps, "captureProps");
        this.recognitionProps = Objects.requireNonNull(recognitionProps, "recognitionProps");
        this.defaultMode = defaultMode == null ? CaptureMode.DUAL : defaultMode;
        this.stopGraceMs = Math.max(0, stopGraceMs);
        this.engine = Objects.requireNonNull(engine, "engine");
        this.reconnector = Objects.requireNonNull(reconnector, "reconnector");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.metrics = metrics == null ? RecordingMetrics.NOOP : metrics;
        this.clock = Objects.requireNonNull(clock, "clock");

        RecognitionSessionListener sessionListener = new SessionListener();
        for (Map.Entry<StreamId, AudioSourceCapture> e : captures.entrySet()) {
            StreamId id = e.getKey();
            StreamingRecognitionSession session = new StreamingRecognitionSession(id, client, recognitionProps,
                    sessionListener, publisher, clock);
            pipelines.put(id, new StreamPipeline(id, e.getValue(), session));
        }
        this.loop = new OrchestrationLoop("orchestration-loop", loopCapacity, new LoopHandler());
        this.loop.start();
        LOG.info("Recording orchestrator ready: streams={}, recognizer={}, defaultMode={}",
                pipelines.keySet(), client.name(), this.defaultMode);
    }

    @Override
    public String startRecording(RecordingOptions options) {
        RecordingOptions opts = options == null ? RecordingOptions.defaults() : options;
        if (!stateMachine.beginStart()) {
            throw new IllegalStateException("Recording already " + stateMachine.state().name().toLowerCase(Locale.ROOT));
        }
        CaptureMode mode = opts.captureMode() == null ? defaultMode : opts.captureMode();
        LanguageConfig base = recognitionProps.defaultLanguage();
        LanguageConfig language = opts.language() == null ? base : new LanguageConfig(opts.language(), base.interimResults());
        List<StreamId> streams = mode.streams();

        List<StreamPipeline> opened = new ArrayList<>(streams.size());
        List<StreamPipeline> acquired = new ArrayList<>(streams.size());
        reconnector.reset();
        try {
            for (StreamId id : streams) {
                StreamPipeline p = pipeline(id);
                long t0 = System.nanoTime();
                p.session().open(language);
                metrics.recordSessionOpen(id, System.nanoTime() - t0);
                opened.add(p);
            }
            for (StreamId id : streams) {
                StreamPipeline p = pipeline(id);
                captureDropBaseline.put(id, p.capture().droppedFrames());
                p.capture().onFrame(loop::submitFrame);
                p.capture().acquire(new SourceSpec(id, captureProps.forStream(id).getDeviceName()));
                acquired.add(p);
            }
            activeStreams = streams;
            activeLanguage = language;
            Map<String, String> metadata = new LinkedHashMap<>();
            metadata.put("captureMode", mode.metadataValue());
            metadata.put("language", language.language());
            metadata.putAll(opts.metadata());
            String sessionId = await(loop.call("startSession", () -> engine.startSession(metadata)));
            Instant startedAt = clock.instant();
            stateMachine.markRecording(sessionId, startedAt, mode);
            LOG.info("Recording started: session={}, mode={}, language={}", sessionId, mode, language.language());
            publisher.publishEvent(new RecordingStartedEvent(sessionId, mode, startedAt));
            return sessionId;
        } catch (RuntimeException e) {
            RecordingStartException failure = startFailure(e, streams, opened, acquired);
            rollback(acquired, opened, failure);
            activeStreams = List.of();
            stateMachine.markIdle();
            LOG.error("Recording start failed: {}", failure.getMessage());
            throw failure;
        }
    }

    private RecordingStartException startFailure(RuntimeException cause, List<StreamId> streams,
                                                 List<StreamPipeline> opened, List<StreamPipeline> acquired) {
        List<String> failed = new ArrayList<>(1);
        String stage;
        if (opened.size() < streams.size()) {
            failed.add(streams.get(opened.size()).wireName());
            stage = "open recognition session for " + failed.get(0);
        } else if (acquired.size() < streams.size()) {
            failed.add(streams.get(acquired.size()).wireName());
            stage = "acquire audio source " + failed.get(0);
        } else {
            stage = "open transcript session";
        }
        return new RecordingStartException("Failed to " + stage + ": " + cause.getMessage(), failed, cause);
    }

    private void rollback(List<StreamPipeline> acquired, List<StreamPipeline> opened, RecordingStartException failure) {
        for (StreamPipeline p : acquired) {
            try {
                p.capture().release();
            } catch (RuntimeException e) {
                failure.addSuppressed(e);
            }
        }
        for (StreamPipeline p : opened) {
            try {
                p.session().close();
            } catch (RuntimeException e) {
                failure.addSuppressed(e);
            }
        }
        reconnector.reset();
    }

    @Override
    public Optional<SessionSummary> stopRecording() {
        if (!stateMachine.beginStop()) {
            LOG.debug("stopRecording ignored: state={}", stateMachine.state());
            return Optional.empty();
        }
        String sessionId = stateMachine.snapshot().sessionId();
        List<StreamId> streams = activeStreams;
        SessionSummary summary = null;
        try {
            reconnector.reset();
            for (StreamId id : streams) {
                StreamPipeline p = pipeline(id);
                try {
                    p.capture().release();
                } catch (RuntimeException e) {
                    LOG.warn("Failed to release {} capture: {}", id, e.toString());
                }
                metrics.incrementFramesDropped(id, "capture",
                        p.capture().droppedFrames() - captureDropBaseline.getOrDefault(id, 0L));
            }
            for (StreamId id : streams) {
                try {
                    pipeline(id).session().close();
                } catch (RuntimeException e) {
                    LOG.warn("Failed to close {} recognition session: {}", id, e.toString());
                }
            }
            awaitGracePeriod();
            try {
                summary = await(loop.call("endSession", engine::endSession)).orElse(null);
            } catch (RuntimeException e) {
                LOG.error("Failed to seal transcript session {}: {}", sessionId, e.toString());
            }
        } finally {
            activeStreams = List.of();
            activeLanguage = null;
            stateMachine.markIdle();
        }
        LOG.info("Recording stopped: session={}, transcripts={}", sessionId,
                summary == null ? 0 : summary.totalTranscripts());
        publisher.publishEvent(new RecordingStoppedEvent(sessionId, summary, clock.instant()));
        return Optional.ofNullable(summary);
    }

    private void awaitGracePeriod() {
        if (stopGraceMs == 0) {
            return;
        }
        try {
            Thread.sleep(stopGraceMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted during stop grace period; sealing early");
        }
    }

    @Override
    public RecordingStatus toggleRecording(RecordingOptions options) {
        if (stateMachine.isRecording()) {
            stopRecording();
        } else {
            startRecording(options);
        }
        return status();
    }

    @Override
    public boolean isRecording() {
        return stateMachine.isRecording();
    }

    @Override
    public RecordingStatus status() {
        RecordingStateMachine.Snapshot snap = stateMachine.snapshot();
        Map<StreamId, RecordingStatus.StreamStatus> streams = new EnumMap<>(StreamId.class);
        for (StreamPipeline p : pipelines.values()) {
            streams.put(p.streamId(), new RecordingStatus.StreamStatus(p.session().state(), p.capture().isActive(),
                    reconnector.health(p.streamId()), p.capture().droppedFrames(), p.session().droppedFrames()));
        }
        return new RecordingStatus(snap.state(), snap.sessionId(), snap.startedAt(), snap.captureMode(),
                streams, loop.droppedFrames());
    }

    /** Releases every source and session and stops the loop. */
    @PreDestroy
    public void shutdown() {
        if (stateMachine.isRecording()) {
            stopRecording();
        }
        loop.shutdown();
    }

    private StreamPipeline pipeline(StreamId id) {
        StreamPipeline p = pipelines.get(id);
        if (p == null) {
            throw new IllegalStateException("No audio source configured for " + id.wireName());
        }
        return p;
    }

    private static <T> T await(CompletableFuture<T> future) {
        try {
            return future.get(CONTROL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted waiting for orchestration loop", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            throw new IllegalStateException("Orchestration action failed", cause);
        } catch (TimeoutException e) {
            throw new IllegalStateException("Orchestration loop did not respond within " + CONTROL_TIMEOUT_MS + " ms", e);
        }
    }

    /** Reopens a stream on the reconnect scheduler; only while still recording. */
    private void reopen(StreamId id) {
        LanguageConfig language = activeLanguage;
        if (!stateMachine.isRecording() || language == null || !activeStreams.contains(id)) {
            LOG.debug("Skipping reopen of {}: not recording", id);
            return;
        }
        StreamingRecognitionSession session = pipeline(id).session();
        long t0 = System.nanoTime();
        session.open(language);
        metrics.recordSessionOpen(id, System.nanoTime() - t0);
        if (!stateMachine.isRecording()) {
            session.close();
        }
    }

    private final class SessionListener implements RecognitionSessionListener {

        @Override
        public void onResult(RecognitionResult result) {
            loop.submitResult(result);
        }

        @Override
        public void onSessionError(StreamId streamId, RecognitionException error) {
            if (!stateMachine.isRecording() || !activeStreams.contains(streamId)) {
                LOG.debug("Session error on {} outside recording: {}", streamId, error.getMessage());
                return;
            }
            reconnector.onFailure(streamId, error, DefaultRecordingOrchestrator.this::reopen);
        }
    }

    private final class LoopHandler implements OrchestrationLoop.Handler {

        @Override
        public void onFrame(AudioFrame frame) {
            StreamPipeline p = pipelines.get(frame.sourceId());
            if (p == null) {
                return;
            }
            if (!p.session().pushFrame(frame)) {
                metrics.incrementFramesDropped(frame.sourceId(), "session", 1);
            }
        }

        @Override
        public void onResult(RecognitionResult result) {
            if (result.isFinal()) {
                engine.addFinal(result.streamId(), result.text(), result.confidence(), result.timestampMs());
            } else {
                engine.addInterim(result.streamId(), result.text(), result.timestampMs());
            }
        }
    }
}

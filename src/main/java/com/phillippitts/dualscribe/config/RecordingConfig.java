package com.phillippitts.dualscribe.config;

import com.phillippitts.dualscribe.config.properties.AudioCaptureProperties;
import com.phillippitts.dualscribe.config.properties.RecognitionProperties;
import com.phillippitts.dualscribe.config.properties.RecordingProperties;
import com.phillippitts.dualscribe.config.properties.TranscriptProperties;
import com.phillippitts.dualscribe.domain.StreamId;
import com.phillippitts.dualscribe.service.audio.capture.AudioDeviceCatalog;
import com.phillippitts.dualscribe.service.audio.capture.AudioSourceCapture;
import com.phillippitts.dualscribe.service.audio.capture.AudioSourceRegistry;
import com.phillippitts.dualscribe.service.audio.capture.JavaSoundAudioSourceCapture;
import com.phillippitts.dualscribe.service.audio.capture.JavaSoundDeviceCatalog;
import com.phillippitts.dualscribe.service.audio.capture.PushAudioSourceCapture;
import com.phillippitts.dualscribe.service.health.RecognitionHealthIndicator;
import com.phillippitts.dualscribe.service.metrics.RecordingMetrics;
import com.phillippitts.dualscribe.service.orchestration.DefaultRecordingOrchestrator;
import com.phillippitts.dualscribe.service.orchestration.RecordingOrchestrator;
import com.phillippitts.dualscribe.service.orchestration.StreamReconnector;
import com.phillippitts.dualscribe.service.recognition.RecognitionClient;
import com.phillippitts.dualscribe.service.recognition.remote.WebSocketRecognitionClient;
import com.phillippitts.dualscribe.service.recognition.vosk.VoskRecognitionClient;
import com.phillippitts.dualscribe.service.transcript.DefaultTranscriptEngine;
import com.phillippitts.dualscribe.service.transcript.DuplicateSuppressor;
import com.phillippitts.dualscribe.service.transcript.JsonFileSessionStore;
import com.phillippitts.dualscribe.service.transcript.SessionAutoSaver;
import com.phillippitts.dualscribe.service.transcript.SessionStore;
import com.phillippitts.dualscribe.service.transcript.TranscriptEngine;
import com.phillippitts.dualscribe.service.transcript.TranscriptExporter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.Executor;

/**
 * Wires the recording pipeline: audio sources, recognizer, transcript engine and orchestrator.
 *
 * <p>Every component receives its configuration value at construction; nothing reads global state.
 */
@Configuration
public class RecordingConfig {

    private static final Logger LOG = LogManager.getLogger(RecordingConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    /**
     * Recognizer selected by {@code recognition.provider}.
     *
     * @throws IllegalStateException if REMOTE is selected without {@code recognition.remote.url}
     */
    @Bean(destroyMethod = "close")
    public RecognitionClient recognitionClient(RecognitionProperties props,
                                               @Qualifier("recognitionExecutor") Executor recognitionExecutor,
                                               Clock clock) {
        return switch (props.getProvider()) {
            case VOSK -> {
                LOG.info("Using local Vosk recognizer (model={})", props.getVosk().getModelPath());
                yield new VoskRecognitionClient(props.getVosk().getModelPath(), recognitionExecutor, clock);
            }
            case REMOTE -> {
                String url = props.getRemote().getUrl();
                if (url == null || url.isBlank()) {
                    throw new IllegalStateException("recognition.remote.url is required when recognition.provider=REMOTE");
                }
                Duration timeout = Duration.ofMillis(props.getOpenTimeoutMs());
                HttpClient http = HttpClient.newBuilder()
                        .connectTimeout(timeout)
                        .executor(recognitionExecutor)
                        .build();
                LOG.info("Using remote recognizer at {}", url);
                yield new WebSocketRecognitionClient(URI.create(url), props.getRemote().getApiKey(), http, timeout, clock);
            }
        };
    }

    @Bean
    public AudioDeviceCatalog audioDeviceCatalog(AudioCaptureProperties props) {
        return new JavaSoundDeviceCatalog(props);
    }

    /** One source per stream, Java Sound or push-fed according to {@code audio.capture.<stream>.mode}. */
    @Bean
    public AudioSourceRegistry audioSourceRegistry(AudioCaptureProperties props,
                                                   ApplicationEventPublisher publisher,
                                                   Clock clock) {
        Map<StreamId, AudioSourceCapture> sources = new EnumMap<>(StreamId.class);
        for (StreamId id : StreamId.values()) {
            AudioSourceCapture source = switch (props.forStream(id).getMode()) {
                case JAVA_SOUND -> new JavaSoundAudioSourceCapture(id, props.bytesPerChunk(),
                        props.getQueueCapacity(), publisher, clock);
                case PUSH -> new PushAudioSourceCapture(id, props.getQueueCapacity(), publisher, clock);
            };
            sources.put(id, source);
            LOG.info("Audio source for {}: {}", id.wireName(), props.forStream(id).getMode());
        }
        return new AudioSourceRegistry(sources);
    }

    @Bean
    public SessionStore sessionStore(TranscriptProperties props, Clock clock) {
        return new JsonFileSessionStore(props.saveDirectoryPath(), clock);
    }

    @Bean
    public TranscriptExporter transcriptExporter(TranscriptProperties props, Clock clock) {
        return new TranscriptExporter(clock, props.getSubtitleDefaultDurationMs(), props.isSpeakerTagging());
    }

    @Bean
    public TranscriptEngine transcriptEngine(TranscriptProperties props,
                                             SessionStore sessionStore,
                                             TranscriptExporter exporter,
                                             ApplicationEventPublisher publisher,
                                             RecordingMetrics metrics,
                                             Clock clock) {
        return new DefaultTranscriptEngine(props.getMaxBufferSize(), props.getUpdatedWindow(),
                props.toDuplicatePolicy(), new DuplicateSuppressor(), sessionStore, exporter,
                publisher, metrics, clock);
    }

    @Bean
    public SessionAutoSaver sessionAutoSaver(TranscriptEngine engine, TranscriptProperties props) {
        return new SessionAutoSaver(engine, props.isAutoSave());
    }

    @Bean
    public StreamReconnector streamReconnector(RecognitionProperties props,
                                               @Qualifier("reconnectScheduler") ThreadPoolTaskScheduler scheduler,
                                               ApplicationEventPublisher publisher,
                                               RecordingMetrics metrics,
                                               Clock clock) {
        return new StreamReconnector(props.getReconnect(), scheduler.getScheduledExecutor(), publisher, metrics, clock);
    }

    @Bean
    public RecordingOrchestrator recordingOrchestrator(RecognitionClient client,
                                                       AudioSourceRegistry sources,
                                                       AudioCaptureProperties captureProps,
                                                       RecognitionProperties recognitionProps,
                                                       RecordingProperties recordingProps,
                                                       TranscriptEngine engine,
                                                       StreamReconnector reconnector,
                                                       ApplicationEventPublisher publisher,
                                                       RecordingMetrics metrics,
                                                       Clock clock) {
        return new DefaultRecordingOrchestrator(client, sources.all(), captureProps, recognitionProps,
                recordingProps.getCaptureMode(), recordingProps.getStopGraceMs(),
                recordingProps.getLoopQueueCapacity(), engine, reconnector, publisher, metrics, clock);
    }

    @Bean
    public RecognitionHealthIndicator recognitionHealthIndicator(RecognitionClient client,
                                                                 StreamReconnector reconnector) {
        return new RecognitionHealthIndicator(client, reconnector);
    }
}

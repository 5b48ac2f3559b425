package com.phillippitts.dualscribe.service.recognition.vosk;

import com.phillippitts.dualscribe.domain.StreamId;
import com.phillippitts.dualscribe.exception.ModelNotFoundException;
import com.phillippitts.dualscribe.exception.RecognitionException;
import com.phillippitts.dualscribe.service.audio.AudioFormat;
import com.phillippitts.dualscribe.service.recognition.LanguageConfig;
import com.phillippitts.dualscribe.service.recognition.RecognitionClient;
import com.phillippitts.dualscribe.service.recognition.RecognitionHandle;
import com.phillippitts.dualscribe.service.recognition.RecognitionListener;
import com.phillippitts.dualscribe.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Local streaming recognizer backed by the Vosk offline speech library.
 *
 * <p>One {@link org.vosk.Model} is loaded lazily on the first open and shared by all streams;
 * every open creates its own {@link org.vosk.Recognizer}. Partial results become interim events,
 * endpointed results become finals whose confidence is the mean per-word confidence.
 *
 * <p>The language of the session is determined by the model on disk; the requested language is
 * only logged.
 */
public class VoskRecognitionClient implements RecognitionClient {

    private static final Logger LOG = LogManager.getLogger(VoskRecognitionClient.class);

    private final String modelPath;
    private final Executor executor;
    private final Clock clock;

    private final Object lock = new Object();
    // @GuardedBy("lock")
    private org.vosk.Model model;           // JNI resource

    public VoskRecognitionClient(String modelPath, Executor executor, Clock clock) {
        this.modelPath = Objects.requireNonNull(modelPath, "modelPath");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public String name() {
        return "vosk";
    }

    @Override
    public boolean isAvailable() {
        return Files.isDirectory(Path.of(modelPath));
    }

    @Override
    public CompletableFuture<RecognitionHandle> open(StreamId streamId, LanguageConfig language,
                                                     RecognitionListener listener) {
        return CompletableFuture.supplyAsync(() -> {
            org.vosk.Model m = loadModel();
            try {
                org.vosk.Recognizer recognizer = new org.vosk.Recognizer(m, AudioFormat.REQUIRED_SAMPLE_RATE);
                recognizer.setWords(true);
                LOG.debug("Vosk recognizer created for {} (requested language={})",
                        streamId.wireName(), language.language());
                return new VoskHandle(streamId, recognizer, listener, language.interimResults(), clock);
            } catch (IOException e) {
                throw new RecognitionException("Failed to create Vosk recognizer: " + e.getMessage(), streamId, e);
            }
        }, executor);
    }

    private org.vosk.Model loadModel() {
        synchronized (lock) {
            if (model != null) {
                return model;
            }
            if (!isAvailable()) {
                throw new ModelNotFoundException(modelPath);
            }
            LOG.info("Loading Vosk model from {}", modelPath);
            try {
                model = new org.vosk.Model(modelPath);
            } catch (IOException e) {
                throw new ModelNotFoundException(modelPath, e);
            } catch (LinkageError e) {
                throw new RecognitionException("Vosk native library unavailable: " + e.getMessage(), null, e);
            }
            LOG.info("Vosk model loaded");
            return model;
        }
    }

    @Override
    public void close() {
        synchronized (lock) {
            if (model != null) {
                try {
                    model.close();
                } catch (RuntimeException e) {
                    LOG.warn("Error closing Vosk model", e);
                }
                model = null;
                LOG.info("Vosk model released");
            }
        }
    }

    /**
     * One recognizer per stream. Calls are serialized by the session's sender thread;
     * {@code synchronized} guards the close racing a late send.
     */
    static final class VoskHandle implements RecognitionHandle {

        private final StreamId streamId;
        private final org.vosk.Recognizer recognizer;
        private final RecognitionListener listener;
        private final boolean interimResults;
        private final Clock clock;
        private String lastPartial = "";
        private boolean closed;

        VoskHandle(StreamId streamId, org.vosk.Recognizer recognizer, RecognitionListener listener,
                   boolean interimResults, Clock clock) {
            this.streamId = streamId;
            this.recognizer = recognizer;
            this.listener = listener;
            this.interimResults = interimResults;
            this.clock = clock;
        }

        @Override
        public synchronized void send(byte[] pcm) {
            if (closed) {
                return;
            }
            if (recognizer.acceptWaveForm(pcm, pcm.length)) {
                emitFinal(recognizer.getResult());
            } else if (interimResults) {
                String partial = VoskResultParser.parsePartial(recognizer.getPartialResult());
                if (!partial.isEmpty() && !partial.equals(lastPartial)) {
                    lastPartial = partial;
                    listener.onInterim(partial, clock.millis());
                }
            }
        }

        @Override
        public synchronized CompletableFuture<Void> close() {
            if (closed) {
                return CompletableFuture.completedFuture(null);
            }
            closed = true;
            try {
                emitFinal(recognizer.getFinalResult());
                return CompletableFuture.completedFuture(null);
            } catch (RuntimeException e) {
                return CompletableFuture.failedFuture(e);
            } finally {
                recognizer.close();
            }
        }

        private void emitFinal(String json) {
            VoskResultParser.VoskResult result = VoskResultParser.parse(json);
            lastPartial = "";
            if (!result.text().isEmpty()) {
                LOG.debug("Vosk final for {}: '{}' conf={}", streamId.wireName(),
                        LogSanitizer.preview(result.text()), result.confidence());
                listener.onFinal(result.text(), result.confidence(), clock.millis());
            }
        }
    }
}

package com.phillippitts.dualscribe.config.properties;

import com.phillippitts.dualscribe.service.recognition.LanguageConfig;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for streaming recognition sessions and their provider.
 */
@Validated
@ConfigurationProperties(prefix = "recognition")
public class RecognitionProperties {

    public enum Provider { VOSK, REMOTE }

    @NotNull
    private final Provider provider;

    /** BCP-47 language tag passed to the recognizer. */
    private final String language;

    /** Whether interim (partial) hypotheses are requested. */
    private final boolean interimResults;

    /** Upper bound for {@code open}; start never hangs longer than this per stream. */
    @Min(100)
    @Max(60_000)
    private final long openTimeoutMs;

    /** Upper bound for the flush performed by {@code close}. */
    @Min(100)
    @Max(60_000)
    private final long closeTimeoutMs;

    /** Frames buffered between {@code pushFrame} and the network send loop. */
    @Min(1)
    private final int sendQueueCapacity;

    private final Reconnect reconnect;
    private final Vosk vosk;
    private final Remote remote;

    @ConstructorBinding
    public RecognitionProperties(Provider provider,
                                 String language,
                                 Boolean interimResults,
                                 Long openTimeoutMs,
                                 Long closeTimeoutMs,
                                 Integer sendQueueCapacity,
                                 Reconnect reconnect,
                                 Vosk vosk,
                                 Remote remote) {
        this.provider = provider == null ? Provider.VOSK : provider;
        this.language = (language == null || language.isBlank()) ? "en-US" : language;
        this.interimResults = interimResults == null || interimResults;
        this.openTimeoutMs = openTimeoutMs == null ? 5000L : openTimeoutMs;
        this.closeTimeoutMs = closeTimeoutMs == null ? 3000L : closeTimeoutMs;
        this.sendQueueCapacity = sendQueueCapacity == null ? 100 : sendQueueCapacity;
        if (this.openTimeoutMs <= 0 || this.closeTimeoutMs <= 0) {
            throw new IllegalArgumentException("recognition timeouts must be positive");
        }
        this.reconnect = reconnect == null ? new Reconnect(null, null, null) : reconnect;
        this.vosk = vosk == null ? new Vosk(null) : vosk;
        this.remote = remote == null ? new Remote(null, null) : remote;
    }

    public Provider getProvider() { return provider; }
    public String getLanguage() { return language; }
    public boolean isInterimResults() { return interimResults; }
    public long getOpenTimeoutMs() { return openTimeoutMs; }
    public long getCloseTimeoutMs() { return closeTimeoutMs; }
    public int getSendQueueCapacity() { return sendQueueCapacity; }
    public Reconnect getReconnect() { return reconnect; }
    public Vosk getVosk() { return vosk; }
    public Remote getRemote() { return remote; }

    /** Language settings used when a recording does not override the language. */
    public LanguageConfig defaultLanguage() {
        return new LanguageConfig(language, interimResults);
    }

    /**
     * Bounded exponential backoff for reopening a stream after a transient failure.
     */
    public static class Reconnect {
        private final int maxAttempts;
        private final long initialBackoffMs;
        private final long maxBackoffMs;

        public Reconnect(Integer maxAttempts, Long initialBackoffMs, Long maxBackoffMs) {
            this.maxAttempts = maxAttempts == null ? 3 : maxAttempts;
            this.initialBackoffMs = initialBackoffMs == null ? 500L : initialBackoffMs;
            this.maxBackoffMs = maxBackoffMs == null ? 8000L : maxBackoffMs;
            if (this.maxAttempts < 0) {
                throw new IllegalArgumentException("recognition.reconnect.max-attempts must be >= 0");
            }
            if (this.initialBackoffMs < 0 || this.maxBackoffMs < this.initialBackoffMs) {
                throw new IllegalArgumentException(
                        "recognition.reconnect backoff must satisfy 0 <= initial <= max");
            }
        }

        public int getMaxAttempts() { return maxAttempts; }
        public long getInitialBackoffMs() { return initialBackoffMs; }
        public long getMaxBackoffMs() { return maxBackoffMs; }
    }

    /** Local Vosk model settings. */
    public static class Vosk {
        private final String modelPath;

        public Vosk(String modelPath) {
            this.modelPath = (modelPath == null || modelPath.isBlank())
                    ? "models/vosk-model-small-en-us-0.15" : modelPath;
        }

        public String getModelPath() { return modelPath; }
    }

    /** Remote websocket recognizer settings. */
    public static class Remote {
        private final String url;
        private final String apiKey;

        public Remote(String url, String apiKey) {
            this.url = (url == null || url.isBlank()) ? null : url;
            this.apiKey = (apiKey == null || apiKey.isBlank()) ? null : apiKey;
        }

        public String getUrl() { return url; }
        public String getApiKey() { return apiKey; }
    }
}

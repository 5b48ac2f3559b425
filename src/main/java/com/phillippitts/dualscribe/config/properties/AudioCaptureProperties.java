package com.phillippitts.dualscribe.config.properties;

import com.phillippitts.dualscribe.domain.StreamId;
import com.phillippitts.dualscribe.service.audio.AudioFormat;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.util.List;
import java.util.Locale;

/**
 * Typed properties for the two audio sources.
 *
 * Required format (enforced by the capture layer): 16 kHz, 16-bit PCM, mono, little-endian.
 */
@Validated
@ConfigurationProperties(prefix = "audio.capture")
public class AudioCaptureProperties {

    /** How a source obtains audio. */
    public enum SourceMode {
        /** Read from a Java Sound {@code TargetDataLine} on a named (or the default) mixer. */
        JAVA_SOUND,
        /** Audio is pushed in by an external host over the REST ingest endpoint. */
        PUSH
    }

    private static final List<String> DEFAULT_LOOPBACK_HINTS =
            List.of("blackhole", "loopback", "stereo mix", "soundflower", "monitor");

    /** Size of one frame in milliseconds. */
    @Min(10)
    @Max(200)
    private final int chunkMillis;

    /** Maximum frames buffered between a source and its consumer before the oldest are dropped. */
    @Min(1)
    @Max(10_000)
    private final int queueCapacity;

    private final Source microphone;
    private final Source system;

    /** Lowercase mixer name fragments that identify loopback (system audio) devices. */
    private final List<String> loopbackHints;

    @ConstructorBinding
    public AudioCaptureProperties(Integer chunkMillis,
                                  Integer queueCapacity,
                                  Source microphone,
                                  Source system,
                                  List<String> loopbackHints) {
        this.chunkMillis = chunkMillis == null ? 20 : chunkMillis;
        this.queueCapacity = queueCapacity == null ? 50 : queueCapacity;
        if (this.queueCapacity < 1) {
            throw new IllegalArgumentException("audio.capture.queue-capacity must be >= 1");
        }
        this.microphone = microphone == null ? new Source(SourceMode.JAVA_SOUND, null) : microphone;
        this.system = system == null ? new Source(SourceMode.JAVA_SOUND, null) : system;
        this.loopbackHints = (loopbackHints == null || loopbackHints.isEmpty())
                ? DEFAULT_LOOPBACK_HINTS
                : loopbackHints.stream().map(h -> h.trim().toLowerCase(Locale.ROOT)).toList();
    }

    public int getChunkMillis() { return chunkMillis; }
    public int getQueueCapacity() { return queueCapacity; }
    public Source getMicrophone() { return microphone; }
    public Source getSystem() { return system; }
    public List<String> getLoopbackHints() { return loopbackHints; }

    /** Settings of the source feeding the given stream. */
    public Source forStream(StreamId streamId) {
        return switch (streamId) {
            case MICROPHONE -> microphone;
            case SYSTEM_AUDIO -> system;
        };
    }

    /** Bytes of canonical PCM per frame. */
    public int bytesPerChunk() {
        return AudioFormat.bytesForMillis(chunkMillis);
    }

    /**
     * Per-source settings.
     */
    public static class Source {

        private final SourceMode mode;

        /** Optional mixer name; falls back to the system default input when null/blank. */
        private final String deviceName;

        public Source(SourceMode mode, String deviceName) {
            this.mode = mode == null ? SourceMode.JAVA_SOUND : mode;
            this.deviceName = (deviceName == null || deviceName.isBlank()) ? null : deviceName;
        }

        public SourceMode getMode() { return mode; }
        public String getDeviceName() { return deviceName; }
    }
}

package com.phillippitts.dualscribe.config.properties;

import com.phillippitts.dualscribe.service.orchestration.CaptureMode;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for recording sessions.
 */
@Validated
@ConfigurationProperties(prefix = "recording")
public class RecordingProperties {

    private final CaptureMode captureMode;

    /** Time allowed for in-flight final results after the streams are closed. */
    @Min(0)
    @Max(30_000)
    private final long stopGraceMs;

    /** Capacity of the single-writer orchestration queue. */
    @Min(16)
    private final int loopQueueCapacity;

    @ConstructorBinding
    public RecordingProperties(CaptureMode captureMode, Long stopGraceMs, Integer loopQueueCapacity) {
        this.captureMode = captureMode == null ? CaptureMode.DUAL : captureMode;
        this.stopGraceMs = stopGraceMs == null ? 1000L : stopGraceMs;
        if (this.stopGraceMs < 0) {
            throw new IllegalArgumentException("recording.stop-grace-ms must be >= 0");
        }
        this.loopQueueCapacity = loopQueueCapacity == null ? 10_000 : loopQueueCapacity;
    }

    public CaptureMode getCaptureMode() { return captureMode; }
    public long getStopGraceMs() { return stopGraceMs; }
    public int getLoopQueueCapacity() { return loopQueueCapacity; }
}

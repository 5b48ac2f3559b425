package com.phillippitts.dualscribe.service.orchestration;

import java.util.Map;

/**
 * Per-recording overrides. Null fields fall back to configuration.
 *
 * @param captureMode streams to capture, or {@code null} for {@code recording.capture-mode}
 * @param language    recognizer language tag, or {@code null} for {@code recognition.language}
 * @param metadata    extra metadata stored with the transcript session
 */
public record RecordingOptions(CaptureMode captureMode, String language, Map<String, String> metadata) {

    public RecordingOptions {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
        language = (language == null || language.isBlank()) ? null : language;
    }

    public static RecordingOptions defaults() {
        return new RecordingOptions(null, null, Map.of());
    }
}

package com.phillippitts.dualscribe.domain;

import java.util.Objects;

/**
 * One interim or final hypothesis emitted by a streaming recognizer for a single stream.
 *
 * <p>Confidence is clamped to [0, 1]; interim results carry a confidence of 0.
 */
public record RecognitionResult(StreamId streamId, String text, boolean isFinal, double confidence,
                                long timestampMs) {

    public RecognitionResult {
        Objects.requireNonNull(streamId, "streamId");
        text = text == null ? "" : text;
        if (Double.isNaN(confidence)) {
            confidence = 0.0;
        }
        confidence = Math.min(1.0, Math.max(0.0, confidence));
    }

    public static RecognitionResult interim(StreamId streamId, String text, long timestampMs) {
        return new RecognitionResult(streamId, text, false, 0.0, timestampMs);
    }

    public static RecognitionResult finalResult(StreamId streamId, String text, double confidence, long timestampMs) {
        return new RecognitionResult(streamId, text, true, confidence, timestampMs);
    }
}

package com.phillippitts.dualscribe.domain;

import java.util.Objects;

/**
 * Immutable transcript entry owned by the transcript engine.
 *
 * <p>The speaker label is always derived from the stream, so a transcript can never
 * carry a label that disagrees with its source.
 *
 * @param id          unique id within the process
 * @param sessionId   id of the recording session the entry belongs to
 * @param streamId    stream that produced the text
 * @param speaker     speaker label, fixed by {@link StreamId#speakerLabel()}
 * @param text        trimmed recognized text, never blank
 * @param confidence  recognizer confidence in [0, 1]
 * @param timestampMs recognizer timestamp in epoch milliseconds
 * @param kind        interim or final
 */
public record Transcript(String id,
                         String sessionId,
                         StreamId streamId,
                         String speaker,
                         String text,
                         double confidence,
                         long timestampMs,
                         TranscriptKind kind) {

    public Transcript {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(streamId, "streamId");
        Objects.requireNonNull(kind, "kind");
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Transcript text must not be blank");
        }
        if (confidence < 0.0 || confidence > 1.0 || Double.isNaN(confidence)) {
            throw new IllegalArgumentException("confidence must be within [0,1], got " + confidence);
        }
        if (!streamId.speakerLabel().equals(speaker)) {
            throw new IllegalArgumentException("speaker '" + speaker + "' does not match stream " + streamId);
        }
    }

    /**
     * Creates a final transcript; the speaker label is filled in from the stream.
     */
    public static Transcript finalOf(String id, String sessionId, StreamId streamId, String text,
                                     double confidence, long timestampMs) {
        return new Transcript(id, sessionId, streamId, streamId.speakerLabel(), text.trim(),
                confidence, timestampMs, TranscriptKind.FINAL);
    }

    /** Text prefixed with the speaker tag, e.g. {@code [Me] hello}. */
    public String taggedText() {
        return "[" + speaker + "] " + text;
    }

    /** Number of whitespace-separated words in the text. */
    public int wordCount() {
        return text.trim().split("\\s+").length;
    }
}

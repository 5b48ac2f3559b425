package com.phillippitts.dualscribe.domain;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Snapshot of one recording interval.
 *
 * @param id          session id
 * @param startTime   when the session was opened
 * @param endTime     when it was sealed, {@code null} while active
 * @param transcripts final transcripts in log order
 * @param metadata    caller-supplied metadata (capture mode, language, ...)
 */
public record TranscriptSession(String id,
                                Instant startTime,
                                Instant endTime,
                                List<Transcript> transcripts,
                                Map<String, String> metadata) {

    public TranscriptSession {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(startTime, "startTime");
        transcripts = transcripts == null ? List.of() : List.copyOf(transcripts);
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public boolean isActive() {
        return endTime == null;
    }

    public TranscriptSession withTranscripts(List<Transcript> snapshot) {
        return new TranscriptSession(id, startTime, endTime, snapshot, metadata);
    }

    public TranscriptSession seal(Instant end, List<Transcript> finalTranscripts) {
        return new TranscriptSession(id, startTime, end, finalTranscripts, metadata);
    }
}

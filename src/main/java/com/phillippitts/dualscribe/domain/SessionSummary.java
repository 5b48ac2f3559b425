package com.phillippitts.dualscribe.domain;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregate statistics computed when a session is sealed (or on demand for an active one).
 *
 * @param sessionId         session the summary describes
 * @param startTime         session start
 * @param endTime           session end, or the computation time for an active session
 * @param totalTranscripts  number of final transcripts retained
 * @param wordCount         total words across all transcripts
 * @param averageConfidence mean confidence, 0 when there are no transcripts
 * @param duration          endTime minus startTime
 * @param speakers          per-speaker breakdown in first-seen order
 */
public record SessionSummary(String sessionId,
                             Instant startTime,
                             Instant endTime,
                             int totalTranscripts,
                             int wordCount,
                             double averageConfidence,
                             Duration duration,
                             List<SpeakerStats> speakers) {

    public SessionSummary {
        speakers = speakers == null ? List.of() : List.copyOf(speakers);
    }

    /** Per-speaker counts. */
    public record SpeakerStats(String speaker, int transcriptCount, int wordCount) { }

    /**
     * Builds a summary over the given transcripts.
     */
    public static SessionSummary of(String sessionId, Instant startTime, Instant endTime,
                                    List<Transcript> transcripts) {
        Map<String, int[]> perSpeaker = new LinkedHashMap<>();
        int words = 0;
        double confidenceSum = 0.0;
        for (Transcript t : transcripts) {
            int w = t.wordCount();
            words += w;
            confidenceSum += t.confidence();
            int[] counts = perSpeaker.computeIfAbsent(t.speaker(), k -> new int[2]);
            counts[0]++;
            counts[1] += w;
        }
        List<SpeakerStats> stats = new ArrayList<>(perSpeaker.size());
        perSpeaker.forEach((speaker, c) -> stats.add(new SpeakerStats(speaker, c[0], c[1])));
        double avg = transcripts.isEmpty() ? 0.0 : confidenceSum / transcripts.size();
        Duration duration = endTime == null ? Duration.ZERO : Duration.between(startTime, endTime);
        return new SessionSummary(sessionId, startTime, endTime, transcripts.size(), words, avg, duration, stats);
    }
}

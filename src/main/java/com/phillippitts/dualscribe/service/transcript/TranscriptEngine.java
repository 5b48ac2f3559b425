package com.phillippitts.dualscribe.service.transcript;

import com.phillippitts.dualscribe.domain.InterimTranscript;
import com.phillippitts.dualscribe.domain.SessionSummary;
import com.phillippitts.dualscribe.domain.StreamId;
import com.phillippitts.dualscribe.domain.Transcript;
import com.phillippitts.dualscribe.domain.TranscriptSession;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Owns the authoritative, deduplicated transcript log of the active session.
 *
 * <p>Mutators are expected to be called from a single writer (the orchestration loop) while
 * recording; implementations still guard their state so queries are safe from any thread.
 * Invalid input (blank text) is ignored and logged, never thrown.
 */
public interface TranscriptEngine {

    /**
     * Seals any open session, clears the log and interim state, and opens a new session.
     *
     * @param metadata caller-supplied metadata stored with the session
     * @return id of the new session
     */
    String startSession(Map<String, String> metadata);

    /**
     * Seals and persists the active session.
     *
     * @return summary of the sealed session, or empty if none was active
     */
    Optional<SessionSummary> endSession();

    /** Replaces the live hypothesis of {@code streamId}. Blank text is ignored. */
    void addInterim(StreamId streamId, String text, long timestampMs);

    /**
     * Runs duplicate suppression and stores the final if it survives.
     *
     * @return the stored transcript, or empty if it was ignored or suppressed
     */
    Optional<Transcript> addFinal(StreamId streamId, String text, double confidence, long timestampMs);

    /** Up to {@code n} most recent transcripts in log order. */
    List<Transcript> getRecent(int n);

    /** Substring search over the log; a blank query matches every entry. */
    List<Transcript> search(String query, SearchOptions options);

    /** Renders the current log in {@code format}. */
    String export(ExportFormat format);

    List<InterimTranscript> getInterimTranscripts();

    /** Transcripts of the current (or last sealed) session in log order. */
    List<Transcript> getSessionTranscripts();

    Optional<TranscriptSession> currentSession();

    TranscriptStatus getStatus();

    DuplicatePolicy getPolicy();

    void updatePolicy(DuplicatePolicy policy);

    /** Empties the log and interim state without touching the session lifecycle. */
    void clearTranscripts();

    /**
     * Persists a snapshot of the active session.
     *
     * @return file written, or empty when there is no active session or the write failed
     */
    Optional<Path> saveSnapshot();
}

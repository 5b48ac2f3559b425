package com.phillippitts.dualscribe.service.orchestration;

import com.phillippitts.dualscribe.domain.SessionSummary;
import com.phillippitts.dualscribe.exception.RecordingStartException;

import java.util.Optional;

/**
 * Supervises the capture/recognition pairs of all streams as one atomic recording.
 *
 * @see DefaultRecordingOrchestrator
 */
public interface RecordingOrchestrator {

    /**
     * Opens every recognition session, then starts every capture, then opens a transcript session.
     * Any failure rolls back whatever was already opened.
     *
     * @return id of the new transcript session
     * @throws RecordingStartException when a stream could not be opened
     * @throws IllegalStateException   when a recording is already running or starting
     */
    String startRecording(RecordingOptions options);

    /**
     * Stops captures, closes sessions, waits the grace period for in-flight finals and seals the
     * transcript session. Idempotent: returns empty when nothing was recording.
     */
    Optional<SessionSummary> stopRecording();

    /**
     * Stops when recording, starts otherwise.
     *
     * @return status after the transition
     */
    RecordingStatus toggleRecording(RecordingOptions options);

    boolean isRecording();

    RecordingStatus status();
}

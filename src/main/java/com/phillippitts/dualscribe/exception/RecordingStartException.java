package com.phillippitts.dualscribe.exception;

import java.util.List;

/**
 * Aggregated failure of {@code startRecording}. Everything opened before the failure has been
 * rolled back by the time this is thrown; rollback errors are attached as suppressed exceptions.
 */
public class RecordingStartException extends DualScribeException {

    private final List<String> failedStreams;

    public RecordingStartException(String message, List<String> failedStreams, Throwable cause) {
        super(message, cause);
        this.failedStreams = failedStreams == null ? List.of() : List.copyOf(failedStreams);
    }

    /** Wire names of the streams whose open or acquire failed. */
    public List<String> getFailedStreams() {
        return failedStreams;
    }
}

package com.phillippitts.dualscribe.exception;

import com.phillippitts.dualscribe.domain.StreamId;

/**
 * Base class for failures of a streaming recognition session.
 *
 * <p>{@link #isTransient()} tells the orchestrator whether a reopen may succeed.
 */
public class RecognitionException extends DualScribeException {

    private final StreamId streamId;

    public RecognitionException(String message, StreamId streamId) {
        super(message);
        this.streamId = streamId;
    }

    public RecognitionException(String message, StreamId streamId, Throwable cause) {
        super(message, cause);
        this.streamId = streamId;
    }

    /** Stream whose session failed, may be {@code null} for provider-level failures. */
    public StreamId getStreamId() {
        return streamId;
    }

    public boolean isTransient() {
        return false;
    }
}

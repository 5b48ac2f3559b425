package com.phillippitts.dualscribe.exception;

import com.phillippitts.dualscribe.domain.StreamId;

/**
 * Thrown by {@code open} when the session for a stream is not idle.
 */
public class AlreadyOpenException extends RecognitionException {

    public AlreadyOpenException(StreamId streamId, String state) {
        super("Recognition session for " + streamId + " is already " + state, streamId);
    }
}

package com.phillippitts.dualscribe.exception;

import com.phillippitts.dualscribe.domain.StreamId;

/**
 * Network failure, open timeout, or unexpected disconnect. Transient: eligible for backed-off reopen.
 */
public class ConnectivityException extends RecognitionException {

    public ConnectivityException(String message, StreamId streamId) {
        super(message, streamId);
    }

    public ConnectivityException(String message, StreamId streamId, Throwable cause) {
        super(message, streamId, cause);
    }

    @Override
    public boolean isTransient() {
        return true;
    }
}

package com.phillippitts.dualscribe.exception;

import com.phillippitts.dualscribe.domain.StreamId;

/**
 * The recognizer rejected our credentials. Fatal: never retried automatically.
 */
public class AuthenticationException extends RecognitionException {

    public AuthenticationException(String message, StreamId streamId) {
        super(message, streamId);
    }

    public AuthenticationException(String message, StreamId streamId, Throwable cause) {
        super(message, streamId, cause);
    }
}

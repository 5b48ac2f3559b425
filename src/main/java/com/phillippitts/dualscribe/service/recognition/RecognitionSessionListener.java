package com.phillippitts.dualscribe.service.recognition;

import com.phillippitts.dualscribe.domain.RecognitionResult;
import com.phillippitts.dualscribe.domain.StreamId;
import com.phillippitts.dualscribe.exception.RecognitionException;

/**
 * Receives normalized results and failures from a {@link StreamingRecognitionSession}.
 */
public interface RecognitionSessionListener {

    void onResult(RecognitionResult result);

    /**
     * The session dropped to IDLE because of an error while ACTIVE. Reopening is the caller's decision.
     */
    void onSessionError(StreamId streamId, RecognitionException error);
}

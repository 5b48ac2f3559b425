package com.phillippitts.dualscribe.service.orchestration;

import com.phillippitts.dualscribe.domain.StreamId;
import com.phillippitts.dualscribe.service.audio.capture.AudioSourceCapture;
import com.phillippitts.dualscribe.service.recognition.StreamingRecognitionSession;

import java.util.Objects;

/**
 * One capture source paired with the recognition session it feeds.
 */
record StreamPipeline(StreamId streamId, AudioSourceCapture capture, StreamingRecognitionSession session) {

    StreamPipeline {
        Objects.requireNonNull(streamId, "streamId");
        Objects.requireNonNull(capture, "capture");
        Objects.requireNonNull(session, "session");
        if (capture.streamId() != streamId || session.streamId() != streamId) {
            throw new IllegalArgumentException("Pipeline components must all belong to " + streamId);
        }
    }
}

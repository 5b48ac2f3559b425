package com.phillippitts.dualscribe.service.recognition;

import com.phillippitts.dualscribe.domain.StreamId;

import java.time.Instant;

/**
 * Published when an active recognition session fails and returns to IDLE.
 */
public record RecognitionSessionErrorEvent(StreamId streamId, RecognitionErrorKind kind, String message, Instant at) { }

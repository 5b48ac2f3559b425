package com.phillippitts.dualscribe.service.orchestration.event;

import com.phillippitts.dualscribe.domain.StreamId;

import java.time.Instant;

/**
 * Published when a stream's recognition session was reopened after a transient failure.
 *
 * @param streamId stream that recovered
 * @param attempts reopen attempts it took
 * @param at       when it recovered
 */
public record RecognitionSessionRecoveredEvent(StreamId streamId, int attempts, Instant at) {
    public RecognitionSessionRecoveredEvent {
        if (at == null) at = Instant.now();
    }
}

package com.phillippitts.dualscribe.service.audio.capture;

import com.phillippitts.dualscribe.domain.StreamId;

import java.time.Instant;

/**
 * Published when a source starts or stops delivering frames.
 */
public record SourceLifecycleEvent(StreamId source, State state, Instant at) {

    public enum State { ACTIVE, INACTIVE }
}

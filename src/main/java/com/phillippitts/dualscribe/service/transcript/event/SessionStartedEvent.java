package com.phillippitts.dualscribe.service.transcript.event;

import java.time.Instant;

/**
 * Published when the transcript engine opens a new session.
 */
public record SessionStartedEvent(String sessionId, Instant startTime) {}

package com.phillippitts.dualscribe.service.transcript.event;

import java.time.Instant;

/**
 * Published when the log and interim state were cleared on request.
 */
public record TranscriptsClearedEvent(String sessionId, Instant at) {}

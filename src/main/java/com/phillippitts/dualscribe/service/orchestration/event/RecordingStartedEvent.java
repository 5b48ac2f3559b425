package com.phillippitts.dualscribe.service.orchestration.event;

import com.phillippitts.dualscribe.service.orchestration.CaptureMode;

import java.time.Instant;

/**
 * Published after every stream of a recording is open and capturing.
 */
public record RecordingStartedEvent(String sessionId, CaptureMode captureMode, Instant at) {}

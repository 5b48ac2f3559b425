package com.phillippitts.dualscribe.service.audio.capture;

import com.phillippitts.dualscribe.domain.StreamId;

import java.time.Instant;

/**
 * Published when an audio source fails (permissions, device errors, read failures).
 *
 * Payload contains the source, a short reason and timestamp. Avoids any PII.
 */
public record CaptureErrorEvent(StreamId source, String reason, Instant at) { }

package com.phillippitts.dualscribe.service.transcript.event;

import java.time.Instant;

/**
 * Published when a stored transcript is removed in favour of a preferred-stream duplicate.
 * Always precedes the {@link FinalTranscriptEvent} of the replacement.
 */
public record TranscriptRetractedEvent(String transcriptId, String replacedById, Instant at) {}

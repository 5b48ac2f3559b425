package com.phillippitts.dualscribe.service.transcript.event;

import com.phillippitts.dualscribe.domain.StreamId;

/**
 * Published whenever the live hypothesis of a stream changes.
 */
public record InterimTranscriptEvent(StreamId streamId, String speaker, String text, long timestampMs) {}

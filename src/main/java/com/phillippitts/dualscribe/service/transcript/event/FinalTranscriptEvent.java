package com.phillippitts.dualscribe.service.transcript.event;

import com.phillippitts.dualscribe.domain.Transcript;

/**
 * Published after a final transcript has been stored in the log.
 *
 * @param transcript the stored entry
 */
public record FinalTranscriptEvent(Transcript transcript) {}

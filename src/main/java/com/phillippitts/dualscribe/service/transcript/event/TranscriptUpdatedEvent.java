package com.phillippitts.dualscribe.service.transcript.event;

import com.phillippitts.dualscribe.domain.Transcript;

import java.util.List;

/**
 * Rolling view of the log after a change.
 *
 * @param recent most recent entries in log order
 * @param total  number of entries currently in the log
 */
public record TranscriptUpdatedEvent(List<Transcript> recent, int total) {

    public TranscriptUpdatedEvent {
        recent = recent == null ? List.of() : List.copyOf(recent);
    }
}

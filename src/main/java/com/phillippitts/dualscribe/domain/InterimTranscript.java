package com.phillippitts.dualscribe.domain;

/**
 * Live, not yet committed hypothesis for one stream. At most one exists per stream.
 */
public record InterimTranscript(StreamId streamId, String speaker, String text, long timestampMs) {

    public static InterimTranscript of(StreamId streamId, String text, long timestampMs) {
        return new InterimTranscript(streamId, streamId.speakerLabel(), text, timestampMs);
    }
}

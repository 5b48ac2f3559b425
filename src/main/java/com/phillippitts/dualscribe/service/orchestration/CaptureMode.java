package com.phillippitts.dualscribe.service.orchestration;

import com.phillippitts.dualscribe.domain.StreamId;

import java.util.List;

/**
 * Which streams a recording session captures.
 */
public enum CaptureMode {

    /** Microphone and system audio. */
    DUAL(List.of(StreamId.MICROPHONE, StreamId.SYSTEM_AUDIO)),

    /** Microphone only. */
    MICROPHONE_ONLY(List.of(StreamId.MICROPHONE));

    private final List<StreamId> streams;

    CaptureMode(List<StreamId> streams) {
        this.streams = streams;
    }

    /** Streams in the order they are opened. */
    public List<StreamId> streams() {
        return streams;
    }

    /** Value stored in session metadata. */
    public String metadataValue() {
        return switch (this) {
            case DUAL -> "dual";
            case MICROPHONE_ONLY -> "microphone";
        };
    }
}

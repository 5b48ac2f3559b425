package com.phillippitts.dualscribe.service.transcript;

import com.phillippitts.dualscribe.domain.StreamId;

import java.util.Optional;

/** Which stream wins when the same utterance is heard on both. */
public enum PreferredSource {
    SYSTEM_AUDIO,
    MICROPHONE,
    NONE;

    public Optional<StreamId> stream() {
        return switch (this) {
            case SYSTEM_AUDIO -> Optional.of(StreamId.SYSTEM_AUDIO);
            case MICROPHONE -> Optional.of(StreamId.MICROPHONE);
            case NONE -> Optional.empty();
        };
    }
}

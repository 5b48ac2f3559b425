package com.phillippitts.dualscribe.service.audio.capture;

import com.phillippitts.dualscribe.domain.StreamId;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * The configured audio source of each stream.
 */
public class AudioSourceRegistry {

    private final Map<StreamId, AudioSourceCapture> sources;

    public AudioSourceRegistry(Map<StreamId, AudioSourceCapture> sources) {
        EnumMap<StreamId, AudioSourceCapture> copy = new EnumMap<>(StreamId.class);
        sources.forEach((id, source) -> {
            if (source.streamId() != id) {
                throw new IllegalArgumentException("Source for " + source.streamId() + " registered as " + id);
            }
            copy.put(id, source);
        });
        this.sources = Collections.unmodifiableMap(copy);
    }

    public Map<StreamId, AudioSourceCapture> all() {
        return sources;
    }

    public Optional<AudioSourceCapture> get(StreamId id) {
        return Optional.ofNullable(sources.get(id));
    }

    /** The source of {@code id} if it accepts externally pushed audio. */
    public Optional<PushAudioSourceCapture> pushSource(StreamId id) {
        AudioSourceCapture source = sources.get(id);
        return source instanceof PushAudioSourceCapture push ? Optional.of(push) : Optional.empty();
    }
}

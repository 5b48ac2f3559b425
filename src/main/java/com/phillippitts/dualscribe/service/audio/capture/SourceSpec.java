package com.phillippitts.dualscribe.service.audio.capture;

import com.phillippitts.dualscribe.domain.StreamId;

import java.util.Objects;
import java.util.Optional;

/**
 * What to open for a stream.
 *
 * @param streamId   logical stream the source feeds
 * @param deviceName mixer name, or {@code null} for the platform default
 */
public record SourceSpec(StreamId streamId, String deviceName) {

    public SourceSpec {
        Objects.requireNonNull(streamId, "streamId");
        deviceName = (deviceName == null || deviceName.isBlank()) ? null : deviceName;
    }

    public Optional<String> device() {
        return Optional.ofNullable(deviceName);
    }
}

package com.phillippitts.dualscribe.domain;

import java.util.Objects;

/**
 * One chunk of canonical PCM (16 kHz, 16-bit signed, mono, little-endian) from a single source.
 *
 * @param sourceId    stream the frame was captured from
 * @param pcm         PCM16LE bytes; never copied after construction, treat as read-only
 * @param timestampMs capture wall-clock time in epoch milliseconds
 */
public record AudioFrame(StreamId sourceId, byte[] pcm, long timestampMs) {

    public AudioFrame {
        Objects.requireNonNull(sourceId, "sourceId");
        Objects.requireNonNull(pcm, "pcm");
        if ((pcm.length & 1) != 0) {
            throw new IllegalArgumentException("PCM16 frame must have an even byte length, got " + pcm.length);
        }
    }

    /** Number of 16-bit samples in this frame. */
    public int sampleCount() {
        return pcm.length / 2;
    }
}

package com.phillippitts.dualscribe.service.audio;

import com.phillippitts.dualscribe.exception.UnsupportedFormatException;

import java.util.Locale;

/**
 * Sample encodings accepted from pushed audio.
 */
public enum SampleFormat {

    /** 16-bit signed little-endian integer samples. */
    PCM_S16LE(2),
    /** 16-bit signed big-endian integer samples. */
    PCM_S16BE(2),
    /** 32-bit IEEE float little-endian samples in [-1, 1]. */
    FLOAT32LE(4);

    private final int bytesPerSample;

    SampleFormat(int bytesPerSample) {
        this.bytesPerSample = bytesPerSample;
    }

    public int bytesPerSample() {
        return bytesPerSample;
    }

    /**
     * Parses a format name such as {@code s16le}, {@code pcm_s16le}, {@code f32le} or {@code float32}.
     *
     * @throws UnsupportedFormatException for unrecognized names
     */
    public static SampleFormat fromName(String name) {
        if (name == null || name.isBlank()) {
            return PCM_S16LE;
        }
        String n = name.trim().toLowerCase(Locale.ROOT).replace("pcm_", "").replace('-', '_');
        return switch (n) {
            case "s16le", "s16", "int16", "pcm16" -> PCM_S16LE;
            case "s16be" -> PCM_S16BE;
            case "f32le", "f32", "float32", "float" -> FLOAT32LE;
            default -> throw new UnsupportedFormatException("Unsupported sample format: " + name);
        };
    }
}

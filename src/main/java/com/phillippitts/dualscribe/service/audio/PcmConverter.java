package com.phillippitts.dualscribe.service.audio;

import com.phillippitts.dualscribe.exception.UnsupportedFormatException;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Converts incoming sample data to canonical PCM16LE mono at 16 kHz.
 *
 * <p>Float samples are clamped to [-1, 1] and scaled to int16 full-scale (x 32767).
 * Multi-channel input is downmixed by averaging the channels of each frame.
 * No resampling is performed: input at any other sample rate is rejected.
 *
 * <p>Thread-safe: stateless static methods.
 */
public final class PcmConverter {

    private static final int PCM16_FULL_SCALE = 0x7FFF;

    private PcmConverter() {
        // Utility class - prevent instantiation
    }

    /**
     * Converts raw sample bytes to canonical PCM.
     *
     * @param data       interleaved sample bytes
     * @param format     sample encoding
     * @param channels   channel count, 1..{@link AudioFormat#MAX_INPUT_CHANNELS}
     * @param sampleRate sample rate in Hz; must equal {@link AudioFormat#REQUIRED_SAMPLE_RATE}
     * @return PCM16LE mono bytes
     * @throws UnsupportedFormatException if the format cannot be converted
     */
    public static byte[] toCanonical(byte[] data, SampleFormat format, int channels, int sampleRate) {
        if (data == null) {
            throw new UnsupportedFormatException("Audio data must not be null");
        }
        if (format == null) {
            throw new UnsupportedFormatException("Sample format must be specified");
        }
        if (sampleRate != AudioFormat.REQUIRED_SAMPLE_RATE) {
            throw new UnsupportedFormatException("Unsupported sample rate " + sampleRate
                    + " Hz; expected " + AudioFormat.REQUIRED_SAMPLE_RATE);
        }
        if (channels < 1 || channels > AudioFormat.MAX_INPUT_CHANNELS) {
            throw new UnsupportedFormatException("Unsupported channel count: " + channels);
        }
        int frameBytes = format.bytesPerSample() * channels;
        if (data.length % frameBytes != 0) {
            throw new UnsupportedFormatException("Audio length " + data.length
                    + " is not a multiple of the frame size " + frameBytes);
        }
        if (format == SampleFormat.PCM_S16LE && channels == 1) {
            return data.clone();
        }

        int frames = data.length / frameBytes;
        ByteBuffer in = ByteBuffer.wrap(data)
                .order(format == SampleFormat.PCM_S16BE ? ByteOrder.BIG_ENDIAN : ByteOrder.LITTLE_ENDIAN);
        ByteBuffer out = ByteBuffer.allocate(frames * 2).order(ByteOrder.LITTLE_ENDIAN);
        for (int f = 0; f < frames; f++) {
            double sum = 0.0;
            for (int c = 0; c < channels; c++) {
                sum += format == SampleFormat.FLOAT32LE
                        ? floatToPcm16(in.getFloat())
                        : in.getShort();
            }
            out.putShort((short) Math.round(sum / channels));
        }
        return out.array();
    }

    /**
     * Converts float samples to PCM16LE mono bytes.
     */
    public static byte[] floatsToPcm16(float[] samples) {
        ByteBuffer out = ByteBuffer.allocate(samples.length * 2).order(ByteOrder.LITTLE_ENDIAN);
        for (float s : samples) {
            out.putShort(floatToPcm16(s));
        }
        return out.array();
    }

    /**
     * Clamps a float sample to [-1, 1] and scales it to int16. NaN maps to silence.
     */
    public static short floatToPcm16(float sample) {
        if (Float.isNaN(sample)) {
            return 0;
        }
        float clamped = Math.max(-1.0f, Math.min(1.0f, sample));
        return (short) Math.round(clamped * PCM16_FULL_SCALE);
    }
}

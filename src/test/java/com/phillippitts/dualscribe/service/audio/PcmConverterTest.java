package com.phillippitts.dualscribe.service.audio;

import com.phillippitts.dualscribe.exception.UnsupportedFormatException;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PcmConverterTest {

    @Test
    void canonicalInputIsCopiedUnchanged() {
        byte[] pcm = {1, 2, 3, 4};

        byte[] out = PcmConverter.toCanonical(pcm, SampleFormat.PCM_S16LE, 1, 16_000);

        assertThat(out).containsExactly(1, 2, 3, 4).isNotSameAs(pcm);
    }

    @Test
    void floatSamplesAreClampedAndScaled() {
        assertThat(PcmConverter.floatToPcm16(1.0f)).isEqualTo((short) 32767);
        assertThat(PcmConverter.floatToPcm16(2.5f)).isEqualTo((short) 32767);
        assertThat(PcmConverter.floatToPcm16(-1.0f)).isEqualTo((short) -32767);
        assertThat(PcmConverter.floatToPcm16(-0.5f)).isEqualTo((short) -16383);
        assertThat(PcmConverter.floatToPcm16(0.5f)).isEqualTo((short) 16384);
        assertThat(PcmConverter.floatToPcm16(Float.NaN)).isEqualTo((short) 0);
    }

    @Test
    void stereoIsDownmixedByAveraging() {
        ByteBuffer in = ByteBuffer.allocate(8).order(ByteOrder.LITTLE_ENDIAN);
        in.putShort((short) 1000).putShort((short) 3000);
        in.putShort((short) -200).putShort((short) 200);

        byte[] out = PcmConverter.toCanonical(in.array(), SampleFormat.PCM_S16LE, 2, 16_000);

        ByteBuffer result = ByteBuffer.wrap(out).order(ByteOrder.LITTLE_ENDIAN);
        assertThat(out).hasSize(4);
        assertThat(result.getShort()).isEqualTo((short) 2000);
        assertThat(result.getShort()).isEqualTo((short) 0);
    }

    @Test
    void bigEndianIsConvertedToLittleEndian() {
        byte[] be = {0x01, 0x02};

        byte[] out = PcmConverter.toCanonical(be, SampleFormat.PCM_S16BE, 1, 16_000);

        assertThat(out).containsExactly(0x02, 0x01);
    }

    @Test
    void float32MonoIsConverted() {
        ByteBuffer in = ByteBuffer.allocate(8).order(ByteOrder.LITTLE_ENDIAN);
        in.putFloat(1.0f).putFloat(-0.5f);

        byte[] out = PcmConverter.toCanonical(in.array(), SampleFormat.FLOAT32LE, 1, 16_000);

        ByteBuffer result = ByteBuffer.wrap(out).order(ByteOrder.LITTLE_ENDIAN);
        assertThat(result.getShort()).isEqualTo((short) 32767);
        assertThat(result.getShort()).isEqualTo((short) -16383);
    }

    @Test
    void rejectsOtherSampleRates() {
        assertThatThrownBy(() -> PcmConverter.toCanonical(new byte[4], SampleFormat.PCM_S16LE, 1, 44_100))
                .isInstanceOf(UnsupportedFormatException.class)
                .hasMessageContaining("44100");
    }

    @Test
    void rejectsPartialFrames() {
        assertThatThrownBy(() -> PcmConverter.toCanonical(new byte[3], SampleFormat.PCM_S16LE, 1, 16_000))
                .isInstanceOf(UnsupportedFormatException.class);
        assertThatThrownBy(() -> PcmConverter.toCanonical(new byte[6], SampleFormat.FLOAT32LE, 1, 16_000))
                .isInstanceOf(UnsupportedFormatException.class);
    }

    @Test
    void rejectsBadChannelCounts() {
        assertThatThrownBy(() -> PcmConverter.toCanonical(new byte[4], SampleFormat.PCM_S16LE, 0, 16_000))
                .isInstanceOf(UnsupportedFormatException.class);
        assertThatThrownBy(() -> PcmConverter.toCanonical(new byte[18], SampleFormat.PCM_S16LE, 9, 16_000))
                .isInstanceOf(UnsupportedFormatException.class);
    }

    @Test
    void parsesSampleFormatNames() {
        assertThat(SampleFormat.fromName(null)).isEqualTo(SampleFormat.PCM_S16LE);
        assertThat(SampleFormat.fromName("pcm_s16le")).isEqualTo(SampleFormat.PCM_S16LE);
        assertThat(SampleFormat.fromName("S16BE")).isEqualTo(SampleFormat.PCM_S16BE);
        assertThat(SampleFormat.fromName("float32")).isEqualTo(SampleFormat.FLOAT32LE);
        assertThatThrownBy(() -> SampleFormat.fromName("mp3"))
                .isInstanceOf(UnsupportedFormatException.class);
    }

    @Test
    void bytesForMillisRoundsToWholeSamples() {
        assertThat(AudioFormat.bytesForMillis(20)).isEqualTo(640);
        assertThat(AudioFormat.bytesForMillis(1000)).isEqualTo(AudioFormat.REQUIRED_BYTE_RATE);
    }
}

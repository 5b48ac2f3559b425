package com.phillippitts.dualscribe.service.audio.capture;

import com.phillippitts.dualscribe.domain.StreamId;
import com.phillippitts.dualscribe.service.audio.PcmConverter;
import com.phillippitts.dualscribe.service.audio.SampleFormat;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;

/**
 * Source whose audio is delivered by an external host (for example a browser or desktop shell
 * that owns the loopback capture) rather than read from a local device.
 *
 * <p>Callers push raw samples via {@link #accept(byte[], SampleFormat, int, int)}; data pushed while
 * the source is not acquired is discarded.
 */
public class PushAudioSourceCapture extends AbstractAudioSourceCapture {

    private static final Logger LOG = LogManager.getLogger(PushAudioSourceCapture.class);

    public PushAudioSourceCapture(StreamId streamId,
                                  int queueCapacity,
                                  ApplicationEventPublisher publisher,
                                  Clock clock) {
        super(streamId, queueCapacity, publisher, clock);
    }

    @Override
    protected void doAcquire(SourceSpec spec) {
        LOG.debug("Push source {} ready to accept audio", streamId().wireName());
    }

    @Override
    protected void doRelease() {
        LOG.debug("Push source {} stopped accepting audio", streamId().wireName());
    }

    /**
     * Normalizes pushed samples to canonical PCM and hands them to the dispatcher.
     *
     * @return {@code false} if the source is inactive and the samples were discarded
     * @throws com.phillippitts.dualscribe.exception.UnsupportedFormatException if the data cannot be converted
     */
    public boolean accept(byte[] data, SampleFormat format, int channels, int sampleRate) {
        byte[] pcm = PcmConverter.toCanonical(data, format, channels, sampleRate);
        return enqueue(pcm);
    }
}

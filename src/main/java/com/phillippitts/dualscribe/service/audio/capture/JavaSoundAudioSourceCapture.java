package com.phillippitts.dualscribe.service.audio.capture;

import com.phillippitts.dualscribe.domain.StreamId;
import com.phillippitts.dualscribe.exception.AcquisitionException;
import com.phillippitts.dualscribe.service.audio.AudioFormat;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.DataLine;
import javax.sound.sampled.LineUnavailableException;
import javax.sound.sampled.Mixer;
import javax.sound.sampled.TargetDataLine;
import java.time.Clock;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * Java Sound based source producing raw PCM16LE mono @16kHz.
 *
 * <p>The microphone opens the default (or a named) input mixer. System audio opens a loopback
 * mixer by name, e.g. a virtual device that mirrors the output.
 * The line is opened synchronously inside {@link #acquire(SourceSpec)} so device and permission
 * failures surface to the caller; reads then happen on a dedicated daemon thread.
 */
public class JavaSoundAudioSourceCapture extends AbstractAudioSourceCapture {

    private static final Logger LOG = LogManager.getLogger(JavaSoundAudioSourceCapture.class);

    static final long EMPTY_READ_BACKOFF_MS = 5;

    /** Abstraction to open a TargetDataLine (for testing). */
    public interface DataLineProvider {
        TargetDataLine open(javax.sound.sampled.AudioFormat format, Optional<String> deviceName)
                throws LineUnavailableException;
    }

    private final int bytesPerChunk;
    private final DataLineProvider provider;

    private volatile TargetDataLine line;
    private volatile Thread captureThread;

    public JavaSoundAudioSourceCapture(StreamId streamId,
                                       int bytesPerChunk,
                                       int queueCapacity,
                                       ApplicationEventPublisher publisher,
                                       Clock clock) {
        this(streamId, bytesPerChunk, queueCapacity, publisher, clock, defaultProvider());
    }

    // Package-private for tests
    JavaSoundAudioSourceCapture(StreamId streamId,
                                int bytesPerChunk,
                                int queueCapacity,
                                ApplicationEventPublisher publisher,
                                Clock clock,
                                DataLineProvider provider) {
        super(streamId, queueCapacity, publisher, clock);
        if (bytesPerChunk <= 0 || bytesPerChunk % AudioFormat.REQUIRED_BLOCK_ALIGN != 0) {
            throw new IllegalArgumentException("bytesPerChunk must be a positive multiple of "
                    + AudioFormat.REQUIRED_BLOCK_ALIGN);
        }
        this.bytesPerChunk = bytesPerChunk;
        this.provider = Objects.requireNonNull(provider);
    }

    static DataLineProvider defaultProvider() {
        return (format, device) -> {
            DataLine.Info info = new DataLine.Info(TargetDataLine.class, format);
            TargetDataLine l = null;
            if (device.isPresent()) {
                for (Mixer.Info mixerInfo : AudioSystem.getMixerInfo()) {
                    if (mixerInfo.getName().equalsIgnoreCase(device.get())) {
                        Mixer m = AudioSystem.getMixer(mixerInfo);
                        l = (TargetDataLine) m.getLine(info);
                        break;
                    }
                }
                if (l == null) {
                    throw new LineUnavailableException("No mixer named '" + device.get() + "'");
                }
            } else {
                l = (TargetDataLine) AudioSystem.getLine(info);
            }
            l.open(format);
            return l;
        };
    }

    @Override
    protected void doAcquire(SourceSpec spec) {
        String source = streamId().wireName();
        TargetDataLine opened;
        try {
            opened = provider.open(AudioFormat.javaSoundFormat(), spec.device());
        } catch (LineUnavailableException | IllegalArgumentException e) {
            throw new AcquisitionException(source, "DEVICE_UNAVAILABLE",
                    "Audio device unavailable for " + source + ": " + e.getMessage(), e);
        } catch (SecurityException e) {
            throw new AcquisitionException(source, "PERMISSION_DENIED",
                    "Audio capture permission denied for " + source, e);
        }
        opened.start();
        line = opened;
        Thread t = new Thread(() -> readLoop(opened), "audio-capture-" + source);
        t.setDaemon(true);
        captureThread = t;
        t.start();
    }

    @Override
    protected void doRelease() {
        TargetDataLine l = line;
        line = null;
        if (l != null) {
            // Closing unblocks a pending read on the capture thread
            try {
                l.stop();
                l.close();
            } catch (RuntimeException e) {
                LOG.debug("Error closing line for {}: {}", streamId().wireName(), e.toString());
            }
        }
    }

    @Override
    protected Thread producerThread() {
        return captureThread;
    }

    private void readLoop(TargetDataLine l) {
        byte[] buf = new byte[bytesPerChunk];
        long total = 0;
        try {
            while (line == l) {
                int n = l.read(buf, 0, buf.length);
                if (n <= 0) {
                    if (!l.isOpen()) {
                        if (line == l) {
                            failed("CAPTURE_ERROR", new IllegalStateException("line closed by the device"));
                        }
                        break;
                    }
                    // Open but starved; give the device a moment instead of spinning
                    Thread.sleep(EMPTY_READ_BACKOFF_MS);
                    continue;
                }
                // Keep whole samples only
                int usable = n - (n % AudioFormat.REQUIRED_BLOCK_ALIGN);
                if (usable == 0) {
                    continue;
                }
                enqueue(Arrays.copyOf(buf, usable));
                total += usable;
            }
            LOG.debug("Capture loop for {} finished: {} bytes read", streamId().wireName(), total);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            LOG.debug("Capture loop for {} interrupted", streamId().wireName());
        } catch (SecurityException se) {
            failed("PERMISSION_DENIED", se);
        } catch (RuntimeException e) {
            if (line == l) {
                failed("CAPTURE_ERROR", e);
            } else {
                LOG.debug("Capture loop for {} ended during release: {}", streamId().wireName(), e.toString());
            }
        }
    }
}

package com.phillippitts.dualscribe.service.audio.capture;

import com.phillippitts.dualscribe.domain.AudioFrame;
import com.phillippitts.dualscribe.domain.StreamId;
import com.phillippitts.dualscribe.util.ThreadTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Base class handling the parts every source shares: idempotent lifecycle, the drop-oldest
 * hand-off queue, the dispatcher thread and lifecycle events.
 *
 * <p>Subclasses implement {@link #doAcquire(SourceSpec)} and {@link #doRelease()} and feed audio
 * through {@link #enqueue(byte[])} from whatever thread the platform delivers it on.
 */
public abstract class AbstractAudioSourceCapture implements AudioSourceCapture {

    private static final Logger LOG = LogManager.getLogger(AbstractAudioSourceCapture.class);

    private static final long DISPATCH_POLL_MS = 50;
    private static final long DROP_LOG_INTERVAL = 100;

    private final StreamId streamId;
    private final FrameQueue queue;
    private final Clock clock;
    protected final ApplicationEventPublisher publisher;

    private final Object lock = new Object();
    private volatile boolean active;
    private volatile FrameListener listener;
    private Thread dispatcher;

    protected AbstractAudioSourceCapture(StreamId streamId,
                                         int queueCapacity,
                                         ApplicationEventPublisher publisher,
                                         Clock clock) {
        this.streamId = Objects.requireNonNull(streamId, "streamId");
        this.queue = new FrameQueue(queueCapacity);
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Opens the underlying device. Called with the lifecycle lock held.
     *
     * @throws com.phillippitts.dualscribe.exception.AcquisitionException on failure
     */
    protected abstract void doAcquire(SourceSpec spec);

    /** Stops the underlying device. Called with the lifecycle lock held; must not block long. */
    protected abstract void doRelease();

    /** Thread to join after {@link #doRelease()}, or {@code null} if the subclass owns none. */
    protected Thread producerThread() {
        return null;
    }

    @Override
    public StreamId streamId() {
        return streamId;
    }

    @Override
    public void acquire(SourceSpec spec) {
        Objects.requireNonNull(spec, "spec");
        synchronized (lock) {
            if (active) {
                LOG.debug("Source {} already active; acquire is a no-op", streamId.wireName());
                return;
            }
            queue.clear();
            doAcquire(spec);
            active = true;
            Thread t = new Thread(this::dispatchLoop, "frame-dispatch-" + streamId.wireName());
            t.setDaemon(true);
            dispatcher = t;
            t.start();
        }
        LOG.info("Audio source {} active (device='{}')", streamId.wireName(), spec.device().orElse("default"));
        publisher.publishEvent(new SourceLifecycleEvent(streamId, SourceLifecycleEvent.State.ACTIVE, Instant.now(clock)));
    }

    @Override
    public void release() {
        Thread producer;
        Thread dispatch;
        synchronized (lock) {
            if (!active) {
                return;
            }
            active = false;
            producer = producerThread();
            doRelease();
            dispatch = dispatcher;
            dispatcher = null;
        }
        // Join outside lock to avoid deadlock with a producer reporting failure
        if (!ThreadTimeouts.join(producer, ThreadTimeouts.CAPTURE_THREAD_STOP_TIMEOUT)) {
            LOG.warn("Capture thread for {} did not terminate within {}ms",
                    streamId.wireName(), ThreadTimeouts.CAPTURE_THREAD_STOP_TIMEOUT.toMillis());
        }
        if (!ThreadTimeouts.join(dispatch, ThreadTimeouts.CAPTURE_THREAD_STOP_TIMEOUT)) {
            LOG.warn("Dispatcher for {} did not terminate in time", streamId.wireName());
        }
        queue.clear();
        LOG.info("Audio source {} released (dropped frames so far: {})", streamId.wireName(), queue.droppedCount());
        publisher.publishEvent(new SourceLifecycleEvent(streamId, SourceLifecycleEvent.State.INACTIVE, Instant.now(clock)));
    }

    @Override
    public void onFrame(FrameListener listener) {
        this.listener = listener;
    }

    @Override
    public boolean isActive() {
        return active;
    }

    @Override
    public long droppedFrames() {
        return queue.droppedCount();
    }

    /**
     * Hands canonical PCM to the dispatcher. Never blocks; drops the oldest frame when full.
     *
     * @return {@code false} if the source is not active and the data was discarded
     */
    protected boolean enqueue(byte[] pcm) {
        if (!active || pcm.length == 0) {
            return false;
        }
        AudioFrame frame = new AudioFrame(streamId, pcm, clock.millis());
        if (queue.offer(frame)) {
            long dropped = queue.droppedCount();
            if (dropped == 1 || dropped % DROP_LOG_INTERVAL == 0) {
                LOG.warn("Frame queue for {} full (capacity={}); dropped oldest frame, total dropped={}",
                        streamId.wireName(), queue.capacity(), dropped);
            }
        }
        return true;
    }

    /**
     * Reports an unrecoverable device failure from the producer thread and deactivates the source.
     */
    protected void failed(String reason, Throwable cause) {
        LOG.warn("Audio source {} failed: reason={}, cause={}", streamId.wireName(), reason, cause.toString());
        publisher.publishEvent(new CaptureErrorEvent(streamId, reason, Instant.now(clock)));
        Thread dispatch;
        synchronized (lock) {
            if (!active) {
                return;
            }
            active = false;
            doRelease();
            dispatch = dispatcher;
            dispatcher = null;
        }
        ThreadTimeouts.join(dispatch, ThreadTimeouts.THREAD_SHUTDOWN_TIMEOUT);
        publisher.publishEvent(new SourceLifecycleEvent(streamId, SourceLifecycleEvent.State.INACTIVE, Instant.now(clock)));
    }

    private void dispatchLoop() {
        try {
            while (active) {
                AudioFrame frame = queue.poll(DISPATCH_POLL_MS, TimeUnit.MILLISECONDS);
                if (frame == null) {
                    continue;
                }
                FrameListener l = listener;
                if (l == null) {
                    continue;
                }
                try {
                    l.onFrame(frame);
                } catch (RuntimeException e) {
                    LOG.warn("Frame listener for {} threw: {}", streamId.wireName(), e.toString());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.debug("Dispatcher for {} interrupted", streamId.wireName());
        }
    }
}

package com.phillippitts.dualscribe.service.audio.capture;

import com.phillippitts.dualscribe.domain.StreamId;

/**
 * Acquires continuous audio from one physical source and delivers canonical PCM frames.
 *
 * <p>Contract:
 * <ul>
 *   <li>{@link #acquire(SourceSpec)} is idempotent: calling it on an active source is a no-op.</li>
 *   <li>{@link #release()} is always safe, including on a source that was never acquired.</li>
 *   <li>Frames reach the listener in strict arrival order on a dedicated dispatcher thread.
 *       The audio thread never blocks on a slow listener; at most {@code audio.capture.queue-capacity}
 *       frames are buffered and the oldest are dropped beyond that.</li>
 * </ul>
 *
 * <p>Implementations publish {@link SourceLifecycleEvent} on activation and release, and
 * {@link CaptureErrorEvent} when the device fails while active.
 */
public interface AudioSourceCapture {

    /** Stream this source feeds. */
    StreamId streamId();

    /**
     * Opens the device and starts delivering frames.
     *
     * @param spec device selection
     * @throws com.phillippitts.dualscribe.exception.AcquisitionException on permission or device failure
     */
    void acquire(SourceSpec spec);

    /** Stops delivery and releases the device. */
    void release();

    /**
     * Registers the frame consumer, replacing any previous one.
     */
    void onFrame(FrameListener listener);

    boolean isActive();

    /** Total frames dropped because the consumer fell behind. */
    long droppedFrames();
}

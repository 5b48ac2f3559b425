package com.phillippitts.dualscribe.service.audio.capture;

import com.phillippitts.dualscribe.domain.AudioFrame;

import java.util.ArrayDeque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded frame queue that never blocks the producer: when full, the oldest frame is dropped.
 *
 * <p>Thread-safe for one producer (the audio thread) and one consumer (the dispatcher).
 */
final class FrameQueue {

    private final int capacity;
    private final ArrayDeque<AudioFrame> frames;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final AtomicLong dropped = new AtomicLong();

    FrameQueue(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1");
        }
        this.capacity = capacity;
        this.frames = new ArrayDeque<>(capacity);
    }

    int capacity() {
        return capacity;
    }

    /**
     * Appends a frame, evicting the oldest when at capacity.
     *
     * @return {@code true} if an older frame was dropped to make room
     */
    boolean offer(AudioFrame frame) {
        lock.lock();
        try {
            boolean evicted = false;
            if (frames.size() >= capacity) {
                frames.pollFirst();
                dropped.incrementAndGet();
                evicted = true;
            }
            frames.addLast(frame);
            notEmpty.signal();
            return evicted;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes the oldest frame, waiting up to the timeout.
     *
     * @return the frame, or {@code null} on timeout
     */
    AudioFrame poll(long timeout, TimeUnit unit) throws InterruptedException {
        long nanos = unit.toNanos(timeout);
        lock.lock();
        try {
            while (frames.isEmpty()) {
                if (nanos <= 0L) {
                    return null;
                }
                nanos = notEmpty.awaitNanos(nanos);
            }
            return frames.pollFirst();
        } finally {
            lock.unlock();
        }
    }

    int size() {
        lock.lock();
        try {
            return frames.size();
        } finally {
            lock.unlock();
        }
    }

    void clear() {
        lock.lock();
        try {
            frames.clear();
        } finally {
            lock.unlock();
        }
    }

    long droppedCount() {
        return dropped.get();
    }
}

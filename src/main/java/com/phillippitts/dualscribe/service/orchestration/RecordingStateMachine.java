package com.phillippitts.dualscribe.service.orchestration;

import java.time.Instant;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Thread-safe state machine for the recording lifecycle.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * IDLE → STARTING (via beginStart)
 * STARTING → RECORDING (via markRecording) or IDLE (via markIdle on rollback)
 * RECORDING → STOPPING (via beginStop)
 * STOPPING → IDLE (via markIdle)
 * </pre>
 *
 * <p>Only the caller that won {@link #beginStart()} or {@link #beginStop()} may drive the
 * following transition, so concurrent start/stop requests can never interleave.
 */
public final class RecordingStateMachine {

    /** Immutable view of the machine. */
    public record Snapshot(RecordingState state, String sessionId, Instant startedAt, CaptureMode captureMode) {}

    private final Lock lock = new ReentrantLock();
    private RecordingState state = RecordingState.IDLE;
    private String sessionId;
    private Instant startedAt;
    private CaptureMode captureMode;

    /**
     * @return {@code true} if the machine moved IDLE → STARTING
     */
    public boolean beginStart() {
        lock.lock();
        try {
            if (state != RecordingState.IDLE) {
                return false;
            }
            state = RecordingState.STARTING;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * STARTING → RECORDING.
     *
     * @throws IllegalStateException if the machine is not STARTING
     */
    public void markRecording(String sessionId, Instant startedAt, CaptureMode mode) {
        lock.lock();
        try {
            if (state != RecordingState.STARTING) {
                throw new IllegalStateException("Cannot mark recording from state " + state);
            }
            this.state = RecordingState.RECORDING;
            this.sessionId = sessionId;
            this.startedAt = startedAt;
            this.captureMode = mode;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return {@code true} if the machine moved RECORDING → STOPPING
     */
    public boolean beginStop() {
        lock.lock();
        try {
            if (state != RecordingState.RECORDING) {
                return false;
            }
            state = RecordingState.STOPPING;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /** Returns to IDLE from any state and forgets the session. */
    public void markIdle() {
        lock.lock();
        try {
            state = RecordingState.IDLE;
            sessionId = null;
            startedAt = null;
            captureMode = null;
        } finally {
            lock.unlock();
        }
    }

    public RecordingState state() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public boolean isRecording() {
        return state() == RecordingState.RECORDING;
    }

    public Snapshot snapshot() {
        lock.lock();
        try {
            return new Snapshot(state, sessionId, startedAt, captureMode);
        } finally {
            lock.unlock();
        }
    }
}

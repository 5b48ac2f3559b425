package com.phillippitts.dualscribe.util;

import java.time.Duration;

/**
 * Standard timeout values for worker thread lifecycle management.
 *
 * <p>Centralized so capture, dispatch and recognition sender threads shut down consistently.
 *
 * @since 1.0
 */
public final class ThreadTimeouts {

    /**
     * Timeout for a capture or dispatcher thread to terminate during a normal release.
     *
     * <p>Capture threads may be blocked on a device read; 1000ms lets one chunk drain.
     */
    public static final Duration CAPTURE_THREAD_STOP_TIMEOUT = Duration.ofMillis(1000);

    /**
     * Timeout for worker threads during application shutdown (best-effort, threads are daemons).
     */
    public static final Duration THREAD_SHUTDOWN_TIMEOUT = Duration.ofMillis(500);

    private ThreadTimeouts() {
        // Utility class - prevent instantiation
    }

    /**
     * Joins a thread for at most {@code timeout}; restores the interrupt flag if interrupted.
     *
     * @return {@code true} if the thread is no longer alive
     */
    public static boolean join(Thread thread, Duration timeout) {
        if (thread == null || !thread.isAlive()) {
            return true;
        }
        if (thread == Thread.currentThread()) {
            return false;
        }
        try {
            thread.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return !thread.isAlive();
    }
}

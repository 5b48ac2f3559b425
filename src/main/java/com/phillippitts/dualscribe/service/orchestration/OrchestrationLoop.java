package com.phillippitts.dualscribe.service.orchestration;

import com.phillippitts.dualscribe.domain.AudioFrame;
import com.phillippitts.dualscribe.domain.RecognitionResult;
import com.phillippitts.dualscribe.util.ThreadTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Single-writer message loop. Every frame, result and control action passes through one bounded
 * queue and is handled on one thread, so the transcript engine is only mutated from that thread
 * while recording and per-stream order is preserved.
 *
 * <p>Producers never block for long: frames are offered and dropped (counted) when the queue is
 * full; results and control messages wait up to {@link #RESULT_OFFER_TIMEOUT_MS} before giving up.
 */
public class OrchestrationLoop {

    private static final Logger LOG = LogManager.getLogger(OrchestrationLoop.class);

    static final long RESULT_OFFER_TIMEOUT_MS = 1000;
    private static final long POLL_MS = 100;
    private static final long DROP_LOG_INTERVAL = 100;

    /** Receives frame and result messages on the loop thread. */
    public interface Handler {
        void onFrame(AudioFrame frame);

        void onResult(RecognitionResult result);
    }

    private final String threadName;
    private final BlockingQueue<PipelineMessage> queue;
    private final Handler handler;
    private final AtomicLong droppedFrames = new AtomicLong();
    private final AtomicLong droppedResults = new AtomicLong();

    private volatile boolean running;
    private volatile Thread thread;

    public OrchestrationLoop(String threadName, int capacity, Handler handler) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1");
        }
        this.threadName = threadName;
        this.queue = new LinkedBlockingQueue<>(capacity);
        this.handler = handler;
    }

    /** Starts the loop thread. Idempotent. */
    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        Thread t = new Thread(this::runLoop, threadName);
        t.setDaemon(true);
        thread = t;
        t.start();
        LOG.debug("Orchestration loop '{}' started", threadName);
    }

    /** Stops the loop thread; pending messages are discarded and pending calls fail. */
    public synchronized void shutdown() {
        if (!running) {
            return;
        }
        running = false;
        Thread t = thread;
        if (t != null) {
            t.interrupt();
            if (!ThreadTimeouts.join(t, ThreadTimeouts.THREAD_SHUTDOWN_TIMEOUT)) {
                LOG.warn("Orchestration loop '{}' did not stop within {}", threadName,
                        ThreadTimeouts.THREAD_SHUTDOWN_TIMEOUT);
            }
        }
        PipelineMessage m;
        while ((m = queue.poll()) != null) {
            if (m instanceof PipelineMessage.ControlMessage<?> c) {
                c.reply().completeExceptionally(new RejectedExecutionException("Orchestration loop stopped"));
            }
        }
        thread = null;
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Enqueues a frame without blocking.
     *
     * @return {@code false} if the queue was full and the frame was dropped
     */
    public boolean submitFrame(AudioFrame frame) {
        if (queue.offer(new PipelineMessage.FrameMessage(frame))) {
            return true;
        }
        long dropped = droppedFrames.incrementAndGet();
        if (dropped == 1 || dropped % DROP_LOG_INTERVAL == 0) {
            LOG.warn("Orchestration queue full; dropped {} frames so far", dropped);
        }
        return false;
    }

    /**
     * Enqueues a recognition result, waiting briefly if the queue is full.
     *
     * @return {@code false} if the result could not be enqueued
     */
    public boolean submitResult(RecognitionResult result) {
        try {
            if (queue.offer(new PipelineMessage.ResultMessage(result), RESULT_OFFER_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                return true;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        droppedResults.incrementAndGet();
        LOG.warn("Dropped {} result from {}: orchestration queue unavailable",
                result.isFinal() ? "final" : "interim", result.streamId());
        return false;
    }

    /**
     * Runs {@code action} on the loop thread. Called from the loop thread itself, it runs inline.
     *
     * @return future completed with the action's result
     */
    public <T> CompletableFuture<T> call(String name, Supplier<T> action) {
        PipelineMessage.ControlMessage<T> msg = new PipelineMessage.ControlMessage<>(name, action, new CompletableFuture<>());
        if (Thread.currentThread() == thread) {
            msg.run();
            return msg.reply();
        }
        if (!running) {
            msg.reply().completeExceptionally(new RejectedExecutionException("Orchestration loop not running"));
            return msg.reply();
        }
        try {
            if (!queue.offer(msg, RESULT_OFFER_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                msg.reply().completeExceptionally(new RejectedExecutionException("Orchestration queue full: " + name));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            msg.reply().completeExceptionally(e);
        }
        return msg.reply();
    }

    public long droppedFrames() {
        return droppedFrames.get();
    }

    public long droppedResults() {
        return droppedResults.get();
    }

    public int pending() {
        return queue.size();
    }

    private void runLoop() {
        while (running) {
            PipelineMessage m;
            try {
                m = queue.poll(POLL_MS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                if (!running) {
                    break;
                }
                continue;
            }
            if (m != null) {
                dispatch(m);
            }
        }
        LOG.debug("Orchestration loop '{}' exited", threadName);
    }

    private void dispatch(PipelineMessage m) {
        try {
            if (m instanceof PipelineMessage.FrameMessage f) {
                ThreadContext.put("stream", f.frame().sourceId().wireName());
                handler.onFrame(f.frame());
            } else if (m instanceof PipelineMessage.ResultMessage r) {
                ThreadContext.put("stream", r.result().streamId().wireName());
                handler.onResult(r.result());
            } else if (m instanceof PipelineMessage.ControlMessage<?> c) {
                LOG.debug("Running control action '{}'", c.name());
                c.run();
            }
        } catch (RuntimeException e) {
            LOG.error("Orchestration handler failed for {}: {}", m.getClass().getSimpleName(), e.toString(), e);
        } finally {
            ThreadContext.remove("stream");
        }
    }
}

package com.phillippitts.dualscribe.service.recognition;

import com.phillippitts.dualscribe.config.properties.RecognitionProperties;
import com.phillippitts.dualscribe.domain.AudioFrame;
import com.phillippitts.dualscribe.domain.RecognitionResult;
import com.phillippitts.dualscribe.domain.StreamId;
import com.phillippitts.dualscribe.exception.AlreadyOpenException;
import com.phillippitts.dualscribe.exception.AuthenticationException;
import com.phillippitts.dualscribe.exception.ConnectivityException;
import com.phillippitts.dualscribe.exception.RecognitionException;
import com.phillippitts.dualscribe.util.ThreadTimeouts;
import com.phillippitts.dualscribe.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One duplex recognizer connection bound to a single stream.
 *
 * <p><b>State machine:</b> IDLE → OPENING → ACTIVE → CLOSING → IDLE. Only ACTIVE accepts frames.
 * An error reported while ACTIVE drops the session to IDLE, publishes a
 * {@link RecognitionSessionErrorEvent} and notifies the {@link RecognitionSessionListener};
 * whether to reopen is left to the caller.
 *
 * <p><b>Threading:</b> {@link #pushFrame(AudioFrame)} only enqueues onto a bounded send queue and
 * never blocks; a per-session sender thread forwards bytes to the recognizer in order. When the
 * queue is full the frame is dropped and counted.
 *
 * <p><b>Result contract:</b> timestamps are forced non-decreasing per stream and confidence is
 * clamped to [0, 1]. Callbacks that belong to a previous connection (tracked by a generation
 * counter) are ignored, so a late result from a closed or failed handle can never leak into a
 * reopened session.
 */
public class StreamingRecognitionSession {

    private static final Logger LOG = LogManager.getLogger(StreamingRecognitionSession.class);

    private static final long SEND_POLL_MS = 50;
    private static final long DROP_LOG_INTERVAL = 100;

    private final StreamId streamId;
    private final RecognitionClient client;
    private final long openTimeoutMs;
    private final long closeTimeoutMs;
    private final BlockingQueue<byte[]> sendQueue;
    private final RecognitionSessionListener listener;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicLong generation = new AtomicLong();
    private final AtomicLong lastTimestamp = new AtomicLong(Long.MIN_VALUE);
    private final AtomicLong droppedFrames = new AtomicLong();

    private volatile SessionState state = SessionState.IDLE;
    private volatile boolean drainAndStop;
    // @GuardedBy("lock")
    private RecognitionHandle handle;
    // @GuardedBy("lock")
    private Thread sender;

    public StreamingRecognitionSession(StreamId streamId,
                                       RecognitionClient client,
                                       RecognitionProperties props,
                                       RecognitionSessionListener listener,
                                       ApplicationEventPublisher publisher,
                                       Clock clock) {
        this.streamId = Objects.requireNonNull(streamId, "streamId");
        this.client = Objects.requireNonNull(client, "client");
        this.openTimeoutMs = props.getOpenTimeoutMs();
        this.closeTimeoutMs = props.getCloseTimeoutMs();
        this.sendQueue = new ArrayBlockingQueue<>(props.getSendQueueCapacity());
        this.listener = Objects.requireNonNull(listener, "listener");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public StreamId streamId() {
        return streamId;
    }

    public SessionState state() {
        return state;
    }

    public boolean isActive() {
        return state == SessionState.ACTIVE;
    }

    /** Frames rejected because the send queue was full. */
    public long droppedFrames() {
        return droppedFrames.get();
    }

    /**
     * Opens the recognizer connection, waiting at most {@code recognition.open-timeout-ms}.
     *
     * @throws AlreadyOpenException if the session is not IDLE
     * @throws AuthenticationException if the recognizer rejected the credentials
     * @throws ConnectivityException on network failure or timeout
     */
    public void open(LanguageConfig language) {
        long gen;
        lock.lock();
        try {
            if (state != SessionState.IDLE) {
                throw new AlreadyOpenException(streamId, state.name());
            }
            state = SessionState.OPENING;
            gen = generation.incrementAndGet();
            lastTimestamp.set(Long.MIN_VALUE);
            sendQueue.clear();
        } finally {
            lock.unlock();
        }

        long startNanos = System.nanoTime();
        RecognitionHandle opened = awaitHandle(gen, language);

        boolean stale;
        lock.lock();
        try {
            stale = state != SessionState.OPENING || generation.get() != gen;
            if (!stale) {
                handle = opened;
                drainAndStop = false;
                Thread t = new Thread(() -> sendLoop(gen, opened), "recognition-send-" + streamId.wireName());
                t.setDaemon(true);
                sender = t;
                state = SessionState.ACTIVE;
                t.start();
            }
        } finally {
            lock.unlock();
        }
        if (stale) {
            closeQuietly(opened);
            throw new ConnectivityException("Recognition session for " + streamId.wireName()
                    + " was closed while opening", streamId);
        }
        LOG.info("Recognition session for {} opened via {} in {}ms",
                streamId.wireName(), client.name(), TimeUtils.elapsedMillis(startNanos));
    }

    private RecognitionHandle awaitHandle(long gen, LanguageConfig language) {
        CompletableFuture<RecognitionHandle> pending;
        try {
            pending = client.open(streamId, language, new HandleListener(gen));
        } catch (RecognitionException e) {
            resetIfOpening(gen);
            throw e;
        } catch (RuntimeException e) {
            resetIfOpening(gen);
            throw new ConnectivityException("Recognizer open failed for " + streamId.wireName()
                    + ": " + e.getMessage(), streamId, e);
        }
        try {
            return pending.get(openTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            resetIfOpening(gen);
            closeWhenReady(pending);
            throw new ConnectivityException("Opening recognition session for " + streamId.wireName()
                    + " timed out after " + openTimeoutMs + "ms", streamId, e);
        } catch (ExecutionException e) {
            resetIfOpening(gen);
            throw translate(e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            resetIfOpening(gen);
            closeWhenReady(pending);
            throw new ConnectivityException("Interrupted while opening recognition session for "
                    + streamId.wireName(), streamId, e);
        }
    }

    /**
     * Queues a frame for the recognizer without blocking.
     *
     * @return {@code false} if the session is not ACTIVE or the send queue is full
     * @throws IllegalArgumentException if the frame belongs to another stream
     */
    public boolean pushFrame(AudioFrame frame) {
        if (frame.sourceId() != streamId) {
            throw new IllegalArgumentException("Frame from " + frame.sourceId() + " pushed to session for " + streamId);
        }
        if (state != SessionState.ACTIVE) {
            return false;
        }
        if (!sendQueue.offer(frame.pcm())) {
            long dropped = droppedFrames.incrementAndGet();
            if (dropped == 1 || dropped % DROP_LOG_INTERVAL == 0) {
                LOG.warn("Send queue for {} saturated; dropped frame, total dropped={}", streamId.wireName(), dropped);
            }
            return false;
        }
        return true;
    }

    /**
     * Flushes queued audio, asks the recognizer for its pending final result and returns to IDLE.
     * Safe to call in any state; a no-op when IDLE.
     */
    public void close() {
        RecognitionHandle h;
        Thread s;
        long gen;
        lock.lock();
        try {
            if (state == SessionState.IDLE || state == SessionState.CLOSING) {
                return;
            }
            if (state == SessionState.OPENING) {
                // open() observes the generation change and discards its handle
                generation.incrementAndGet();
                state = SessionState.IDLE;
                LOG.info("Recognition session for {} closed while opening", streamId.wireName());
                return;
            }
            state = SessionState.CLOSING;
            h = handle;
            s = sender;
            gen = generation.get();
            drainAndStop = true;
        } finally {
            lock.unlock();
        }

        try {
            if (!ThreadTimeouts.join(s, Duration.ofMillis(closeTimeoutMs))) {
                LOG.warn("Sender for {} did not drain within {}ms", streamId.wireName(), closeTimeoutMs);
            }
            h.close().get(closeTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            LOG.warn("Recognizer flush for {} timed out after {}ms", streamId.wireName(), closeTimeoutMs);
        } catch (ExecutionException e) {
            LOG.warn("Recognizer flush for {} failed: {}", streamId.wireName(), String.valueOf(e.getCause()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while closing recognition session for {}", streamId.wireName());
        } catch (RuntimeException e) {
            LOG.warn("Recognizer close for {} failed: {}", streamId.wireName(), e.toString());
        } finally {
            lock.lock();
            try {
                if (generation.get() == gen) {
                    generation.incrementAndGet();
                }
                handle = null;
                sender = null;
                sendQueue.clear();
                state = SessionState.IDLE;
            } finally {
                lock.unlock();
            }
        }
        LOG.info("Recognition session for {} closed", streamId.wireName());
    }

    private void sendLoop(long gen, RecognitionHandle h) {
        try {
            while (true) {
                byte[] pcm = sendQueue.poll(SEND_POLL_MS, TimeUnit.MILLISECONDS);
                if (generation.get() != gen) {
                    break;
                }
                if (pcm != null) {
                    h.send(pcm);
                } else if (drainAndStop) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (RecognitionException e) {
            fail(gen, e, e instanceof AuthenticationException
                    ? RecognitionErrorKind.AUTHENTICATION : RecognitionErrorKind.CONNECTIVITY);
        } catch (RuntimeException e) {
            fail(gen, new ConnectivityException("Sending audio for " + streamId.wireName() + " failed: "
                    + e.getMessage(), streamId, e), RecognitionErrorKind.CONNECTIVITY);
        }
    }

    private void fail(long gen, RecognitionException error, RecognitionErrorKind kind) {
        RecognitionHandle h;
        lock.lock();
        try {
            if (generation.get() != gen) {
                return;
            }
            if (state == SessionState.CLOSING) {
                LOG.warn("Recognizer error for {} while closing: {}", streamId.wireName(), error.getMessage());
                return;
            }
            if (state != SessionState.ACTIVE) {
                return;
            }
            generation.incrementAndGet();
            state = SessionState.IDLE;
            h = handle;
            handle = null;
            sender = null;
            drainAndStop = true;
            sendQueue.clear();
        } finally {
            lock.unlock();
        }
        LOG.warn("Recognition session for {} failed: kind={}, message={}", streamId.wireName(), kind, error.getMessage());
        closeQuietly(h);
        publisher.publishEvent(new RecognitionSessionErrorEvent(streamId, kind, error.getMessage(), Instant.now(clock)));
        listener.onSessionError(streamId, error);
    }

    private void resetIfOpening(long gen) {
        lock.lock();
        try {
            if (state == SessionState.OPENING && generation.get() == gen) {
                state = SessionState.IDLE;
            }
        } finally {
            lock.unlock();
        }
    }

    private RecognitionException translate(Throwable cause) {
        Throwable c = cause;
        while (c instanceof CompletionException && c.getCause() != null) {
            c = c.getCause();
        }
        if (c instanceof RecognitionException re) {
            return re;
        }
        return new ConnectivityException("Recognizer open failed for " + streamId.wireName() + ": "
                + (c == null ? "unknown" : c.getMessage()), streamId, c);
    }

    private void closeWhenReady(CompletableFuture<RecognitionHandle> pending) {
        pending.thenAccept(this::closeQuietly);
    }

    private void closeQuietly(RecognitionHandle h) {
        if (h == null) {
            return;
        }
        try {
            h.close().exceptionally(t -> {
                LOG.debug("Closing recognizer handle for {} failed: {}", streamId.wireName(), t.toString());
                return null;
            });
        } catch (RuntimeException e) {
            LOG.debug("Closing recognizer handle for {} failed: {}", streamId.wireName(), e.toString());
        }
    }

    private long monotonic(long timestampMs) {
        return lastTimestamp.accumulateAndGet(timestampMs, Math::max);
    }

    /** Routes callbacks of one connection; ignores them once the connection is superseded. */
    private final class HandleListener implements RecognitionListener {

        private final long gen;

        HandleListener(long gen) {
            this.gen = gen;
        }

        private boolean current() {
            return generation.get() == gen && state != SessionState.IDLE;
        }

        @Override
        public void onInterim(String text, long timestampMs) {
            if (!current()) {
                return;
            }
            listener.onResult(RecognitionResult.interim(streamId, text, monotonic(timestampMs)));
        }

        @Override
        public void onFinal(String text, double confidence, long timestampMs) {
            if (!current()) {
                LOG.debug("Ignoring final result from superseded connection for {}", streamId.wireName());
                return;
            }
            listener.onResult(RecognitionResult.finalResult(streamId, text, confidence, monotonic(timestampMs)));
        }

        @Override
        public void onError(RecognitionErrorKind kind, String message) {
            RecognitionException error = switch (kind) {
                case AUTHENTICATION -> new AuthenticationException(message, streamId);
                case CONNECTIVITY -> new ConnectivityException(message, streamId);
                case PROTOCOL -> new RecognitionException(message, streamId);
            };
            fail(gen, error, kind);
        }
    }
}

package com.phillippitts.dualscribe.service.orchestration;

import com.phillippitts.dualscribe.domain.AudioFrame;
import com.phillippitts.dualscribe.domain.RecognitionResult;
import com.phillippitts.dualscribe.domain.StreamId;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class OrchestrationLoopTest {

    private OrchestrationLoop loop;

    @AfterEach
    void tearDown() {
        if (loop != null) {
            loop.shutdown();
        }
    }

    @Test
    void handlesFramesAndResultsInSubmissionOrder() throws Exception {
        RecordingHandler handler = new RecordingHandler();
        loop = new OrchestrationLoop("test-loop", 16, handler);
        loop.start();

        loop.submitFrame(frame(StreamId.MICROPHONE, 0));
        loop.submitResult(RecognitionResult.finalResult(StreamId.MICROPHONE, "hello", 0.9, 10));
        loop.submitFrame(frame(StreamId.SYSTEM_AUDIO, 20));

        // A control call queued last completes only after everything before it was handled
        loop.call("barrier", () -> null).get(5, TimeUnit.SECONDS);
        assertThat(handler.seen).containsExactly("frame:microphone@0", "final:hello", "frame:system@20");
    }

    @Test
    void dropsFramesWhenQueueIsFull() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        RecordingHandler handler = new RecordingHandler();
        loop = new OrchestrationLoop("test-loop", 1, handler);
        loop.start();

        // Park the loop thread so the queue fills
        CompletableFuture<Object> blocker = loop.call("block", () -> {
            awaitLatch(release);
            return null;
        });
        await().atMost(Duration.ofSeconds(2)).until(() -> loop.pending() == 0);

        assertThat(loop.submitFrame(frame(StreamId.MICROPHONE, 0))).isTrue();
        assertThat(loop.submitFrame(frame(StreamId.MICROPHONE, 20))).isFalse();
        assertThat(loop.droppedFrames()).isEqualTo(1);

        release.countDown();
        blocker.get(5, TimeUnit.SECONDS);
        await().atMost(Duration.ofSeconds(2)).until(() -> handler.seen.size() == 1);
    }

    @Test
    void callFromLoopThreadRunsInline() throws Exception {
        loop = new OrchestrationLoop("test-loop", 4, new RecordingHandler());
        loop.start();

        String result = loop.call("outer", () -> loop.call("inner", () -> "nested").join())
                .get(5, TimeUnit.SECONDS);

        assertThat(result).isEqualTo("nested");
    }

    @Test
    void callFailsWhenLoopIsNotRunning() {
        loop = new OrchestrationLoop("test-loop", 4, new RecordingHandler());

        CompletableFuture<String> reply = loop.call("noop", () -> "x");

        assertThatThrownBy(() -> reply.get(1, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(RejectedExecutionException.class);
    }

    @Test
    void actionExceptionCompletesReplyExceptionally() {
        loop = new OrchestrationLoop("test-loop", 4, new RecordingHandler());
        loop.start();

        CompletableFuture<String> reply = loop.call("boom", () -> {
            throw new IllegalStateException("boom");
        });

        assertThatThrownBy(() -> reply.get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void handlerFailureDoesNotStopLoop() throws Exception {
        RecordingHandler handler = new RecordingHandler();
        handler.failOnText = "bad";
        loop = new OrchestrationLoop("test-loop", 8, handler);
        loop.start();

        loop.submitResult(RecognitionResult.finalResult(StreamId.MICROPHONE, "bad", 0.9, 0));
        loop.submitResult(RecognitionResult.finalResult(StreamId.MICROPHONE, "good", 0.9, 10));
        loop.call("barrier", () -> null).get(5, TimeUnit.SECONDS);

        assertThat(handler.seen).containsExactly("final:good");
        assertThat(loop.isRunning()).isTrue();
    }

    @Test
    void shutdownFailsPendingCalls() {
        CountDownLatch release = new CountDownLatch(1);
        loop = new OrchestrationLoop("test-loop", 4, new RecordingHandler());
        loop.start();
        loop.call("block", () -> {
            awaitLatch(release);
            return null;
        });
        await().atMost(Duration.ofSeconds(2)).until(() -> loop.pending() == 0);
        CompletableFuture<String> pending = loop.call("pending", () -> "never");

        loop.shutdown();
        release.countDown();

        assertThat(loop.isRunning()).isFalse();
        assertThatThrownBy(() -> pending.get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(RejectedExecutionException.class);
    }

    @Test
    void rejectsNonPositiveCapacity() {
        assertThatThrownBy(() -> new OrchestrationLoop("bad", 0, new RecordingHandler()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static AudioFrame frame(StreamId id, long ts) {
        return new AudioFrame(id, new byte[640], ts);
    }

    private static void awaitLatch(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static final class RecordingHandler implements OrchestrationLoop.Handler {
        final List<String> seen = new CopyOnWriteArrayList<>();
        volatile String failOnText;

        @Override
        public void onFrame(AudioFrame frame) {
            seen.add("frame:" + frame.sourceId().wireName() + "@" + frame.timestampMs());
        }

        @Override
        public void onResult(RecognitionResult result) {
            if (result.text().equals(failOnText)) {
                throw new IllegalStateException("handler failure");
            }
            seen.add((result.isFinal() ? "final:" : "interim:") + result.text());
        }
    }
}

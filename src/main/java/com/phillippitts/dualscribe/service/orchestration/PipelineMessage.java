package com.phillippitts.dualscribe.service.orchestration;

import com.phillippitts.dualscribe.domain.AudioFrame;
import com.phillippitts.dualscribe.domain.RecognitionResult;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Messages handled by the {@link OrchestrationLoop}.
 */
public interface PipelineMessage {

    /** Audio captured from one source, to be forwarded to that stream's recognizer. */
    record FrameMessage(AudioFrame frame) implements PipelineMessage {
        public FrameMessage {
            Objects.requireNonNull(frame, "frame");
        }
    }

    /** Recognizer output, to be applied to the transcript engine. */
    record ResultMessage(RecognitionResult result) implements PipelineMessage {
        public ResultMessage {
            Objects.requireNonNull(result, "result");
        }
    }

    /**
     * Arbitrary work that must run on the loop thread, e.g. opening or sealing a transcript session.
     *
     * @param name   label for logs
     * @param action work to run
     * @param reply  completed with the result or failure of {@code action}
     */
    record ControlMessage<T>(String name, Supplier<T> action, CompletableFuture<T> reply) implements PipelineMessage {

        void run() {
            try {
                reply.complete(action.get());
            } catch (RuntimeException e) {
                reply.completeExceptionally(e);
            }
        }
    }
}

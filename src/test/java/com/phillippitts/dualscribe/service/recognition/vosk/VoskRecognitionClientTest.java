package com.phillippitts.dualscribe.service.recognition.vosk;

import com.phillippitts.dualscribe.domain.StreamId;
import com.phillippitts.dualscribe.exception.ModelNotFoundException;
import com.phillippitts.dualscribe.service.recognition.LanguageConfig;
import com.phillippitts.dualscribe.service.recognition.RecognitionErrorKind;
import com.phillippitts.dualscribe.service.recognition.RecognitionHandle;
import com.phillippitts.dualscribe.service.recognition.RecognitionListener;
import com.phillippitts.dualscribe.testutil.InlineRecognitionExecutor;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VoskRecognitionClientTest {

    private static final RecognitionListener NO_OP = new RecognitionListener() {
        @Override
        public void onInterim(String text, long timestampMs) {
        }

        @Override
        public void onFinal(String text, double confidence, long timestampMs) {
        }

        @Override
        public void onError(RecognitionErrorKind kind, String message) {
        }
    };

    @Test
    void reportsUnavailableWhenModelDirectoryMissing(@TempDir Path dir) {
        VoskRecognitionClient client = new VoskRecognitionClient(dir.resolve("missing").toString(),
                new InlineRecognitionExecutor(), Clock.systemUTC());

        assertThat(client.name()).isEqualTo("vosk");
        assertThat(client.isAvailable()).isFalse();
    }

    @Test
    void reportsAvailableWhenModelDirectoryExists(@TempDir Path dir) {
        VoskRecognitionClient client = new VoskRecognitionClient(dir.toString(), new InlineRecognitionExecutor(), Clock.systemUTC());

        assertThat(client.isAvailable()).isTrue();
    }

    @Test
    void openFailsWithModelNotFoundWhenModelMissing(@TempDir Path dir) {
        String modelPath = dir.resolve("missing").toString();
        InlineRecognitionExecutor executor = new InlineRecognitionExecutor();
        VoskRecognitionClient client = new VoskRecognitionClient(modelPath, executor, Clock.systemUTC());

        CompletableFuture<RecognitionHandle> opened =
                client.open(StreamId.MICROPHONE, new LanguageConfig("en-US", true), NO_OP);

        assertThatThrownBy(opened::get)
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(ModelNotFoundException.class)
                .hasMessageContaining(modelPath);
        assertThat(executor.tasksRun()).isEqualTo(1);
    }

    @Test
    void closeWithoutLoadedModelIsNoOp(@TempDir Path dir) {
        VoskRecognitionClient client = new VoskRecognitionClient(dir.toString(), new InlineRecognitionExecutor(), Clock.systemUTC());

        client.close();
        client.close();

        assertThat(client.isAvailable()).isTrue();
    }
}

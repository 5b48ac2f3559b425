package com.phillippitts.dualscribe.service.recognition;

import com.phillippitts.dualscribe.config.properties.RecognitionProperties;
import com.phillippitts.dualscribe.domain.AudioFrame;
import com.phillippitts.dualscribe.domain.RecognitionResult;
import com.phillippitts.dualscribe.domain.StreamId;
import com.phillippitts.dualscribe.exception.AlreadyOpenException;
import com.phillippitts.dualscribe.exception.AuthenticationException;
import com.phillippitts.dualscribe.exception.ConnectivityException;
import com.phillippitts.dualscribe.exception.RecognitionException;
import com.phillippitts.dualscribe.testutil.EventCapturingPublisher;
import com.phillippitts.dualscribe.testutil.FakeRecognitionClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class StreamingRecognitionSessionTest {

    private static final LanguageConfig EN = new LanguageConfig("en-US", true);

    private FakeRecognitionClient client;
    private EventCapturingPublisher publisher;
    private CapturingListener listener;
    private StreamingRecognitionSession session;

    @BeforeEach
    void setUp() {
        client = new FakeRecognitionClient();
        publisher = new EventCapturingPublisher();
        listener = new CapturingListener();
        session = newSession(props(100, 4));
    }

    @AfterEach
    void tearDown() {
        session.close();
    }

    private StreamingRecognitionSession newSession(RecognitionProperties props) {
        return new StreamingRecognitionSession(StreamId.MICROPHONE, client, props, listener, publisher,
                Clock.systemUTC());
    }

    private static RecognitionProperties props(long openTimeoutMs, int queueCapacity) {
        return new RecognitionProperties(RecognitionProperties.Provider.VOSK, "en-US", true,
                openTimeoutMs, 500L, queueCapacity, null, null, null);
    }

    private static AudioFrame frame(StreamId id, int bytes) {
        return new AudioFrame(id, new byte[bytes], System.currentTimeMillis());
    }

    @Test
    void opensToActiveAndForwardsFramesInOrder() {
        session.open(EN);
        assertThat(session.state()).isEqualTo(SessionState.ACTIVE);

        AudioFrame first = new AudioFrame(StreamId.MICROPHONE, new byte[] {1, 1}, 1L);
        AudioFrame second = new AudioFrame(StreamId.MICROPHONE, new byte[] {2, 2}, 2L);
        assertThat(session.pushFrame(first)).isTrue();
        assertThat(session.pushFrame(second)).isTrue();

        FakeRecognitionClient.FakeHandle handle = client.handle(StreamId.MICROPHONE);
        await().atMost(Duration.ofSeconds(2)).until(() -> handle.sent().size() == 2);
        assertThat(handle.sent().get(0)).containsExactly(1, 1);
        assertThat(handle.sent().get(1)).containsExactly(2, 2);
    }

    @Test
    void secondOpenIsRejected() {
        session.open(EN);

        assertThatThrownBy(() -> session.open(EN))
                .isInstanceOf(AlreadyOpenException.class);
        assertThat(session.isActive()).isTrue();
    }

    @Test
    void pushFrameReturnsFalseWhenIdle() {
        assertThat(session.pushFrame(frame(StreamId.MICROPHONE, 320))).isFalse();
    }

    @Test
    void pushFrameRejectsFramesFromAnotherStream() {
        session.open(EN);

        assertThatThrownBy(() -> session.pushFrame(frame(StreamId.SYSTEM_AUDIO, 320)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void authenticationFailureOnOpenLeavesSessionIdle() {
        client.failNextOpen(StreamId.MICROPHONE, new AuthenticationException("bad key", StreamId.MICROPHONE));

        assertThatThrownBy(() -> session.open(EN))
                .isInstanceOf(AuthenticationException.class)
                .hasMessageContaining("bad key");
        assertThat(session.state()).isEqualTo(SessionState.IDLE);
    }

    @Test
    void unexpectedOpenFailureIsTranslatedToConnectivity() {
        client.failNextOpen(StreamId.MICROPHONE, new IllegalStateException("socket reset"));

        assertThatThrownBy(() -> session.open(EN))
                .isInstanceOf(ConnectivityException.class)
                .hasMessageContaining("socket reset");
        assertThat(session.state()).isEqualTo(SessionState.IDLE);
    }

    @Test
    void openTimesOutAndReturnsToIdle() {
        client.hangNextOpen(StreamId.MICROPHONE);

        assertThatThrownBy(() -> session.open(EN))
                .isInstanceOf(ConnectivityException.class)
                .hasMessageContaining("timed out");
        assertThat(session.state()).isEqualTo(SessionState.IDLE);

        // a later open succeeds
        session.open(EN);
        assertThat(session.isActive()).isTrue();
    }

    @Test
    void closeDeliversPendingFinalBeforeReturning() {
        client.finalOnClose(StreamId.MICROPHONE, "last words");
        session.open(EN);

        session.close();

        assertThat(session.state()).isEqualTo(SessionState.IDLE);
        assertThat(listener.results).extracting(RecognitionResult::text).containsExactly("last words");
        assertThat(client.handle(StreamId.MICROPHONE).isClosed()).isTrue();
    }

    @Test
    void closeIsNoOpWhenIdle() {
        session.close();
        session.close();

        assertThat(session.state()).isEqualTo(SessionState.IDLE);
    }

    @Test
    void resultsAreNormalized() {
        session.open(EN);
        RecognitionListener cb = client.listener(StreamId.MICROPHONE);

        cb.onFinal("hello", 1.7, 2000L);
        cb.onInterim("hel", 1000L);

        assertThat(listener.results).hasSize(2);
        RecognitionResult fin = listener.results.get(0);
        assertThat(fin.isFinal()).isTrue();
        assertThat(fin.confidence()).isEqualTo(1.0);
        // timestamps never go backwards
        assertThat(listener.results.get(1).timestampMs()).isEqualTo(2000L);
        assertThat(listener.results.get(1).isFinal()).isFalse();
    }

    @Test
    void errorWhileActiveDropsToIdleAndNotifies() {
        session.open(EN);
        RecognitionListener cb = client.listener(StreamId.MICROPHONE);

        cb.onError(RecognitionErrorKind.CONNECTIVITY, "connection reset");

        assertThat(session.state()).isEqualTo(SessionState.IDLE);
        assertThat(listener.errors).hasSize(1);
        assertThat(listener.errors.get(0)).isInstanceOf(ConnectivityException.class);
        assertThat(listener.errors.get(0).isTransient()).isTrue();
        RecognitionSessionErrorEvent event = publisher.first(RecognitionSessionErrorEvent.class);
        assertThat(event).isNotNull();
        assertThat(event.streamId()).isEqualTo(StreamId.MICROPHONE);
        assertThat(event.kind()).isEqualTo(RecognitionErrorKind.CONNECTIVITY);
    }

    @Test
    void protocolErrorIsNotTransient() {
        session.open(EN);

        client.listener(StreamId.MICROPHONE).onError(RecognitionErrorKind.PROTOCOL, "garbage");

        assertThat(listener.errors).singleElement()
                .satisfies(e -> assertThat(e.isTransient()).isFalse());
    }

    @Test
    void callbacksFromSupersededConnectionAreIgnored() {
        session.open(EN);
        RecognitionListener stale = client.listener(StreamId.MICROPHONE);
        session.close();
        session.open(EN);

        stale.onFinal("late result", 0.9, 5000L);
        stale.onError(RecognitionErrorKind.CONNECTIVITY, "late error");

        assertThat(listener.results).isEmpty();
        assertThat(listener.errors).isEmpty();
        assertThat(session.isActive()).isTrue();
    }

    @Test
    void sendFailureFailsTheSession() {
        session.open(EN);
        client.handle(StreamId.MICROPHONE).failSendsWith(new IllegalStateException("broken pipe"));

        session.pushFrame(frame(StreamId.MICROPHONE, 320));

        await().atMost(Duration.ofSeconds(2)).until(() -> session.state() == SessionState.IDLE);
        assertThat(listener.errors).singleElement().isInstanceOf(ConnectivityException.class);
    }

    private static final class CapturingListener implements RecognitionSessionListener {
        final List<RecognitionResult> results = new CopyOnWriteArrayList<>();
        final List<RecognitionException> errors = new CopyOnWriteArrayList<>();

        @Override
        public void onResult(RecognitionResult result) {
            results.add(result);
        }

        @Override
        public void onSessionError(StreamId streamId, RecognitionException error) {
            errors.add(error);
        }
    }
}

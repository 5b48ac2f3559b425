package com.phillippitts.dualscribe.service.events;

import com.phillippitts.dualscribe.domain.StreamId;
import com.phillippitts.dualscribe.service.audio.capture.CaptureErrorEvent;
import com.phillippitts.dualscribe.service.recognition.RecognitionErrorKind;
import com.phillippitts.dualscribe.service.recognition.RecognitionSessionErrorEvent;
import com.phillippitts.dualscribe.service.transcript.event.PersistenceFailedEvent;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class ErrorEventsListenerTest {

    @Test
    void throttlesRepeatLogs() {
        ErrorEventsListener l = new ErrorEventsListener();
        assertThat(l.shouldLog("capture-MICROPHONE-DEVICE_LOST")).isTrue();
        assertThat(l.shouldLog("capture-MICROPHONE-DEVICE_LOST")).isFalse();
        // Different keys are throttled independently
        assertThat(l.shouldLog("capture-SYSTEM_AUDIO-DEVICE_LOST")).isTrue();
    }

    @Test
    void handlersDoNotThrow() {
        ErrorEventsListener l = new ErrorEventsListener();
        assertThatCode(() -> {
            l.onCaptureError(new CaptureErrorEvent(StreamId.MICROPHONE, "DEVICE_LOST", Instant.now()));
            l.onRecognitionError(new RecognitionSessionErrorEvent(StreamId.SYSTEM_AUDIO,
                    RecognitionErrorKind.AUTHENTICATION, "401", Instant.now()));
            l.onRecognitionError(new RecognitionSessionErrorEvent(StreamId.SYSTEM_AUDIO,
                    RecognitionErrorKind.CONNECTIVITY, "reset", Instant.now()));
            l.onPersistenceFailed(new PersistenceFailedEvent("s-1", Path.of("/tmp/s-1.json"), "disk full",
                    Instant.now()));
        }).doesNotThrowAnyException();
    }
}

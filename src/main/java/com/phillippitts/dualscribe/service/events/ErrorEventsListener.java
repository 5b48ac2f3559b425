package com.phillippitts.dualscribe.service.events;

import com.phillippitts.dualscribe.service.audio.capture.CaptureErrorEvent;
import com.phillippitts.dualscribe.service.recognition.RecognitionErrorKind;
import com.phillippitts.dualscribe.service.recognition.RecognitionSessionErrorEvent;
import com.phillippitts.dualscribe.service.transcript.event.PersistenceFailedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized handler for user-facing error events. Privacy-safe and throttled to avoid log spam.
 */
@Component
class ErrorEventsListener {
    private static final Logger LOG = LogManager.getLogger(ErrorEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onCaptureError(CaptureErrorEvent e) {
        String key = "capture-" + e.source() + '-' + e.reason();
        if (shouldLog(key)) {
            LOG.warn("Capture error on {}: reason={}. Check the audio device and permissions.",
                    e.source().wireName(), e.reason());
        }
    }

    @EventListener
    void onRecognitionError(RecognitionSessionErrorEvent e) {
        String key = "recognition-" + e.streamId() + '-' + e.kind();
        if (shouldLog(key)) {
            if (e.kind() == RecognitionErrorKind.AUTHENTICATION) {
                LOG.error("Recognizer rejected credentials for {}. Check recognition.remote.api-key.",
                        e.streamId().wireName());
            } else {
                LOG.warn("Recognition error on {}: kind={}, message={}", e.streamId().wireName(), e.kind(), e.message());
            }
        }
    }

    @EventListener
    void onPersistenceFailed(PersistenceFailedEvent e) {
        if (shouldLog("persistence-" + e.path())) {
            LOG.warn("Could not save session {} to {}: {}. Transcripts remain in memory.",
                    e.sessionId(), e.path(), e.message());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}

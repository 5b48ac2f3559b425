package com.phillippitts.dualscribe.service.recognition;

/**
 * Callbacks from a recognizer connection. May be invoked on any thread, but never concurrently
 * for the same handle.
 */
public interface RecognitionListener {

    void onInterim(String text, long timestampMs);

    void onFinal(String text, double confidence, long timestampMs);

    void onError(RecognitionErrorKind kind, String message);
}

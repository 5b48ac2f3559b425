package com.phillippitts.dualscribe.service.recognition.remote;

import com.phillippitts.dualscribe.service.recognition.RecognitionErrorKind;

/**
 * Decoded downstream message of the remote recognizer protocol.
 *
 * @param type        message type
 * @param text        recognized text for interim/final messages
 * @param confidence  confidence for final messages
 * @param timestampMs recognizer timestamp, or -1 when the server did not send one
 * @param errorKind   classification for error messages
 * @param message     error description
 */
record RemoteMessage(Type type, String text, double confidence, long timestampMs,
                     RecognitionErrorKind errorKind, String message) {

    enum Type { INTERIM, FINAL, ERROR, IGNORED }

    static RemoteMessage ignored() {
        return new RemoteMessage(Type.IGNORED, "", 0.0, -1L, null, null);
    }
}

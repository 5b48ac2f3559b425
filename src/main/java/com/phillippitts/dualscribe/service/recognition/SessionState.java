package com.phillippitts.dualscribe.service.recognition;

/**
 * Lifecycle of a {@link StreamingRecognitionSession}.
 *
 * <pre>
 * IDLE → OPENING → ACTIVE → CLOSING → IDLE
 *           ↘ IDLE (open failed)   ↘ IDLE (error)
 * </pre>
 */
public enum SessionState {
    IDLE,
    OPENING,
    ACTIVE,
    CLOSING
}

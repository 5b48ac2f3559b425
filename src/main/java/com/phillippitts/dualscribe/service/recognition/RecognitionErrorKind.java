package com.phillippitts.dualscribe.service.recognition;

/** Classification of errors reported by a recognizer connection. */
public enum RecognitionErrorKind {
    /** Credentials rejected; fatal. */
    AUTHENTICATION,
    /** Network or transport failure; transient. */
    CONNECTIVITY,
    /** Recognizer sent something we could not interpret, or failed internally. */
    PROTOCOL
}

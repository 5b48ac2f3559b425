package com.phillippitts.dualscribe.domain;

/** Whether a transcript is a live preview or a committed recognition result. */
public enum TranscriptKind {
    INTERIM,
    FINAL
}

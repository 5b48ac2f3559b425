package com.phillippitts.dualscribe.service.orchestration;

/** Lifecycle of the recording orchestrator. */
public enum RecordingState {
    IDLE,
    STARTING,
    RECORDING,
    STOPPING
}

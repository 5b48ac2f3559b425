package com.phillippitts.dualscribe.service.orchestration;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecordingStateMachineTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    @Test
    void startsIdle() {
        RecordingStateMachine sm = new RecordingStateMachine();

        assertThat(sm.state()).isEqualTo(RecordingState.IDLE);
        assertThat(sm.isRecording()).isFalse();
        assertThat(sm.snapshot().sessionId()).isNull();
    }

    @Test
    void walksThroughFullLifecycle() {
        RecordingStateMachine sm = new RecordingStateMachine();

        assertThat(sm.beginStart()).isTrue();
        assertThat(sm.state()).isEqualTo(RecordingState.STARTING);

        sm.markRecording("s-1", T0, CaptureMode.DUAL);
        assertThat(sm.isRecording()).isTrue();
        RecordingStateMachine.Snapshot snap = sm.snapshot();
        assertThat(snap.sessionId()).isEqualTo("s-1");
        assertThat(snap.startedAt()).isEqualTo(T0);
        assertThat(snap.captureMode()).isEqualTo(CaptureMode.DUAL);

        assertThat(sm.beginStop()).isTrue();
        assertThat(sm.state()).isEqualTo(RecordingState.STOPPING);

        sm.markIdle();
        assertThat(sm.state()).isEqualTo(RecordingState.IDLE);
        assertThat(sm.snapshot().sessionId()).isNull();
    }

    @Test
    void rejectsSecondStartWhileStarting() {
        RecordingStateMachine sm = new RecordingStateMachine();
        sm.beginStart();

        assertThat(sm.beginStart()).isFalse();
    }

    @Test
    void stopIsRejectedUnlessRecording() {
        RecordingStateMachine sm = new RecordingStateMachine();
        assertThat(sm.beginStop()).isFalse();

        sm.beginStart();
        assertThat(sm.beginStop()).isFalse();
        assertThat(sm.state()).isEqualTo(RecordingState.STARTING);
    }

    @Test
    void markRecordingRequiresStarting() {
        RecordingStateMachine sm = new RecordingStateMachine();

        assertThatThrownBy(() -> sm.markRecording("s-1", T0, CaptureMode.DUAL))
                .isInstanceOf(IllegalStateException.class);
    }
}

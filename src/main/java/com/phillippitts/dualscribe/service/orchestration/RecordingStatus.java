package com.phillippitts.dualscribe.service.orchestration;

import com.phillippitts.dualscribe.domain.StreamId;
import com.phillippitts.dualscribe.service.recognition.SessionState;

import java.time.Instant;
import java.util.Map;

/**
 * Point-in-time view of the recording orchestrator.
 *
 * @param state              lifecycle state
 * @param sessionId          transcript session of the current recording, or {@code null}
 * @param startedAt          when the current recording started, or {@code null}
 * @param captureMode        mode of the current recording, or {@code null}
 * @param streams            per-stream details for every configured stream
 * @param loopDroppedFrames  frames dropped because the orchestration queue was full
 */
public record RecordingStatus(RecordingState state,
                              String sessionId,
                              Instant startedAt,
                              CaptureMode captureMode,
                              Map<StreamId, StreamStatus> streams,
                              long loopDroppedFrames) {

    public RecordingStatus {
        streams = streams == null ? Map.of() : Map.copyOf(streams);
    }

    public boolean recording() {
        return state == RecordingState.RECORDING;
    }

    /**
     * @param sessionState         recognition session state
     * @param captureActive        whether the source is delivering audio
     * @param health               reconnect health
     * @param captureDroppedFrames frames dropped by the capture queue
     * @param sessionDroppedFrames frames the recognition session could not accept
     */
    public record StreamStatus(SessionState sessionState,
                               boolean captureActive,
                               StreamHealth health,
                               long captureDroppedFrames,
                               long sessionDroppedFrames) {}
}

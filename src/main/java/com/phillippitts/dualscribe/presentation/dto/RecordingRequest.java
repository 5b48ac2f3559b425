package com.phillippitts.dualscribe.presentation.dto;

import com.phillippitts.dualscribe.service.orchestration.CaptureMode;
import com.phillippitts.dualscribe.service.orchestration.RecordingOptions;

import java.util.Map;

/**
 * Optional body of start/toggle requests. Missing fields fall back to configuration.
 */
public record RecordingRequest(CaptureMode captureMode, String language, Map<String, String> metadata) {

    public RecordingOptions toOptions() {
        return new RecordingOptions(captureMode, language, metadata);
    }
}

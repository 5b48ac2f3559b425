package com.phillippitts.dualscribe.presentation.controller;

import com.phillippitts.dualscribe.domain.SessionSummary;
import com.phillippitts.dualscribe.presentation.dto.RecordingRequest;
import com.phillippitts.dualscribe.service.orchestration.RecordingOptions;
import com.phillippitts.dualscribe.service.orchestration.RecordingOrchestrator;
import com.phillippitts.dualscribe.service.orchestration.RecordingStatus;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Start, stop and inspect recordings.
 */
@RestController
@RequestMapping("/api/recording")
class RecordingController {

    private static final Logger LOG = LogManager.getLogger(RecordingController.class);

    private final RecordingOrchestrator orchestrator;

    RecordingController(RecordingOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @PostMapping("/start")
    ResponseEntity<Map<String, Object>> start(@RequestBody(required = false) RecordingRequest request) {
        LOG.info("Start recording requested");
        String sessionId = orchestrator.startRecording(options(request));
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("sessionId", sessionId);
        body.put("status", orchestrator.status());
        return ResponseEntity.ok(body);
    }

    @PostMapping("/stop")
    ResponseEntity<Map<String, Object>> stop() {
        LOG.info("Stop recording requested");
        Optional<SessionSummary> summary = orchestrator.stopRecording();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("stopped", summary.isPresent());
        body.put("summary", summary.orElse(null));
        return ResponseEntity.ok(body);
    }

    @PostMapping("/toggle")
    ResponseEntity<RecordingStatus> toggle(@RequestBody(required = false) RecordingRequest request) {
        return ResponseEntity.ok(orchestrator.toggleRecording(options(request)));
    }

    @GetMapping("/status")
    ResponseEntity<RecordingStatus> status() {
        return ResponseEntity.ok(orchestrator.status());
    }

    private static RecordingOptions options(RecordingRequest request) {
        return request == null ? RecordingOptions.defaults() : request.toOptions();
    }
}

package com.phillippitts.dualscribe.presentation.controller;

import com.phillippitts.dualscribe.domain.InterimTranscript;
import com.phillippitts.dualscribe.domain.Transcript;
import com.phillippitts.dualscribe.presentation.dto.PolicyUpdate;
import com.phillippitts.dualscribe.service.transcript.DuplicatePolicy;
import com.phillippitts.dualscribe.service.transcript.ExportFormat;
import com.phillippitts.dualscribe.service.transcript.SearchOptions;
import com.phillippitts.dualscribe.service.transcript.TranscriptEngine;
import com.phillippitts.dualscribe.service.transcript.TranscriptStatus;
import jakarta.validation.Valid;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Read access to the transcript log plus policy tuning and clearing.
 */
@RestController
@RequestMapping("/api/transcripts")
class TranscriptController {

    static final int MAX_RECENT = 1000;

    private final TranscriptEngine engine;

    TranscriptController(TranscriptEngine engine) {
        this.engine = engine;
    }

    @GetMapping("/recent")
    List<Transcript> recent(@RequestParam(defaultValue = "10") int count) {
        return engine.getRecent(Math.min(count, MAX_RECENT));
    }

    @GetMapping("/search")
    List<Transcript> search(@RequestParam(name = "q", defaultValue = "") String query,
                            @RequestParam(required = false) String speaker,
                            @RequestParam(required = false) Long from,
                            @RequestParam(required = false) Long to,
                            @RequestParam(defaultValue = "false") boolean caseSensitive,
                            @RequestParam(defaultValue = "50") int limit) {
        return engine.search(query, new SearchOptions(speaker, from, to, caseSensitive, limit));
    }

    @GetMapping("/interim")
    List<InterimTranscript> interim() {
        return engine.getInterimTranscripts();
    }

    @GetMapping("/session")
    List<Transcript> session() {
        return engine.getSessionTranscripts();
    }

    @GetMapping("/status")
    TranscriptStatus status() {
        return engine.getStatus();
    }

    @GetMapping("/export")
    ResponseEntity<String> export(@RequestParam(defaultValue = "json") String format) {
        ExportFormat f = ExportFormat.fromName(format);
        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(f.contentType()))
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"transcript." + f.extension() + "\"")
                .body(engine.export(f));
    }

    @PutMapping("/policy")
    DuplicatePolicy updatePolicy(@Valid @RequestBody PolicyUpdate update) {
        DuplicatePolicy updated = update.applyTo(engine.getPolicy());
        engine.updatePolicy(updated);
        return updated;
    }

    @DeleteMapping
    ResponseEntity<Void> clear() {
        engine.clearTranscripts();
        return ResponseEntity.noContent().build();
    }
}

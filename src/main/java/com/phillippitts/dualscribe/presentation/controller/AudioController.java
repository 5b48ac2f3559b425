package com.phillippitts.dualscribe.presentation.controller;

import com.phillippitts.dualscribe.domain.StreamId;
import com.phillippitts.dualscribe.service.audio.AudioFormat;
import com.phillippitts.dualscribe.service.audio.SampleFormat;
import com.phillippitts.dualscribe.service.audio.capture.AudioDevice;
import com.phillippitts.dualscribe.service.audio.capture.AudioDeviceCatalog;
import com.phillippitts.dualscribe.service.audio.capture.AudioSourceRegistry;
import com.phillippitts.dualscribe.service.audio.capture.PushAudioSourceCapture;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Device enumeration and ingest of externally captured audio for push-mode sources.
 */
@RestController
@RequestMapping("/api/audio")
class AudioController {

    private final AudioDeviceCatalog catalog;
    private final AudioSourceRegistry sources;

    AudioController(AudioDeviceCatalog catalog, AudioSourceRegistry sources) {
        this.catalog = catalog;
        this.sources = sources;
    }

    @GetMapping("/devices")
    List<AudioDevice> devices() {
        return catalog.enumerate();
    }

    /**
     * Accepts raw samples for a push-mode source.
     *
     * @return 202 when queued, 409 when the source is not capturing, 404 when it is not push-fed
     */
    @PostMapping(value = "/{source}", consumes = MediaType.APPLICATION_OCTET_STREAM_VALUE)
    ResponseEntity<Map<String, Object>> push(@PathVariable String source,
                                             @RequestParam(defaultValue = "pcm_s16le") String format,
                                             @RequestParam(defaultValue = "1") int channels,
                                             @RequestParam(defaultValue = "" + AudioFormat.REQUIRED_SAMPLE_RATE) int sampleRate,
                                             @RequestBody byte[] body) {
        StreamId id = StreamId.fromWire(source);
        PushAudioSourceCapture push = sources.pushSource(id).orElse(null);
        if (push == null) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(Map.of("source", id.wireName(), "accepted", false, "reason", "not a push source"));
        }
        boolean accepted = push.accept(body, SampleFormat.fromName(format), channels, sampleRate);
        if (!accepted) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(Map.of("source", id.wireName(), "accepted", false, "reason", "source not active"));
        }
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("source", id.wireName(), "accepted", true));
    }
}

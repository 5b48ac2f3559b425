package com.phillippitts.dualscribe.presentation.exception;

import com.phillippitts.dualscribe.exception.AcquisitionException;
import com.phillippitts.dualscribe.exception.ModelNotFoundException;
import com.phillippitts.dualscribe.exception.RecordingStartException;
import com.phillippitts.dualscribe.exception.UnsupportedFormatException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void recordingStartFailureReturns503WithFailedStreams() {
        RecordingStartException ex = new RecordingStartException("Failed to open recognition session for system",
                List.of("system"), new IllegalStateException("refused"));

        ResponseEntity<?> response = handler.handleRecordingStart(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().toString())
                .contains("RecordingStartException")
                .contains("Failed streams: system");
    }

    @Test
    void recordingStartCausedByMissingModelHidesPath() {
        RecordingStartException ex = new RecordingStartException("Failed", List.of("microphone"),
                new ModelNotFoundException("/secret/models/vosk"));

        ResponseEntity<?> response = handler.handleRecordingStart(ex);

        assertThat(response.getBody().toString())
                .contains("Recognition model not loaded")
                .doesNotContain("/secret/models");
    }

    @Test
    void modelNotFoundReturns503() {
        ResponseEntity<?> response = handler.handleModelNotFound(new ModelNotFoundException("/models/vosk"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody().toString()).contains("Speech recognition unavailable");
    }

    @Test
    void acquisitionFailureReturns503WithReason() {
        AcquisitionException ex = new AcquisitionException("system", "DEVICE_NOT_FOUND", "No loopback device");

        ResponseEntity<?> response = handler.handleAcquisition(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody().toString()).contains("DEVICE_NOT_FOUND");
    }

    @Test
    void unsupportedFormatReturns400() {
        ResponseEntity<?> response = handler.handleUnsupportedFormat(
                new UnsupportedFormatException("odd byte count for 16-bit samples"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    }

    @Test
    void illegalArgumentReturns400AndIllegalStateReturns409() {
        assertThat(handler.handleIllegalArgument(new IllegalArgumentException("unknown stream")).getStatusCode())
                .isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(handler.handleIllegalState(new IllegalStateException("Recording already recording")).getStatusCode())
                .isEqualTo(HttpStatus.CONFLICT);
    }

    @Test
    void unexpectedErrorDoesNotLeakMessage() {
        ResponseEntity<?> response = handler.handleUnexpected(new RuntimeException("password=hunter2"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().toString()).doesNotContain("hunter2");
    }
}

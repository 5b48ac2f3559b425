package com.phillippitts.dualscribe.presentation.controller;

import com.phillippitts.dualscribe.domain.StreamId;
import com.phillippitts.dualscribe.service.audio.capture.AudioDevice;
import com.phillippitts.dualscribe.service.audio.capture.AudioDeviceCatalog;
import com.phillippitts.dualscribe.service.audio.capture.AudioDeviceKind;
import com.phillippitts.dualscribe.service.audio.capture.AudioSourceRegistry;
import com.phillippitts.dualscribe.service.audio.capture.PushAudioSourceCapture;
import com.phillippitts.dualscribe.service.audio.capture.SourceSpec;
import com.phillippitts.dualscribe.testutil.EventCapturingPublisher;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(AudioController.class)
class AudioControllerTest {

    @Autowired
    private MockMvc mvc;

    @MockBean
    private AudioDeviceCatalog catalog;

    @MockBean
    private AudioSourceRegistry sources;

    private PushAudioSourceCapture systemPush;

    @BeforeEach
    void setUp() {
        systemPush = new PushAudioSourceCapture(StreamId.SYSTEM_AUDIO, 10, new EventCapturingPublisher(),
                Clock.systemUTC());
        when(sources.pushSource(StreamId.SYSTEM_AUDIO)).thenReturn(Optional.of(systemPush));
        when(sources.pushSource(StreamId.MICROPHONE)).thenReturn(Optional.empty());
    }

    @AfterEach
    void tearDown() {
        systemPush.release();
    }

    @Test
    void listsDevices() throws Exception {
        when(catalog.enumerate()).thenReturn(List.of(
                new AudioDevice("Built-in Microphone", "Built-in Microphone", AudioDeviceKind.INPUT),
                new AudioDevice("BlackHole 2ch", "BlackHole 2ch", AudioDeviceKind.LOOPBACK)));

        mvc.perform(get("/api/audio/devices"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[1].kind").value("LOOPBACK"));
    }

    @Test
    void acceptsAudioForActivePushSource() throws Exception {
        systemPush.acquire(new SourceSpec(StreamId.SYSTEM_AUDIO, null));

        mvc.perform(post("/api/audio/system")
                        .contentType(MediaType.APPLICATION_OCTET_STREAM)
                        .content(new byte[640]))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.accepted").value(true));
    }

    @Test
    void inactivePushSourceIsConflict() throws Exception {
        mvc.perform(post("/api/audio/system")
                        .contentType(MediaType.APPLICATION_OCTET_STREAM)
                        .content(new byte[640]))
                .andExpect(status().isConflict());
    }

    @Test
    void nonPushSourceIsNotFound() throws Exception {
        mvc.perform(post("/api/audio/microphone")
                        .contentType(MediaType.APPLICATION_OCTET_STREAM)
                        .content(new byte[640]))
                .andExpect(status().isNotFound());
    }

    @Test
    void oddByteCountIsBadRequest() throws Exception {
        systemPush.acquire(new SourceSpec(StreamId.SYSTEM_AUDIO, null));

        mvc.perform(post("/api/audio/system")
                        .contentType(MediaType.APPLICATION_OCTET_STREAM)
                        .content(new byte[641]))
                .andExpect(status().isBadRequest());
    }

    @Test
    void unknownStreamIsBadRequest() throws Exception {
        mvc.perform(post("/api/audio/speaker")
                        .contentType(MediaType.APPLICATION_OCTET_STREAM)
                        .content(new byte[2]))
                .andExpect(status().isBadRequest());
    }
}

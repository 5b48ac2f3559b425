package com.phillippitts.dualscribe.service.audio.capture;

import com.phillippitts.dualscribe.domain.AudioFrame;

/** Receives frames from one audio source in arrival order, on the source's dispatcher thread. */
@FunctionalInterface
public interface FrameListener {
    void onFrame(AudioFrame frame);
}

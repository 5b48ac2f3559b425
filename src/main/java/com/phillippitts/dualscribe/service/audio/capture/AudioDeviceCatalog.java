package com.phillippitts.dualscribe.service.audio.capture;

import java.util.List;

/**
 * Lists devices that can be opened as audio sources.
 */
public interface AudioDeviceCatalog {

    /**
     * @return capture-capable devices; empty when none are available
     */
    List<AudioDevice> enumerate();
}

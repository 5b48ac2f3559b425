package com.phillippitts.dualscribe.service.audio.capture;

/** Input devices capture the room; loopback devices capture what the machine plays. */
public enum AudioDeviceKind {
    INPUT,
    LOOPBACK
}

package com.phillippitts.dualscribe.service.audio.capture;

/**
 * A capture-capable device as reported by the platform.
 *
 * @param id    stable identifier; the mixer name, usable as {@code device-name}
 * @param label human readable description
 * @param kind  input or loopback
 */
public record AudioDevice(String id, String label, AudioDeviceKind kind) { }

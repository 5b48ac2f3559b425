package com.phillippitts.dualscribe.domain;

import java.util.Locale;

/**
 * Closed set of logical audio streams a recording session can carry.
 *
 * <p>Each stream maps to a fixed speaker label. The microphone is assumed to carry the
 * local user, system audio carries whoever is speaking on the other end of a call.
 */
public enum StreamId {

    MICROPHONE("microphone"),
    SYSTEM_AUDIO("system");

    private final String wireName;

    StreamId(String wireName) {
        this.wireName = wireName;
    }

    /** Stable lowercase name used in URLs, persisted files and the remote recognizer protocol. */
    public String wireName() {
        return wireName;
    }

    /**
     * Returns the speaker label attached to every transcript produced from this stream.
     */
    public String speakerLabel() {
        return switch (this) {
            case MICROPHONE -> "Me";
            case SYSTEM_AUDIO -> "Other";
        };
    }

    /**
     * Resolves a stream from its wire name or enum constant name, case-insensitively.
     *
     * @throws IllegalArgumentException if the name matches no stream
     */
    public static StreamId fromWire(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("stream name must not be blank");
        }
        String n = name.trim().toLowerCase(Locale.ROOT);
        for (StreamId id : values()) {
            if (id.wireName.equals(n) || id.name().toLowerCase(Locale.ROOT).equals(n)) {
                return id;
            }
        }
        throw new IllegalArgumentException("Unknown stream: " + name);
    }

    /** Resolves a stream from its speaker label, or {@code null} if none matches. */
    public static StreamId fromSpeaker(String speaker) {
        for (StreamId id : values()) {
            if (id.speakerLabel().equalsIgnoreCase(speaker)) {
                return id;
            }
        }
        return null;
    }
}

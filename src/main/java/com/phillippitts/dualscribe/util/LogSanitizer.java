package com.phillippitts.dualscribe.util;

/** Utility for privacy-safe logging of transcript text previews. */
public final class LogSanitizer {

    /** Default preview length used when logging recognized speech. */
    public static final int DEFAULT_PREVIEW = 40;

    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null) {
            return "";
        }
        if (max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * Short preview of recognized text for log lines: newlines flattened, cut at
     * {@link #DEFAULT_PREVIEW} characters with a trailing ellipsis when cut.
     */
    public static String preview(String text) {
        if (text == null) {
            return "";
        }
        String flat = text.replace('\n', ' ').replace('\r', ' ');
        return flat.length() <= DEFAULT_PREVIEW ? flat : truncate(flat, DEFAULT_PREVIEW) + "...";
    }
}

package com.phillippitts.dualscribe.service.transcript;

/**
 * Filters for transcript search.
 *
 * @param speaker       speaker label to match exactly, or {@code null} for any
 * @param fromMs        inclusive lower timestamp bound, or {@code null}
 * @param toMs          inclusive upper timestamp bound, or {@code null}
 * @param caseSensitive whether the query must match case
 * @param limit         maximum results; the most recent matches are kept
 */
public record SearchOptions(String speaker, Long fromMs, Long toMs, boolean caseSensitive, int limit) {

    public static final int DEFAULT_LIMIT = 50;

    public SearchOptions {
        speaker = (speaker == null || speaker.isBlank()) ? null : speaker;
        if (limit <= 0) {
            limit = DEFAULT_LIMIT;
        }
    }

    public static SearchOptions defaults() {
        return new SearchOptions(null, null, null, false, DEFAULT_LIMIT);
    }
}

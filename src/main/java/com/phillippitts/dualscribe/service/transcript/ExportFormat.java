package com.phillippitts.dualscribe.service.transcript;

import java.util.Locale;

/** Supported session export formats. */
public enum ExportFormat {

    JSON("application/json", "json"),
    TEXT("text/plain", "txt"),
    CSV("text/csv", "csv"),
    SUBTITLE("application/x-subrip", "srt");

    private final String contentType;
    private final String extension;

    ExportFormat(String contentType, String extension) {
        this.contentType = contentType;
        this.extension = extension;
    }

    public String contentType() {
        return contentType;
    }

    public String extension() {
        return extension;
    }

    /**
     * Accepts enum names and common aliases ({@code txt}, {@code srt}).
     *
     * @throws IllegalArgumentException for unknown formats
     */
    public static ExportFormat fromName(String name) {
        if (name == null || name.isBlank()) {
            return JSON;
        }
        String n = name.trim().toLowerCase(Locale.ROOT);
        for (ExportFormat f : values()) {
            if (f.name().toLowerCase(Locale.ROOT).equals(n) || f.extension.equals(n)) {
                return f;
            }
        }
        throw new IllegalArgumentException("Unsupported export format: " + name);
    }
}

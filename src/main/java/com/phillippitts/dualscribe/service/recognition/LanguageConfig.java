package com.phillippitts.dualscribe.service.recognition;

/**
 * Per-session recognizer settings.
 *
 * @param language       BCP-47 language tag, e.g. {@code en-US}
 * @param interimResults whether partial hypotheses should be emitted
 */
public record LanguageConfig(String language, boolean interimResults) {

    public LanguageConfig {
        language = (language == null || language.isBlank()) ? "en-US" : language;
    }
}

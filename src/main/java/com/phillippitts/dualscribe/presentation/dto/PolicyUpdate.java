package com.phillippitts.dualscribe.presentation.dto;

import com.phillippitts.dualscribe.service.transcript.DuplicatePolicy;
import com.phillippitts.dualscribe.service.transcript.PreferredSource;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * Partial update of the duplicate policy; {@code null} fields keep their current value.
 *
 * @param filterDuplicates    enable or disable suppression
 * @param similarityThreshold new threshold, clamped to [0, 1]
 * @param timeWindowMs        new comparison window
 * @param preferredSource     new preferred source
 * @param systemAudioOnly     prefer system audio and suppress microphone duplicates (or revert)
 */
public record PolicyUpdate(Boolean filterDuplicates,
                           Double similarityThreshold,
                           @PositiveOrZero Long timeWindowMs,
                           PreferredSource preferredSource,
                           Boolean systemAudioOnly) {

    /** Applies the non-null fields to {@code current}. */
    public DuplicatePolicy applyTo(DuplicatePolicy current) {
        DuplicatePolicy p = current;
        if (systemAudioOnly != null) {
            p = p.withSystemAudioOnly(systemAudioOnly);
        }
        if (preferredSource != null) {
            p = p.withPreferredSource(preferredSource);
        }
        if (filterDuplicates != null) {
            p = p.withFilterDuplicates(filterDuplicates);
        }
        if (similarityThreshold != null) {
            p = p.withSimilarityThreshold(similarityThreshold);
        }
        if (timeWindowMs != null) {
            p = p.withTimeWindowMs(timeWindowMs);
        }
        return p;
    }
}

package com.phillippitts.dualscribe.service.transcript;

import com.phillippitts.dualscribe.domain.StreamId;

import java.util.Objects;
import java.util.Optional;

/**
 * Immutable duplicate-suppression settings. Replaced wholesale when changed at runtime.
 *
 * @param filterDuplicates      master switch; nothing is suppressed when off
 * @param suppressNonPreferred  drop non-preferred finals while the preferred source spoke within the window
 * @param preferredSource       stream that wins ties, or {@link PreferredSource#NONE}
 * @param timeWindowMs          maximum timestamp distance for two transcripts to be compared
 * @param similarityThreshold   score at or above which two transcripts are duplicates
 * @param comparisonDepth       number of most recent stored transcripts scanned
 * @param substringBonus        score assigned when one normalized text contains the other
 */
public record DuplicatePolicy(boolean filterDuplicates,
                              boolean suppressNonPreferred,
                              PreferredSource preferredSource,
                              long timeWindowMs,
                              double similarityThreshold,
                              int comparisonDepth,
                              double substringBonus) {

    public DuplicatePolicy {
        Objects.requireNonNull(preferredSource, "preferredSource");
        if (timeWindowMs < 0) {
            throw new IllegalArgumentException("timeWindowMs must be >= 0");
        }
        if (similarityThreshold < 0.0 || similarityThreshold > 1.0) {
            throw new IllegalArgumentException("similarityThreshold must be in [0,1]");
        }
        if (comparisonDepth < 1) {
            throw new IllegalArgumentException("comparisonDepth must be >= 1");
        }
        if (substringBonus < 0.0 || substringBonus > 1.0) {
            throw new IllegalArgumentException("substringBonus must be in [0,1]");
        }
    }

    /** Defaults: system audio preferred, 3 s window, threshold 0.8, last 10 entries, bonus 0.3. */
    public static DuplicatePolicy defaults() {
        return new DuplicatePolicy(true, true, PreferredSource.SYSTEM_AUDIO, 3000L, 0.8, 10, 0.3);
    }

    public Optional<StreamId> preferred() {
        return preferredSource.stream();
    }

    public DuplicatePolicy withFilterDuplicates(boolean enabled) {
        return new DuplicatePolicy(enabled, suppressNonPreferred, preferredSource, timeWindowMs,
                similarityThreshold, comparisonDepth, substringBonus);
    }

    /** Threshold is clamped into [0, 1]. */
    public DuplicatePolicy withSimilarityThreshold(double threshold) {
        double clamped = Double.isNaN(threshold) ? similarityThreshold : Math.max(0.0, Math.min(1.0, threshold));
        return new DuplicatePolicy(filterDuplicates, suppressNonPreferred, preferredSource, timeWindowMs,
                clamped, comparisonDepth, substringBonus);
    }

    public DuplicatePolicy withTimeWindowMs(long windowMs) {
        return new DuplicatePolicy(filterDuplicates, suppressNonPreferred, preferredSource, Math.max(0L, windowMs),
                similarityThreshold, comparisonDepth, substringBonus);
    }

    public DuplicatePolicy withPreferredSource(PreferredSource source) {
        return new DuplicatePolicy(filterDuplicates, suppressNonPreferred, source, timeWindowMs,
                similarityThreshold, comparisonDepth, substringBonus);
    }

    /**
     * "System audio only" mode: when enabled, system audio is preferred and microphone finals are
     * dropped while system audio is speaking; when disabled, non-preferred suppression is switched off.
     */
    public DuplicatePolicy withSystemAudioOnly(boolean enabled) {
        if (enabled) {
            return new DuplicatePolicy(filterDuplicates, true, PreferredSource.SYSTEM_AUDIO, timeWindowMs,
                    similarityThreshold, comparisonDepth, substringBonus);
        }
        return new DuplicatePolicy(filterDuplicates, false, preferredSource, timeWindowMs,
                similarityThreshold, comparisonDepth, substringBonus);
    }
}

package com.phillippitts.dualscribe.config.properties;

import com.phillippitts.dualscribe.service.transcript.DuplicatePolicy;
import com.phillippitts.dualscribe.service.transcript.PreferredSource;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;

/**
 * Typed properties for the transcript engine: buffer bound, duplicate suppression, persistence.
 */
@Validated
@ConfigurationProperties(prefix = "transcript")
public class TranscriptProperties {

    @Min(1)
    private final int maxBufferSize;

    private final boolean filterDuplicates;

    /** Drop non-preferred finals while the preferred source spoke within the window. */
    private final boolean suppressNonPreferred;

    private final PreferredSource preferredSource;

    @Min(0)
    private final long duplicateTimeWindowMs;

    @Min(0)
    @Max(1)
    private final double similarityThreshold;

    /** How many recent transcripts a new final is compared against. */
    @Min(1)
    private final int comparisonDepth;

    @Min(0)
    @Max(1)
    private final double substringBonus;

    private final boolean speakerTagging;

    /** Size of the rolling window carried by transcript-updated events. */
    @Min(1)
    private final int updatedWindow;

    /** Display duration of the last subtitle cue. */
    @Min(1)
    private final long subtitleDefaultDurationMs;

    private final boolean autoSave;

    @Min(1000)
    private final long autoSaveIntervalMs;

    private final String saveDirectory;

    @ConstructorBinding
    public TranscriptProperties(Integer maxBufferSize,
                                Boolean filterDuplicates,
                                Boolean suppressNonPreferred,
                                PreferredSource preferredSource,
                                Long duplicateTimeWindowMs,
                                Double similarityThreshold,
                                Integer comparisonDepth,
                                Double substringBonus,
                                Boolean speakerTagging,
                                Integer updatedWindow,
                                Long subtitleDefaultDurationMs,
                                Boolean autoSave,
                                Long autoSaveIntervalMs,
                                String saveDirectory) {
        this.maxBufferSize = maxBufferSize == null ? 1000 : maxBufferSize;
        if (this.maxBufferSize < 1) {
            throw new IllegalArgumentException("transcript.max-buffer-size must be >= 1");
        }
        this.filterDuplicates = filterDuplicates == null || filterDuplicates;
        this.suppressNonPreferred = suppressNonPreferred == null || suppressNonPreferred;
        this.preferredSource = preferredSource == null ? PreferredSource.SYSTEM_AUDIO : preferredSource;
        this.duplicateTimeWindowMs = duplicateTimeWindowMs == null ? 3000L : duplicateTimeWindowMs;
        double t = similarityThreshold == null ? 0.8 : similarityThreshold;
        if (t < 0.0 || t > 1.0) {
            throw new IllegalArgumentException("transcript.similarity-threshold must be in [0,1]");
        }
        this.similarityThreshold = t;
        this.comparisonDepth = comparisonDepth == null ? 10 : comparisonDepth;
        double b = substringBonus == null ? 0.3 : substringBonus;
        if (b < 0.0 || b > 1.0) {
            throw new IllegalArgumentException("transcript.substring-bonus must be in [0,1]");
        }
        this.substringBonus = b;
        this.speakerTagging = speakerTagging == null || speakerTagging;
        this.updatedWindow = updatedWindow == null ? 10 : updatedWindow;
        this.subtitleDefaultDurationMs = subtitleDefaultDurationMs == null ? 3000L : subtitleDefaultDurationMs;
        this.autoSave = autoSave == null || autoSave;
        this.autoSaveIntervalMs = autoSaveIntervalMs == null ? 30_000L : autoSaveIntervalMs;
        this.saveDirectory = (saveDirectory == null || saveDirectory.isBlank()) ? "./transcripts" : saveDirectory;
    }

    /** Defaults for tests and manual instantiation. */
    public static TranscriptProperties defaults() {
        return new TranscriptProperties(null, null, null, null, null, null, null, null, null, null,
                null, null, null, null);
    }

    public int getMaxBufferSize() { return maxBufferSize; }
    public boolean isFilterDuplicates() { return filterDuplicates; }
    public boolean isSuppressNonPreferred() { return suppressNonPreferred; }
    public PreferredSource getPreferredSource() { return preferredSource; }
    public long getDuplicateTimeWindowMs() { return duplicateTimeWindowMs; }
    public double getSimilarityThreshold() { return similarityThreshold; }
    public int getComparisonDepth() { return comparisonDepth; }
    public double getSubstringBonus() { return substringBonus; }
    public boolean isSpeakerTagging() { return speakerTagging; }
    public int getUpdatedWindow() { return updatedWindow; }
    public long getSubtitleDefaultDurationMs() { return subtitleDefaultDurationMs; }
    public boolean isAutoSave() { return autoSave; }
    public long getAutoSaveIntervalMs() { return autoSaveIntervalMs; }
    public String getSaveDirectory() { return saveDirectory; }

    public Path saveDirectoryPath() {
        return Path.of(saveDirectory);
    }

    /** Initial duplicate policy; may later be replaced at runtime. */
    public DuplicatePolicy toDuplicatePolicy() {
        return new DuplicatePolicy(filterDuplicates, suppressNonPreferred, preferredSource,
                duplicateTimeWindowMs, similarityThreshold, comparisonDepth, substringBonus);
    }
}

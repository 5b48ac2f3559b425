package com.phillippitts.dualscribe.service.transcript;

import com.phillippitts.dualscribe.domain.StreamId;
import com.phillippitts.dualscribe.domain.Transcript;
import com.phillippitts.dualscribe.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Decides whether a new final transcript duplicates one already stored from the other stream.
 *
 * <ol>
 *   <li><b>Preference suppression:</b> a candidate from the non-preferred stream is dropped if the
 *       latest stored transcript of the preferred stream, wherever it sits in the log, is at most
 *       {@code timeWindowMs} older than the candidate.</li>
 *   <li><b>Similarity scan:</b> over the most recent {@code comparisonDepth} stored transcripts, among
 *       those from a <em>different</em> stream whose timestamps lie within the window, find the best
 *       {@link TextSimilarity} match.</li>
 *   <li>If the best score reaches the threshold: a preferred match suppresses the candidate, a
 *       preferred candidate replaces every matching non-preferred entry in the scanned window, and
 *       with no preference the first-seen entry is kept.</li>
 * </ol>
 * Nothing is suppressed while {@code filterDuplicates} is off. Same-stream repeats are never
 * compared. Any internal failure fails open (ACCEPT).
 */
public class DuplicateSuppressor {

    private static final Logger LOG = LogManager.getLogger(DuplicateSuppressor.class);

    /**
     * Evaluates against a list that is also searched for the latest preferred-stream entry.
     *
     * @param candidate         new final transcript
     * @param recentNewestFirst stored transcripts, newest first
     * @param policy            settings in force
     */
    public SuppressionDecision evaluate(Transcript candidate, List<Transcript> recentNewestFirst, DuplicatePolicy policy) {
        Transcript latestPreferred = null;
        Optional<StreamId> preferred = policy.preferred();
        if (preferred.isPresent()) {
            for (Transcript stored : recentNewestFirst) {
                if (stored.streamId() == preferred.get()) {
                    latestPreferred = stored;
                    break;
                }
            }
        }
        return evaluate(candidate, recentNewestFirst, latestPreferred, policy);
    }

    /**
     * @param candidate         new final transcript
     * @param recentNewestFirst stored transcripts, newest first; only the first {@code comparisonDepth} are scanned
     * @param latestPreferred   newest stored transcript from the preferred stream, or {@code null}
     * @param policy            settings in force
     */
    public SuppressionDecision evaluate(Transcript candidate, List<Transcript> recentNewestFirst,
                                        Transcript latestPreferred, DuplicatePolicy policy) {
        if (!policy.filterDuplicates()) {
            return SuppressionDecision.accept();
        }
        try {
            Optional<StreamId> preferred = policy.preferred();
            int depth = Math.min(policy.comparisonDepth(), recentNewestFirst.size());
            List<Transcript> window = recentNewestFirst.subList(0, depth);

            if (policy.suppressNonPreferred() && preferred.isPresent() && candidate.streamId() != preferred.get()
                    && latestPreferred != null && latestPreferred.streamId() == preferred.get()) {
                long delta = candidate.timestampMs() - latestPreferred.timestampMs();
                if (delta >= 0 && delta <= policy.timeWindowMs()) {
                    return SuppressionDecision.suppress(latestPreferred.id(), 0.0,
                            SuppressionDecision.REASON_PREFERRED_ACTIVE);
                }
            }

            Transcript best = null;
            double bestScore = -1.0;
            List<String> matches = new ArrayList<>();
            for (Transcript stored : window) {
                if (stored.streamId() == candidate.streamId()) {
                    continue;
                }
                if (Math.abs(candidate.timestampMs() - stored.timestampMs()) > policy.timeWindowMs()) {
                    continue;
                }
                double score = TextSimilarity.score(candidate.text(), stored.text(), policy.substringBonus());
                if (score >= policy.similarityThreshold()) {
                    matches.add(stored.id());
                }
                if (score > bestScore) {
                    bestScore = score;
                    best = stored;
                }
            }
            if (best == null || bestScore < policy.similarityThreshold()) {
                return SuppressionDecision.accept();
            }

            LOG.debug("Duplicate detected: candidate='{}' ({}) matches '{}' ({}) score={}",
                    LogSanitizer.preview(candidate.text()), candidate.speaker(),
                    LogSanitizer.preview(best.text()), best.speaker(), bestScore);
            if (preferred.isEmpty()) {
                return SuppressionDecision.suppress(best.id(), bestScore, SuppressionDecision.REASON_DUPLICATE);
            }
            if (best.streamId() == preferred.get()) {
                return SuppressionDecision.suppress(best.id(), bestScore, SuppressionDecision.REASON_DUPLICATE);
            }
            if (candidate.streamId() == preferred.get()) {
                // best match first; with two streams every other-stream match is non-preferred
                matches.remove(best.id());
                matches.add(0, best.id());
                return SuppressionDecision.replace(best.id(), bestScore, matches);
            }
            return SuppressionDecision.suppress(best.id(), bestScore, SuppressionDecision.REASON_DUPLICATE);
        } catch (RuntimeException e) {
            LOG.warn("Duplicate check failed; accepting transcript: {}", e.toString());
            return SuppressionDecision.accept();
        }
    }
}

package com.phillippitts.dualscribe.service.transcript;

import java.util.List;

/**
 * Outcome of evaluating a candidate final transcript against the stored log.
 *
 * @param action      what to do with the candidate
 * @param matchedId   id of the stored transcript that triggered the decision, or {@code null}
 * @param similarity  similarity with the matched transcript, 0 when not applicable
 * @param reason      short tag for logs and metrics
 * @param replacedIds for {@link Action#REPLACE}, every stored id the candidate supersedes (best match first);
 *                    empty otherwise
 */
public record SuppressionDecision(Action action, String matchedId, double similarity, String reason,
                                  List<String> replacedIds) {

    public enum Action {
        /** Store the candidate. */
        ACCEPT,
        /** Discard the candidate. */
        SUPPRESS,
        /** Remove every id in {@code replacedIds} from the log and store the candidate in their place. */
        REPLACE
    }

    public static final String REASON_PREFERRED_ACTIVE = "preferred_source_active";
    public static final String REASON_DUPLICATE = "duplicate";
    public static final String REASON_PREFERRED_REPLACES = "preferred_source_replaces";

    private static final SuppressionDecision ACCEPTED =
            new SuppressionDecision(Action.ACCEPT, null, 0.0, "accepted", List.of());

    public SuppressionDecision {
        replacedIds = replacedIds == null ? List.of() : List.copyOf(replacedIds);
    }

    public static SuppressionDecision accept() {
        return ACCEPTED;
    }

    public static SuppressionDecision suppress(String matchedId, double similarity, String reason) {
        return new SuppressionDecision(Action.SUPPRESS, matchedId, similarity, reason, List.of());
    }

    /**
     * @param matchedId   best-scoring stored match
     * @param similarity  score of the best match
     * @param replacedIds all stored matches to retract, including {@code matchedId}
     */
    public static SuppressionDecision replace(String matchedId, double similarity, List<String> replacedIds) {
        return new SuppressionDecision(Action.REPLACE, matchedId, similarity, REASON_PREFERRED_REPLACES, replacedIds);
    }
}

package com.phillippitts.dualscribe.service.transcript;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Heuristic similarity between two short utterances, in [0, 1].
 *
 * <p>Both texts are lowercased, stripped of punctuation and whitespace-collapsed. Identical
 * normalized texts score 1. Otherwise the score is the larger of the Jaccard overlap of the two word
 * sets and a fixed bonus when one normalized text contains the other.
 *
 * <p>"can you hear me" vs "can you hear me now" scores 4/5 = 0.8.
 */
public final class TextSimilarity {

    private static final Pattern PUNCTUATION = Pattern.compile("[^\\p{L}\\p{N}_\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private TextSimilarity() {
        // Utility class - prevent instantiation
    }

    /**
     * @param a              first text
     * @param b              second text
     * @param substringBonus score granted for containment, in [0, 1]
     * @return similarity in [0, 1]; 0 when either text normalizes to empty
     */
    public static double score(String a, String b, double substringBonus) {
        String na = normalize(a);
        String nb = normalize(b);
        if (na.isEmpty() || nb.isEmpty()) {
            return 0.0;
        }
        if (na.equals(nb)) {
            return 1.0;
        }
        double jaccard = jaccard(tokens(na), tokens(nb));
        double containment = (na.contains(nb) || nb.contains(na)) ? substringBonus : 0.0;
        return Math.max(jaccard, containment);
    }

    /** Lowercase, punctuation removed, whitespace collapsed and trimmed. */
    static String normalize(String text) {
        if (text == null) {
            return "";
        }
        String lower = text.toLowerCase(Locale.ROOT);
        String stripped = PUNCTUATION.matcher(lower).replaceAll("");
        return WHITESPACE.matcher(stripped).replaceAll(" ").trim();
    }

    static Set<String> tokens(String normalized) {
        if (normalized.isEmpty()) {
            return Set.of();
        }
        return new LinkedHashSet<>(Arrays.asList(WHITESPACE.split(normalized)));
    }

    static double jaccard(Set<String> a, Set<String> b) {
        if (a.isEmpty() && b.isEmpty()) {
            return 0.0;
        }
        int intersection = 0;
        for (String t : a) {
            if (b.contains(t)) {
                intersection++;
            }
        }
        int union = a.size() + b.size() - intersection;
        return (double) intersection / union;
    }
}

package io.github.cyfko.celldl.core.utils;

import java.util.List;
import java.util.Locale;

/**
 * Levenshtein distance and nearest-candidate lookup used for "did you mean" suggestions.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class EditDistance {

    /** Largest distance still considered a typo. */
    public static final int DEFAULT_MAX_DISTANCE = 2;

    private EditDistance() {}

    /**
     * Minimum number of single-character insertions, deletions and substitutions turning
     * {@code a} into {@code b}.
     */
    public static int levenshtein(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(previous[j] + 1, current[j - 1] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }

    /**
     * Candidate closest to {@code input}, compared case-insensitively.
     *
     * @param input       possibly misspelled word
     * @param candidates  closed vocabulary, in preference order
     * @param maxDistance largest accepted distance
     * @return the closest candidate, the first one on ties, or {@code null} when none is within {@code maxDistance}
     */
    public static String findClosestMatch(String input, List<String> candidates, int maxDistance) {
        String lowered = input.toLowerCase(Locale.ROOT);
        String closest = null;
        int best = Integer.MAX_VALUE;
        for (String candidate : candidates) {
            int distance = levenshtein(lowered, candidate.toLowerCase(Locale.ROOT));
            if (distance < best && distance <= maxDistance) {
                best = distance;
                closest = candidate;
            }
        }
        return closest;
    }

    public static String findClosestMatch(String input, List<String> candidates) {
        return findClosestMatch(input, candidates, DEFAULT_MAX_DISTANCE);
    }
}

package org.ticketrouter.engine.geo;

import java.util.Collection;
import java.util.Locale;
import java.util.Optional;

/**
 * Typo-tolerant place name comparison based on normalized Levenshtein distance.
 */
public final class NameSimilarity {

    private NameSimilarity() {
    }

    /**
     * Lower-cases, trims and folds "ё" to "е".
     */
    public static String normalize(String name) {
        if (name == null) {
            return "";
        }
        return name.trim().toLowerCase(Locale.ROOT).replace('ё', 'е');
    }

    /**
     * Similarity in [0, 1]: {@code 1 - distance / max(length)} over normalized names.
     */
    public static double score(String a, String b) {
        String left = normalize(a);
        String right = normalize(b);
        int longest = Math.max(left.length(), right.length());
        if (longest == 0) {
            return 1.0;
        }
        return 1.0 - (double) levenshtein(left, right) / longest;
    }

    /**
     * Best-scoring candidate at or above the threshold. Ties keep the earlier candidate,
     * so callers control precedence through iteration order.
     */
    public static Optional<String> bestMatch(String name, Collection<String> candidates, double threshold) {
        if (name == null || name.trim().isEmpty()) {
            return Optional.empty();
        }
        String best = null;
        double bestScore = -1.0;
        for (String candidate : candidates) {
            double s = score(name, candidate);
            if (s >= threshold && s > bestScore) {
                best = candidate;
                bestScore = s;
            }
        }
        return Optional.ofNullable(best);
    }

    static int levenshtein(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }
}

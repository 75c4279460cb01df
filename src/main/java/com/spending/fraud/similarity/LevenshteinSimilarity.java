package com.spending.fraud.similarity;

/**
 * Levenshtein distance-based similarity.
 * Computes similarity as 1 - (edit_distance / max_length).
 */
public class LevenshteinSimilarity implements SimilarityAlgorithm {

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        if (s1.equals(s2)) {
            return 1.0;
        }
        if (s1.isEmpty() || s2.isEmpty()) {
            return 0.0;
        }

        int distance = distance(s1, s2);
        int maxLength = Math.max(s1.length(), s2.length());
        return 1.0 - ((double) distance / maxLength);
    }

    @Override
    public String getName() {
        return "Levenshtein";
    }

    /**
     * The distance is at least the length difference, so the score is at most min/max.
     */
    @Override
    public double upperBound(int length1, int length2) {
        int max = Math.max(length1, length2);
        if (max == 0) {
            return 1.0;
        }
        return (double) Math.min(length1, length2) / max;
    }

    /**
     * Wagner-Fischer with two rows sized to the shorter string.
     */
    static int distance(String s1, String s2) {
        if (s1.length() > s2.length()) {
            String swap = s1;
            s1 = s2;
            s2 = swap;
        }

        int m = s1.length();
        int[] previous = new int[m + 1];
        int[] current = new int[m + 1];
        for (int i = 0; i <= m; i++) {
            previous[i] = i;
        }

        for (int j = 1; j <= s2.length(); j++) {
            current[0] = j;
            char c2 = s2.charAt(j - 1);
            for (int i = 1; i <= m; i++) {
                int cost = s1.charAt(i - 1) == c2 ? 0 : 1;
                current[i] = Math.min(Math.min(current[i - 1] + 1, previous[i] + 1), previous[i - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[m];
    }
}

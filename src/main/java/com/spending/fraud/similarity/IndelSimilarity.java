package com.spending.fraud.similarity;

/**
 * Normalized insert/delete similarity: {@code 1 - indel / (len1 + len2)} where
 * {@code indel = len1 + len2 - 2 * lcs}. Substitutions cost two operations, so a
 * single typo in a long name still scores high.
 *
 * <p>This is the default scorer for name matching.</p>
 */
public class IndelSimilarity implements SimilarityAlgorithm {

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        if (s1.equals(s2)) {
            return 1.0;
        }
        int total = s1.length() + s2.length();
        if (s1.isEmpty() || s2.isEmpty()) {
            return 0.0;
        }
        int lcs = longestCommonSubsequence(s1, s2);
        return (2.0 * lcs) / total;
    }

    @Override
    public String getName() {
        return "Indel";
    }

    /**
     * LCS cannot exceed the shorter length, so the score is at most 2*min/(len1+len2).
     */
    @Override
    public double upperBound(int length1, int length2) {
        int total = length1 + length2;
        if (total == 0) {
            return 1.0;
        }
        return (2.0 * Math.min(length1, length2)) / total;
    }

    static int longestCommonSubsequence(String s1, String s2) {
        if (s1.length() > s2.length()) {
            String swap = s1;
            s1 = s2;
            s2 = swap;
        }
        int m = s1.length();
        int[] previous = new int[m + 1];
        int[] current = new int[m + 1];

        for (int j = 1; j <= s2.length(); j++) {
            char c2 = s2.charAt(j - 1);
            for (int i = 1; i <= m; i++) {
                if (s1.charAt(i - 1) == c2) {
                    current[i] = previous[i - 1] + 1;
                } else {
                    current[i] = Math.max(current[i - 1], previous[i]);
                }
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[m];
    }
}

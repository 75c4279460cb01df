package com.spending.fraud.similarity;

/**
 * Interface for similarity computation algorithms.
 * All implementations return a score between 0.0 (no similarity) and 1.0 (identical).
 */
public interface SimilarityAlgorithm {

    /**
     * Computes the similarity between two strings.
     *
     * @param s1 first string
     * @param s2 second string
     * @return similarity score between 0.0 and 1.0
     */
    double compute(String s1, String s2);

    /**
     * Returns the name of this algorithm.
     */
    String getName();

    /**
     * Highest score {@link #compute} can return for two strings of the given lengths.
     * Pairs whose bound is below the threshold can be discarded without scoring.
     * The default bound never rejects anything.
     */
    default double upperBound(int length1, int length2) {
        return 1.0;
    }
}

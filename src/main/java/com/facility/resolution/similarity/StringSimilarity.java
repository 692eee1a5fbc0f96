package com.facility.resolution.similarity;

/**
 * Normalized string similarity backend.
 * Implementations return a ratio between 0.0 (nothing in common) and 1.0 (identical)
 * and must be symmetric in their arguments.
 */
public interface StringSimilarity {

    /**
     * Computes the similarity ratio between two strings.
     *
     * @param a first string
     * @param b second string
     * @return similarity ratio between 0.0 and 1.0
     */
    double ratio(String a, String b);

    /**
     * Returns the name of this backend.
     */
    String getName();
}

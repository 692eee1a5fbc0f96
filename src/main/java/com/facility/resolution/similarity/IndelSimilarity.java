package com.facility.resolution.similarity;

/**
 * Longest-common-subsequence similarity: {@code 2 * LCS(a, b) / (|a| + |b|)}.
 * Equivalent to a normalized insert/delete edit distance, so a single substitution
 * costs two edits.
 */
public class IndelSimilarity implements StringSimilarity {

    @Override
    public double ratio(String a, String b) {
        if (a == null || b == null) {
            return 0.0;
        }
        int total = a.length() + b.length();
        if (total == 0) {
            return 1.0;
        }
        if (a.equals(b)) {
            return 1.0;
        }
        return (2.0 * longestCommonSubsequence(a, b)) / total;
    }

    @Override
    public String getName() {
        return "Indel";
    }

    /**
     * Length of the longest common subsequence, using two rows sized by the shorter string.
     */
    static int longestCommonSubsequence(String a, String b) {
        String shorter = a.length() <= b.length() ? a : b;
        String longer = shorter == a ? b : a;
        int n = shorter.length();
        if (n == 0) {
            return 0;
        }

        int[] previous = new int[n + 1];
        int[] current = new int[n + 1];
        for (int j = 1; j <= longer.length(); j++) {
            char c = longer.charAt(j - 1);
            for (int i = 1; i <= n; i++) {
                if (shorter.charAt(i - 1) == c) {
                    current[i] = previous[i - 1] + 1;
                } else {
                    current[i] = Math.max(current[i - 1], previous[i]);
                }
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[n];
    }
}

package com.fundrecon.reconciliation.text;

import java.util.Objects;

/**
 * Levenshtein based string similarity. Case sensitive; lower-case both inputs
 * first for a case-insensitive comparison.
 */
public final class StringSimilarity {

    private StringSimilarity() {
    }

    /**
     * @return {@code 1 - editDistance(a, b) / max(len(a), len(b))}, in [0, 1];
     *         two empty strings are identical
     */
    public static double similarity(String a, String b) {
        Objects.requireNonNull(a, "a");
        Objects.requireNonNull(b, "b");

        int longest = Math.max(a.length(), b.length());
        if (longest == 0) {
            return 1.0;
        }
        return 1.0 - (double) editDistance(a, b) / longest;
    }

    /**
     * Classic edit distance with unit cost for insertion, deletion and substitution.
     */
    public static int editDistance(String a, String b) {
        int[][] distance = new int[a.length() + 1][b.length() + 1];

        for (int i = 0; i <= a.length(); i++) {
            distance[i][0] = i;
        }
        for (int j = 0; j <= b.length(); j++) {
            distance[0][j] = j;
        }

        for (int i = 1; i <= a.length(); i++) {
            for (int j = 1; j <= b.length(); j++) {
                if (a.charAt(i - 1) == b.charAt(j - 1)) {
                    distance[i][j] = distance[i - 1][j - 1];
                } else {
                    distance[i][j] = 1 + Math.min(distance[i - 1][j - 1],
                        Math.min(distance[i][j - 1], distance[i - 1][j]));
                }
            }
        }

        return distance[a.length()][b.length()];
    }
}

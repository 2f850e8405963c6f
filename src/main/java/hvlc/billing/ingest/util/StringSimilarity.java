package hvlc.billing.ingest.util;

/**
 * Gestalt (Ratcliff/Obershelp) string similarity.
 *
 * The ratio is 2*M/T where T is the combined length of both strings and M is
 * the number of characters in matching blocks. Matching blocks are found by
 * taking the longest common substring and recursing on the pieces to its left
 * and right.
 *
 * Examples:
 *   ratio("abc", "abc") → 1.0
 *   ratio("trans_date", "transaction_date") → 0.769...
 *   ratio("abc", "xyz") → 0.0
 */
public class StringSimilarity {

    private StringSimilarity() {
        // Private constructor to prevent instantiation
    }

    /**
     * Similarity ratio in the range 0..1. Two empty strings are identical.
     *
     * @param a first string (not null)
     * @param b second string (not null)
     * @return similarity ratio
     */
    public static double ratio(String a, String b) {
        int total = a.length() + b.length();
        if (total == 0) {
            return 1.0;
        }
        int matches = matchingCharacters(a, 0, a.length(), b, 0, b.length());
        return 2.0 * matches / total;
    }

    private static int matchingCharacters(String a, int aLo, int aHi, String b, int bLo, int bHi) {
        if (aLo >= aHi || bLo >= bHi) {
            return 0;
        }

        // Longest common substring in a[aLo,aHi) x b[bLo,bHi), earliest in a on ties
        int bestA = aLo;
        int bestB = bLo;
        int bestSize = 0;
        int[] previous = new int[bHi - bLo + 1];
        int[] current = new int[bHi - bLo + 1];

        for (int i = aLo; i < aHi; i++) {
            for (int j = bLo; j < bHi; j++) {
                int k = j - bLo + 1;
                if (a.charAt(i) == b.charAt(j)) {
                    current[k] = previous[k - 1] + 1;
                    if (current[k] > bestSize) {
                        bestSize = current[k];
                        bestA = i - bestSize + 1;
                        bestB = j - bestSize + 1;
                    }
                } else {
                    current[k] = 0;
                }
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }

        if (bestSize == 0) {
            return 0;
        }

        return bestSize
                + matchingCharacters(a, aLo, bestA, b, bLo, bestB)
                + matchingCharacters(a, bestA + bestSize, aHi, b, bestB + bestSize, bHi);
    }
}

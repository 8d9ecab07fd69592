package com.phillippitts.speakwell.service.align;

/**
 * Levenshtein edit distance with unit costs for insertion, deletion and substitution.
 *
 * <p>Keeps two rolling rows, so memory is O(min(|a|, |b|)).
 */
public final class LevenshteinDistance {

    private LevenshteinDistance() {
    }

    /**
     * Computes the minimum number of single-character edits turning {@code a} into {@code b}.
     *
     * @param a first string (null treated as empty)
     * @param b second string (null treated as empty)
     * @return edit distance, 0 when equal
     */
    public static int distance(String a, String b) {
        String s = a == null ? "" : a;
        String t = b == null ? "" : b;
        if (s.equals(t)) {
            return 0;
        }
        // Shorter string indexes the columns
        if (s.length() < t.length()) {
            String tmp = s;
            s = t;
            t = tmp;
        }
        if (t.isEmpty()) {
            return s.length();
        }

        int[] prev = new int[t.length() + 1];
        int[] curr = new int[t.length() + 1];
        for (int j = 0; j <= t.length(); j++) {
            prev[j] = j;
        }

        for (int i = 1; i <= s.length(); i++) {
            curr[0] = i;
            char sc = s.charAt(i - 1);
            for (int j = 1; j <= t.length(); j++) {
                if (sc == t.charAt(j - 1)) {
                    curr[j] = prev[j - 1];
                } else {
                    curr[j] = 1 + Math.min(prev[j - 1], Math.min(curr[j - 1], prev[j]));
                }
            }
            int[] swap = prev;
            prev = curr;
            curr = swap;
        }
        return prev[t.length()];
    }
}

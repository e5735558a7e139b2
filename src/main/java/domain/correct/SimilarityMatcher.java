package domain.correct;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;

/**
 * Fuzzy suggestions for unknown identifiers.
 *
 * <p>Similarity is the Ratcliff/Obershelp "gestalt" ratio {@code 2*M/T}: M is the number of
 * characters in the matching blocks found by repeatedly taking the longest common substring
 * and recursing on both sides, T the total length of both strings.</p>
 */
public final class SimilarityMatcher {

    public static final int DEFAULT_LIMIT = 5;
    public static final double DEFAULT_CUTOFF = 0.6;

    /**
     * Candidates whose ratio with {@code word} is at least {@code cutoff}, best first
     * (ties in reverse alphabetical order), at most {@code limit}.
     */
    public List<String> closeMatches(String word, Iterable<String> candidates, int limit, double cutoff) {
        if (limit <= 0) throw new IllegalArgumentException("limit must be > 0: " + limit);
        if (cutoff < 0.0 || cutoff > 1.0) throw new IllegalArgumentException("cutoff must be in [0, 1]: " + cutoff);
        if (word == null || candidates == null) return List.of();

        List<Scored> scored = new ArrayList<>();
        for (String c : candidates) {
            if (c == null) continue;
            double r = ratio(word, c);
            if (r >= cutoff) scored.add(new Scored(c, r));
        }
        scored.sort(Comparator.comparingDouble(Scored::score).reversed()
                .thenComparing(Scored::word, Comparator.reverseOrder()));

        List<String> out = new ArrayList<>(Math.min(limit, scored.size()));
        for (int i = 0; i < scored.size() && i < limit; i++) {
            out.add(scored.get(i).word());
        }
        return out;
    }

    public List<String> closeMatches(String word, Iterable<String> candidates) {
        return closeMatches(word, candidates, DEFAULT_LIMIT, DEFAULT_CUTOFF);
    }

    public double ratio(String a, String b) {
        int total = a.length() + b.length();
        if (total == 0) return 1.0;
        return 2.0 * matchingCharacters(a, b) / total;
    }

    static int matchingCharacters(String a, String b) {
        int matched = 0;
        Deque<int[]> queue = new ArrayDeque<>();
        queue.push(new int[]{0, a.length(), 0, b.length()});

        while (!queue.isEmpty()) {
            int[] r = queue.pop();
            int[] best = longestMatch(a, r[0], r[1], b, r[2], r[3]);
            int i = best[0];
            int j = best[1];
            int k = best[2];
            if (k == 0) continue;

            matched += k;
            if (r[0] < i && r[2] < j) queue.push(new int[]{r[0], i, r[2], j});
            if (i + k < r[1] && j + k < r[3]) queue.push(new int[]{i + k, r[1], j + k, r[3]});
        }
        return matched;
    }

    /** Longest common block of a[alo:ahi] and b[blo:bhi]; earliest in a, then earliest in b. */
    static int[] longestMatch(String a, int alo, int ahi, String b, int blo, int bhi) {
        int bestI = alo;
        int bestJ = blo;
        int bestK = 0;

        int width = bhi - blo;
        int[] prev = new int[width + 1];
        int[] cur = new int[width + 1];

        for (int i = alo; i < ahi; i++) {
            for (int j = blo; j < bhi; j++) {
                int col = j - blo + 1;
                if (a.charAt(i) == b.charAt(j)) {
                    int k = prev[col - 1] + 1;
                    cur[col] = k;
                    if (k > bestK) {
                        bestI = i - k + 1;
                        bestJ = j - k + 1;
                        bestK = k;
                    }
                } else {
                    cur[col] = 0;
                }
            }
            int[] tmp = prev;
            prev = cur;
            cur = tmp;
        }
        return new int[]{bestI, bestJ, bestK};
    }

    private record Scored(String word, double score) {}
}

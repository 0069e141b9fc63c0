package com.activityplatform.common.voting;

import java.util.ArrayList;
import java.util.List;

/**
 * Computes the Smith set: the smallest non-empty set of candidates in which every member beats
 * every non-member head-to-head.
 *
 * <p>Uses the transitive closure of the "beats or draws" relation. A candidate belongs to the
 * Smith set exactly when it reaches every other candidate under that relation. With a Condorcet
 * winner the set is that single candidate; a top cycle yields all of its members.
 *
 * <p>Pure static utility. O(n³) in the number of candidates.
 */
public final class SmithSetCalculator {

    private SmithSetCalculator() {}

    /** @return Smith set members in ascending identifier order */
    public static List<String> compute(PairwiseTally tally) {
        List<String> candidates = tally.candidates();
        int n = candidates.size();
        boolean[][] reach = new boolean[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                reach[i][j] = i != j && !tally.beats(candidates.get(j), candidates.get(i));
            }
        }
        for (int k = 0; k < n; k++) {
            for (int i = 0; i < n; i++) {
                if (!reach[i][k]) continue;
                for (int j = 0; j < n; j++) {
                    if (reach[k][j]) reach[i][j] = true;
                }
            }
        }

        List<String> smith = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            boolean reachesAll = true;
            for (int j = 0; j < n && reachesAll; j++) {
                if (i != j && !reach[i][j]) reachesAll = false;
            }
            if (reachesAll) smith.add(candidates.get(i));
        }
        return List.copyOf(smith);
    }
}

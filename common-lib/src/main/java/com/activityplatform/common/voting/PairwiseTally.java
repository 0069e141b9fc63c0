package com.activityplatform.common.voting;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Immutable pairwise preference table for one voting round.
 *
 * <p>{@code preferring(a, b)} is the number of ballots ranking {@code a} strictly above
 * {@code b}. Ballots that tie the two contribute to neither direction, so for every pair
 * <pre>
 *   preferring(a, b) + preferring(b, a) + tied(a, b) == ballotCount()
 * </pre>
 *
 * <p>The majority graph is not stored: {@link #beats(String, String)} derives the edge
 * {@code a → b} on demand from the table.
 */
public final class PairwiseTally {

    private final List<String> candidates;
    private final Map<String, Integer> index;
    private final int[][] preferred;
    private final int ballotCount;

    private PairwiseTally(List<String> candidates, int[][] preferred, int ballotCount) {
        this.candidates  = List.copyOf(candidates);
        this.preferred   = preferred;
        this.ballotCount = ballotCount;
        Map<String, Integer> idx = new HashMap<>();
        for (int i = 0; i < this.candidates.size(); i++) {
            idx.put(this.candidates.get(i), i);
        }
        this.index = Collections.unmodifiableMap(idx);
    }

    /**
     * Tallies every ordered candidate pair across the ballots. A candidate missing from a
     * ballot expresses no preference on that ballot.
     */
    public static PairwiseTally of(Collection<String> candidateSet, List<Ballot> ballots) {
        List<String> sorted = new ArrayList<>(new TreeSet<>(candidateSet));
        int n = sorted.size();
        int[][] preferred = new int[n][n];

        for (Ballot ballot : ballots) {
            Map<String, Integer> rank = ballot.rankIndex();
            for (int i = 0; i < n; i++) {
                Integer rankI = rank.get(sorted.get(i));
                if (rankI == null) continue;
                for (int j = i + 1; j < n; j++) {
                    Integer rankJ = rank.get(sorted.get(j));
                    if (rankJ == null) continue;
                    if (rankI < rankJ)      preferred[i][j]++;
                    else if (rankJ < rankI) preferred[j][i]++;
                }
            }
        }
        return new PairwiseTally(sorted, preferred, ballots.size());
    }

    /** Candidates in ascending identifier order. */
    public List<String> candidates() {
        return candidates;
    }

    public int ballotCount() {
        return ballotCount;
    }

    public int preferring(String a, String b) {
        if (a.equals(b)) return 0;
        return preferred[indexOf(a)][indexOf(b)];
    }

    public int tied(String a, String b) {
        if (a.equals(b)) return ballotCount;
        return ballotCount - preferring(a, b) - preferring(b, a);
    }

    public int margin(String a, String b) {
        return preferring(a, b) - preferring(b, a);
    }

    /** Majority edge {@code a → b}: strictly more ballots prefer {@code a}. */
    public boolean beats(String a, String b) {
        return margin(a, b) > 0;
    }

    public PairwiseComparison compare(String a, String b) {
        int forA = preferring(a, b);
        int forB = preferring(b, a);
        return new PairwiseComparison(a, b, forA, forB, tied(a, b), forA - forB);
    }

    /** Nested view {@code a → (b → preferring(a, b))} for display and serialization. */
    public Map<String, Map<String, Integer>> asTable() {
        Map<String, Map<String, Integer>> table = new LinkedHashMap<>();
        for (String a : candidates) {
            Map<String, Integer> row = new LinkedHashMap<>();
            for (String b : candidates) {
                if (!a.equals(b)) row.put(b, preferring(a, b));
            }
            table.put(a, Collections.unmodifiableMap(row));
        }
        return Collections.unmodifiableMap(table);
    }

    private int indexOf(String candidate) {
        Integer i = index.get(candidate);
        if (i == null) {
            throw new IllegalArgumentException("unknown candidate '" + candidate + "'");
        }
        return i;
    }
}

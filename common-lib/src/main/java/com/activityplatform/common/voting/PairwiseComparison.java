package com.activityplatform.common.voting;

/**
 * Head-to-head result between two candidates. {@code votesForA + votesForB + tied} equals the
 * ballot count of the round; {@code margin = votesForA − votesForB}.
 */
public record PairwiseComparison(
    String candidateA,
    String candidateB,
    int    votesForA,
    int    votesForB,
    int    tied,
    int    margin
) {
    /** The candidate preferred by more ballots, or {@code null} on a pairwise draw. */
    public String winner() {
        if (votesForA > votesForB) return candidateA;
        if (votesForB > votesForA) return candidateB;
        return null;
    }
}

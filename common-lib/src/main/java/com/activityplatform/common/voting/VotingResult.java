package com.activityplatform.common.voting;

import java.util.List;
import java.util.Optional;

/**
 * Immutable outcome of one group voting round.
 *
 * <p>Fields:
 * <ul>
 *   <li>{@code winner}          – the resolved group choice; always present</li>
 *   <li>{@code condorcetWinner} – the undisputed winner, or {@code null} when none exists</li>
 *   <li>{@code cycleBroken}     – true when Copeland resolution had to pick the winner</li>
 *   <li>{@code ranking}         – every candidate, ordered by the criterion that decided the
 *                                 winner (wins without a cycle, Copeland score with one)</li>
 *   <li>{@code smithSet}        – smallest set of candidates beating everyone outside it</li>
 *   <li>{@code tally}           – the pairwise table the result was derived from</li>
 *   <li>{@code tiedGroups}      – runs of two or more candidates in {@code ranking} that share
 *                                 the deciding score and marginLost, so only the identifier
 *                                 separates them</li>
 * </ul>
 */
public record VotingResult(
    String                  winner,
    String                  condorcetWinner,
    boolean                 cycleBroken,
    List<CandidateStanding> ranking,
    List<String>            smithSet,
    PairwiseTally           tally,
    int                     ballotCount,
    List<List<String>>      tiedGroups
) {
    public Optional<String> undisputedWinner() {
        return Optional.ofNullable(condorcetWinner);
    }

    public List<String> rankedCandidateIds() {
        return ranking.stream().map(CandidateStanding::candidateId).toList();
    }
}

package com.activityplatform.common.voting;

/**
 * Aggregate head-to-head record of one candidate.
 *
 * <ul>
 *   <li>{@code wins} / {@code losses} / {@code draws} – pairwise contests won, lost, drawn</li>
 *   <li>{@code copelandScore} – {@code wins − losses}</li>
 *   <li>{@code marginLost} – sum of losing margins over every lost contest (0 when unbeaten)</li>
 * </ul>
 */
public record CandidateStanding(
    String candidateId,
    int    wins,
    int    losses,
    int    draws,
    int    copelandScore,
    int    marginLost
) {}

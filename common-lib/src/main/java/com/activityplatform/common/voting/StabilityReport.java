package com.activityplatform.common.voting;

import java.util.List;

/**
 * Sensitivity of a voting result to individual ballots.
 *
 * <ul>
 *   <li>{@code winnerStability} – fraction of leave-one-ballot-out rounds that keep
 *       {@code baseWinner} [0.0, 1.0]</li>
 *   <li>{@code condorcetEfficiency} – 1.0 when the base round had an undisputed winner, else 0.0</li>
 *   <li>{@code alternativeWinners} – other winners observed, ascending by id</li>
 * </ul>
 */
public record StabilityReport(
    String       baseWinner,
    double       winnerStability,
    double       condorcetEfficiency,
    List<String> alternativeWinners
) {}

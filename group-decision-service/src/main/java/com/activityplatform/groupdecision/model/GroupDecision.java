package com.activityplatform.groupdecision.model;

import com.activityplatform.common.voting.Ballot;
import com.activityplatform.common.voting.StabilityReport;
import com.activityplatform.common.voting.VotingResult;

import java.util.List;

/**
 * Outcome of one group round.
 *
 * <p>{@code stability} is {@code null} when stability analysis is disabled.
 * {@code quorumMet} is false when fewer ballots than {@code engine.voting.min-ballots} were cast;
 * the result is still produced.
 */
public record GroupDecision(
    String          groupId,
    VotingResult    result,
    List<Ballot>    ballots,
    StabilityReport stability,
    boolean         quorumMet
) {
    public String winner() {
        return result.winner();
    }
}

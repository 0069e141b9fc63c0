package com.activityplatform.common.voting;

import com.activityplatform.common.exception.CandidateSetMismatchException;
import com.activityplatform.common.exception.EmptyBallotSetException;
import com.activityplatform.common.exception.EmptyCandidateSetException;
import com.activityplatform.common.exception.InvalidBallotException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Pairwise-majority {@link VoteResolver} with Copeland cycle resolution.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>Check every ballot ranks the same candidate set.</li>
 *   <li>Build the {@link PairwiseTally}; tied pairs on a ballot count for neither side.</li>
 *   <li>Majority edge {@code A → B} when {@code tally(A,B) > tally(B,A)}; no edge on a draw.</li>
 *   <li>A candidate with an edge to every other candidate is the Condorcet winner:
 *       {@code cycleBroken = false}, ranking ordered by wins.</li>
 *   <li>Otherwise rank by Copeland score ({@code wins − losses}) and take the top:
 *       {@code cycleBroken = true}.</li>
 * </ol>
 *
 * <h3>Tie-breaks (both orderings)</h3>
 * <pre>
 *   primary score descending → marginLost ascending → candidate id ascending
 * </pre>
 * Candidates separated only by their identifier are reported in {@link VotingResult#tiedGroups()}.
 *
 * <p>This class is stateless and thread-safe.
 */
public class CondorcetResolver implements VoteResolver {

    static final Comparator<CandidateStanding> WINS_ORDER =
        Comparator.comparingInt(CandidateStanding::wins).reversed()
            .thenComparingInt(CandidateStanding::marginLost)
            .thenComparing(CandidateStanding::candidateId);

    static final Comparator<CandidateStanding> COPELAND_ORDER =
        Comparator.comparingInt(CandidateStanding::copelandScore).reversed()
            .thenComparingInt(CandidateStanding::marginLost)
            .thenComparing(CandidateStanding::candidateId);

    /**
     * @throws EmptyBallotSetException       if {@code ballots} is null or empty
     * @throws CandidateSetMismatchException if two ballots rank different candidate sets
     * @throws EmptyCandidateSetException    if the shared candidate set is empty
     */
    @Override
    public VotingResult resolve(List<Ballot> ballots) {
        Set<String> candidateSet = sharedCandidateSet(ballots);
        PairwiseTally tally = PairwiseTally.of(candidateSet, ballots);
        List<CandidateStanding> standings = standings(tally);

        String condorcetWinner = null;
        int opponents = tally.candidates().size() - 1;
        for (CandidateStanding standing : standings) {
            if (standing.wins() == opponents) {
                condorcetWinner = standing.candidateId();
                break;
            }
        }

        boolean cycleBroken = condorcetWinner == null;
        List<CandidateStanding> ranking = new ArrayList<>(standings);
        ranking.sort(cycleBroken ? COPELAND_ORDER : WINS_ORDER);
        String winner = ranking.get(0).candidateId();

        return new VotingResult(
            winner,
            condorcetWinner,
            cycleBroken,
            List.copyOf(ranking),
            SmithSetCalculator.compute(tally),
            tally,
            ballots.size(),
            tiedGroups(ranking, cycleBroken));
    }

    /** Consecutive standings equal on the deciding score and marginLost, two or more at a time. */
    static List<List<String>> tiedGroups(List<CandidateStanding> ranking, boolean byCopeland) {
        List<List<String>> groups = new ArrayList<>();
        List<String> current = new ArrayList<>();
        CandidateStanding previous = null;
        for (CandidateStanding standing : ranking) {
            boolean tiedWithPrevious = previous != null
                && primaryScore(standing, byCopeland) == primaryScore(previous, byCopeland)
                && standing.marginLost() == previous.marginLost();
            if (!tiedWithPrevious) {
                if (current.size() > 1) groups.add(List.copyOf(current));
                current.clear();
            }
            current.add(standing.candidateId());
            previous = standing;
        }
        if (current.size() > 1) groups.add(List.copyOf(current));
        return List.copyOf(groups);
    }

    private static int primaryScore(CandidateStanding standing, boolean byCopeland) {
        return byCopeland ? standing.copelandScore() : standing.wins();
    }

    static Set<String> sharedCandidateSet(List<Ballot> ballots) {
        if (ballots == null || ballots.isEmpty()) {
            throw new EmptyBallotSetException("resolve called with zero ballots");
        }
        Ballot first = ballots.get(0);
        if (first == null) {
            throw new InvalidBallotException("ballot 0 is null");
        }
        Set<String> reference = first.candidates();
        for (int i = 1; i < ballots.size(); i++) {
            Ballot ballot = ballots.get(i);
            if (ballot == null) {
                throw new InvalidBallotException("ballot " + i + " is null");
            }
            Set<String> candidates = ballot.candidates();
            if (!candidates.equals(reference)) {
                throw new CandidateSetMismatchException(
                    "voter=" + ballot.voterId() + " ranks " + candidates
                        + " but voter=" + first.voterId() + " ranks " + reference);
            }
        }
        if (reference.isEmpty()) {
            throw new EmptyCandidateSetException("ballots rank no candidates");
        }
        return reference;
    }

    static List<CandidateStanding> standings(PairwiseTally tally) {
        List<CandidateStanding> standings = new ArrayList<>();
        for (String candidate : tally.candidates()) {
            int wins = 0, losses = 0, draws = 0, marginLost = 0;
            for (String opponent : tally.candidates()) {
                if (candidate.equals(opponent)) continue;
                int margin = tally.margin(candidate, opponent);
                if (margin > 0) {
                    wins++;
                } else if (margin < 0) {
                    losses++;
                    marginLost += -margin;
                } else {
                    draws++;
                }
            }
            standings.add(new CandidateStanding(candidate, wins, losses, draws, wins - losses, marginLost));
        }
        return standings;
    }
}

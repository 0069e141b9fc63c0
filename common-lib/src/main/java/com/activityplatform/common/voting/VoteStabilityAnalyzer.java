package com.activityplatform.common.voting;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Measures how much a group result depends on any single ballot by re-resolving the round
 * once per ballot with that ballot removed.
 *
 * <p>A single-ballot round has no sub-round to compare against and is reported as fully stable.
 * Deterministic: the same ballots always produce the same report.
 */
public final class VoteStabilityAnalyzer {

    private final VoteResolver resolver;

    public VoteStabilityAnalyzer(VoteResolver resolver) {
        this.resolver = resolver;
    }

    public StabilityReport analyze(List<Ballot> ballots) {
        return analyze(ballots, resolver.resolve(ballots));
    }

    /**
     * @param base the already-computed result for {@code ballots}
     */
    public StabilityReport analyze(List<Ballot> ballots, VotingResult base) {
        double condorcetEfficiency = base.undisputedWinner().isPresent() ? 1.0 : 0.0;
        if (ballots.size() < 2) {
            return new StabilityReport(base.winner(), 1.0, condorcetEfficiency, List.of());
        }

        int kept = 0;
        Set<String> alternatives = new TreeSet<>();
        for (int skip = 0; skip < ballots.size(); skip++) {
            List<Ballot> subset = new ArrayList<>(ballots.size() - 1);
            for (int i = 0; i < ballots.size(); i++) {
                if (i != skip) subset.add(ballots.get(i));
            }
            String winner = resolver.resolve(subset).winner();
            if (winner.equals(base.winner())) {
                kept++;
            } else {
                alternatives.add(winner);
            }
        }
        return new StabilityReport(base.winner(), (double) kept / ballots.size(),
            condorcetEfficiency, List.copyOf(alternatives));
    }
}

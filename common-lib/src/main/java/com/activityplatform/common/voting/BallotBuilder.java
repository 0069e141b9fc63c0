package com.activityplatform.common.voting;

import com.activityplatform.common.exception.EmptyCandidateSetException;
import com.activityplatform.common.model.Activity;
import com.activityplatform.common.model.ScoredCandidate;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Converts a voter's ranked recommendations into a {@link Ballot} over the group's agreed
 * candidate universe.
 *
 * <h3>Rules</h3>
 * <ol>
 *   <li>Candidates outside the universe are dropped.</li>
 *   <li>Candidates with bit-identical composite scores share one tie group; groups are
 *       ordered by composite score, highest first.</li>
 *   <li>Universe members the voter never scored form one final tie group, so the voter's
 *       silence ranks them below everything scored but not against each other.</li>
 *   <li>If an activity appears twice in the ranking, its first occurrence counts.</li>
 * </ol>
 *
 * <p>No strict order is ever invented inside a tie. This class is stateless and thread-safe.
 */
public final class BallotBuilder {

    /**
     * @param voterId   identifier of the voter the ranking belongs to
     * @param ranked    the voter's scored candidates (normally the output of
     *                  {@code CompositeRecommender.recommend}); {@code null} means "no opinion"
     * @param universe  the group's candidate activities
     * @throws EmptyCandidateSetException if the universe is null or empty
     */
    public Ballot build(String voterId, List<ScoredCandidate> ranked, Collection<Activity> universe) {
        if (universe == null || universe.isEmpty()) {
            throw new EmptyCandidateSetException("voter=" + voterId + " ballot requested over an empty candidate set");
        }
        Set<String> universeIds = new TreeSet<>();
        for (Activity activity : universe) {
            if (activity == null) {
                throw new IllegalArgumentException("candidate universe must not contain null");
            }
            universeIds.add(activity.id());
        }

        Map<Double, Set<String>> byScore = new TreeMap<>(Comparator.reverseOrder());
        Set<String> placed = new HashSet<>();
        if (ranked != null) {
            for (ScoredCandidate candidate : ranked) {
                if (candidate == null) continue;
                String id = candidate.activityId();
                if (!universeIds.contains(id) || !placed.add(id)) continue;
                byScore.computeIfAbsent(candidate.compositeScore(), k -> new TreeSet<>()).add(id);
            }
        }

        List<Set<String>> groups = new ArrayList<>(byScore.values());
        Set<String> unranked = new TreeSet<>(universeIds);
        unranked.removeAll(placed);
        if (!unranked.isEmpty()) {
            groups.add(unranked);
        }
        return new Ballot(voterId, groups);
    }
}

package com.activityplatform.common.voting;

import com.activityplatform.common.exception.InvalidBallotException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * One voter's ordering over the candidate set of a voting round.
 *
 * <p>{@code rankGroups} is an ordered list of tie groups: every candidate in group {@code i} is
 * preferred to every candidate in group {@code j > i}, and candidates inside one group are tied.
 * A strict ranking is simply a list of singleton groups.
 *
 * <p>Groups are copied into sorted, unmodifiable sets. A candidate may appear only once and no
 * group may be empty; violations raise {@link InvalidBallotException}.
 */
public record Ballot(String voterId, List<Set<String>> rankGroups) {

    public Ballot {
        if (rankGroups == null) {
            throw new InvalidBallotException("voter=" + voterId + " ballot has no ranking");
        }
        Set<String> seen = new TreeSet<>();
        List<Set<String>> copy = new ArrayList<>(rankGroups.size());
        for (Set<String> group : rankGroups) {
            if (group == null || group.isEmpty()) {
                throw new InvalidBallotException("voter=" + voterId + " ballot contains an empty tie group");
            }
            for (String candidate : group) {
                if (candidate == null) {
                    throw new InvalidBallotException("voter=" + voterId + " ballot contains a null candidate");
                }
                if (!seen.add(candidate)) {
                    throw new InvalidBallotException(
                        "voter=" + voterId + " ballot lists candidate '" + candidate + "' more than once");
                }
            }
            copy.add(Collections.unmodifiableSet(new TreeSet<>(group)));
        }
        rankGroups = List.copyOf(copy);
    }

    /** Strict ranking, most preferred first. */
    public static Ballot ofRanking(String voterId, List<String> ranking) {
        if (ranking == null) {
            throw new InvalidBallotException("voter=" + voterId + " ballot has no ranking");
        }
        List<Set<String>> groups = new ArrayList<>(ranking.size());
        for (String candidate : ranking) {
            Set<String> group = new TreeSet<>();
            if (candidate != null) group.add(candidate);
            groups.add(group);
        }
        return new Ballot(voterId, groups);
    }

    /** Ranking with ties, most preferred group first. */
    public static Ballot of(String voterId, List<? extends Collection<String>> groups) {
        if (groups == null) {
            throw new InvalidBallotException("voter=" + voterId + " ballot has no ranking");
        }
        List<Set<String>> copy = new ArrayList<>(groups.size());
        for (Collection<String> group : groups) {
            if (group == null) {
                throw new InvalidBallotException("voter=" + voterId + " ballot contains an empty tie group");
            }
            Set<String> set = new TreeSet<>();
            for (String candidate : group) {
                if (candidate == null) {
                    throw new InvalidBallotException("voter=" + voterId + " ballot contains a null candidate");
                }
                if (!set.add(candidate)) {
                    throw new InvalidBallotException(
                        "voter=" + voterId + " ballot lists candidate '" + candidate + "' more than once");
                }
            }
            copy.add(set);
        }
        return new Ballot(voterId, copy);
    }

    /** All candidates on this ballot, sorted. */
    public Set<String> candidates() {
        Set<String> all = new TreeSet<>();
        rankGroups.forEach(all::addAll);
        return Collections.unmodifiableSet(all);
    }

    /** Candidate → zero-based group index; tied candidates share an index. */
    public Map<String, Integer> rankIndex() {
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < rankGroups.size(); i++) {
            for (String candidate : rankGroups.get(i)) {
                index.put(candidate, i);
            }
        }
        return index;
    }

    /** Group index of {@code candidate}, or -1 when it is not on this ballot. */
    public int rankOf(String candidate) {
        for (int i = 0; i < rankGroups.size(); i++) {
            if (rankGroups.get(i).contains(candidate)) return i;
        }
        return -1;
    }

    /** True only when both candidates are on the ballot and {@code a} is ranked strictly above {@code b}. */
    public boolean prefers(String a, String b) {
        int rankA = rankOf(a);
        int rankB = rankOf(b);
        return rankA >= 0 && rankB >= 0 && rankA < rankB;
    }
}

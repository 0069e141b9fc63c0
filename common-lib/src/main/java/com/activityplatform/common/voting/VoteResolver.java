package com.activityplatform.common.voting;

import java.util.List;

/**
 * Strategy contract for turning the ballots of one group into a single group choice.
 *
 * <p>Implementations must be:
 * <ul>
 *   <li><b>Stateless</b>: no mutable state; safe to call concurrently</li>
 *   <li><b>Pure</b>: no logging, no reactive types, no side effects</li>
 *   <li><b>Deterministic</b>: identical ballots always yield an identical result</li>
 * </ul>
 *
 * <p>Current implementation: {@link CondorcetResolver}. Registered as a Spring {@code @Bean} in
 * the group-decision service so the resolution method can be swapped without touching callers.
 */
public interface VoteResolver {

    /**
     * @param ballots ballots of one round, all over the same candidate set
     * @return the resolved {@link VotingResult}, never {@code null}
     */
    VotingResult resolve(List<Ballot> ballots);
}

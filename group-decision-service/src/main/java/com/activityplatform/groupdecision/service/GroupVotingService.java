package com.activityplatform.groupdecision.service;

import com.activityplatform.common.exception.EmptyCandidateSetException;
import com.activityplatform.common.exception.EngineException;
import com.activityplatform.common.model.ScoredCandidate;
import com.activityplatform.common.model.UserProfile;
import com.activityplatform.common.scoring.CompositeRecommender;
import com.activityplatform.common.trace.RequestContextUtil;
import com.activityplatform.common.voting.Ballot;
import com.activityplatform.common.voting.BallotBuilder;
import com.activityplatform.common.voting.StabilityReport;
import com.activityplatform.common.voting.VoteResolver;
import com.activityplatform.common.voting.VoteStabilityAnalyzer;
import com.activityplatform.common.voting.VotingResult;
import com.activityplatform.groupdecision.logger.VotingFlowLogger;
import com.activityplatform.groupdecision.model.GroupDecision;
import com.activityplatform.groupdecision.model.GroupVoteRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * Runs one group round end to end: every member is scored over the group's candidates in
 * parallel, each ranking becomes a ballot, and the ballots are resolved into one group choice.
 *
 * <p>Ballots are collected in member order regardless of which member finishes first, so the
 * result depends only on the request. Engine validation failures are propagated as
 * {@code Mono.error}; nothing is retried.
 */
@Service
public class GroupVotingService {

    private static final Logger log = LoggerFactory.getLogger(GroupVotingService.class);

    private final CompositeRecommender recommender;
    private final BallotBuilder ballotBuilder;
    private final VoteResolver voteResolver;
    private final VoteStabilityAnalyzer stabilityAnalyzer;
    private final VotingFlowLogger votingFlowLogger;
    private final int minBallots;
    private final boolean stabilityAnalysisEnabled;

    public GroupVotingService(
            CompositeRecommender recommender,
            BallotBuilder ballotBuilder,
            VoteResolver voteResolver,
            VoteStabilityAnalyzer stabilityAnalyzer,
            VotingFlowLogger votingFlowLogger,
            @Value("${engine.voting.min-ballots:3}") int minBallots,
            @Value("${engine.voting.stability-analysis-enabled:true}") boolean stabilityAnalysisEnabled) {
        this.recommender              = recommender;
        this.ballotBuilder            = ballotBuilder;
        this.voteResolver             = voteResolver;
        this.stabilityAnalyzer        = stabilityAnalyzer;
        this.votingFlowLogger         = votingFlowLogger;
        this.minBallots               = minBallots;
        this.stabilityAnalysisEnabled = stabilityAnalysisEnabled;
    }

    public Mono<GroupDecision> decide(GroupVoteRequest request) {
        if (request == null) {
            return Mono.error(new IllegalArgumentException("group vote request must not be null"));
        }
        String groupId = request.groupId();
        Mono<GroupDecision> pipeline = Mono.defer(() -> {
            votingFlowLogger.logWithGroupId(VotingFlowLogger.VOTE_REQUESTED, groupId);
            log.info("Scoring {} members over {} candidates for groupId={}",
                     request.members().size(), request.candidates().size(), groupId);
            if (request.candidates().isEmpty()) {
                return Mono.error(new EmptyCandidateSetException("groupId=" + groupId + " has no candidates"));
            }
            return memberBallots(request)
                .collectList()
                .doOnEach(votingFlowLogger.stage(VotingFlowLogger.BALLOTS_BUILT))
                .map(ballots -> conclude(groupId, ballots));
        });
        return RequestContextUtil.withGroupId(
            pipeline.doOnError(EngineException.class, e ->
                log.warn("Group round rejected groupId={} code={} reason={}",
                         groupId, e.getErrorCode().getCode(), e.getMessage())),
            groupId);
    }

    /**
     * Resolves ballots the members cast directly, skipping the recommendation step.
     */
    public Mono<GroupDecision> resolveBallots(String groupId, List<Ballot> ballots) {
        Mono<GroupDecision> pipeline = Mono.fromCallable(() -> {
            votingFlowLogger.logWithGroupId(VotingFlowLogger.VOTE_REQUESTED, groupId);
            return conclude(groupId, ballots == null ? List.of() : List.copyOf(ballots));
        });
        return RequestContextUtil.withGroupId(
            pipeline.doOnError(EngineException.class, e ->
                log.warn("Ballot round rejected groupId={} code={} reason={}",
                         groupId, e.getErrorCode().getCode(), e.getMessage())),
            groupId);
    }

    /**
     * One ballot per member, scored on {@code boundedElastic} and emitted in member order.
     * Each ballot is logged under the round's groupId taken from the Reactor Context.
     */
    Flux<Ballot> memberBallots(GroupVoteRequest request) {
        Flux<Ballot> ballots = Flux.fromIterable(request.members())
            .flatMapSequential(member -> Mono.fromCallable(() -> ballotFor(request, member))
                .subscribeOn(Schedulers.boundedElastic())
                .doOnEach(signal -> {
                    if (signal.isOnNext()) {
                        votingFlowLogger.logMemberScored(signal.getContextView(), member.userId(),
                                                         signal.get().rankGroups().size());
                    }
                }));
        return RequestContextUtil.withGroupId(ballots, request.groupId());
    }

    private Ballot ballotFor(GroupVoteRequest request, UserProfile member) {
        List<ScoredCandidate> ranked =
            recommender.recommend(request.observation(), request.candidates(), member);
        return ballotBuilder.build(member.userId(), ranked, request.candidates());
    }

    private GroupDecision conclude(String groupId, List<Ballot> ballots) {
        boolean quorumMet = ballots.size() >= minBallots;
        if (!quorumMet) {
            log.warn("Only {} ballot(s) for groupId={}, below the advised minimum of {}",
                     ballots.size(), groupId, minBallots);
        }

        VotingResult result = voteResolver.resolve(ballots);
        votingFlowLogger.logResult(result, groupId);

        StabilityReport stability = null;
        if (stabilityAnalysisEnabled) {
            stability = stabilityAnalyzer.analyze(ballots, result);
            votingFlowLogger.logStability(stability, groupId);
        }
        return new GroupDecision(groupId, result, List.copyOf(ballots), stability, quorumMet);
    }
}

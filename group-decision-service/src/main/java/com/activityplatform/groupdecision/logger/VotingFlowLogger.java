package com.activityplatform.groupdecision.logger;

import com.activityplatform.common.trace.RequestContextUtil;
import com.activityplatform.common.voting.StabilityReport;
import com.activityplatform.common.voting.VotingResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;
import reactor.util.context.ContextView;

import java.util.function.Consumer;

/**
 * Logs each stage of a group voting round without touching the round itself.
 *
 * <p>Stages (in order):
 * <ol>
 *   <li>{@link #VOTE_REQUESTED} - round received with members and candidates</li>
 *   <li>{@link #MEMBER_SCORED} - one member's recommendations turned into a ballot</li>
 *   <li>{@link #BALLOTS_BUILT} - every member ballot collected</li>
 *   <li>{@link #VOTE_RESOLVED} - pairwise resolution produced a winner</li>
 *   <li>{@link #STABILITY_ANALYZED} - leave-one-out analysis finished (when enabled)</li>
 * </ol>
 *
 * <p>Inside a reactive chain:
 * <pre>
 *     .doOnEach(votingFlowLogger.stage(VotingFlowLogger.BALLOTS_BUILT))
 * </pre>
 */
@Component
public class VotingFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(VotingFlowLogger.class);

    public static final String VOTE_REQUESTED     = "VOTE_REQUESTED";
    public static final String MEMBER_SCORED      = "MEMBER_SCORED";
    public static final String BALLOTS_BUILT      = "BALLOTS_BUILT";
    public static final String VOTE_RESOLVED      = "VOTE_RESOLVED";
    public static final String STABILITY_ANALYZED = "STABILITY_ANALYZED";

    /**
     * Returns a {@code doOnEach} consumer that logs {@code stageName} on {@code onNext} only,
     * reading the groupId from the Reactor Context carried by the signal.
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            RequestContextUtil.withMdc(signal.getContextView(), () ->
                log.info("[VotingFlow] stage={} groupId={}", stageName,
                         RequestContextUtil.getGroupId(signal.getContextView()))
            );
        };
    }

    public void logWithGroupId(String stageName, String groupId) {
        RequestContextUtil.withMdc(groupId, () ->
            log.info("[VotingFlow] stage={} groupId={}", stageName, groupId)
        );
    }

    /** Called from a member's {@code doOnEach}; the groupId comes from the signal's context. */
    public void logMemberScored(ContextView ctx, String userId, int rankGroups) {
        RequestContextUtil.withMdc(ctx, () ->
            log.debug("[VotingFlow] stage={} groupId={} user={} rankGroups={}",
                      MEMBER_SCORED, RequestContextUtil.getGroupId(ctx), userId, rankGroups)
        );
    }

    public void logResult(VotingResult result, String groupId) {
        RequestContextUtil.withMdc(groupId, () ->
            log.info("[VotingFlow] stage={} groupId={} winner={} condorcetWinner={} cycleBroken={} "
                     + "ballots={} smithSet={} ties={}",
                     VOTE_RESOLVED, groupId, result.winner(),
                     result.undisputedWinner().orElse("none"), result.cycleBroken(),
                     result.ballotCount(), result.smithSet(), result.tiedGroups())
        );
    }

    public void logStability(StabilityReport report, String groupId) {
        RequestContextUtil.withMdc(groupId, () ->
            log.info("[VotingFlow] stage={} groupId={} winner={} winnerStability={} alternatives={}",
                     STABILITY_ANALYZED, groupId, report.baseWinner(),
                     String.format("%.2f", report.winnerStability()), report.alternativeWinners())
        );
    }
}

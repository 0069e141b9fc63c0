package com.activityplatform.common.voting;

import com.activityplatform.common.exception.EmptyCandidateSetException;
import com.activityplatform.common.model.Activity;
import com.activityplatform.common.model.EnvironmentalTolerance;
import com.activityplatform.common.model.ScoredCandidate;
import com.activityplatform.common.model.UserProfile;
import com.activityplatform.common.scoring.CompositeRecommender;
import com.activityplatform.common.scoring.PreferenceAffinityScorer;
import com.activityplatform.common.scoring.WeatherSuitabilityScorer;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.activityplatform.common.Fixtures.CINEMA;
import static com.activityplatform.common.Fixtures.CYCLING;
import static com.activityplatform.common.Fixtures.HIKING;
import static com.activityplatform.common.Fixtures.MUSEUM;
import static com.activityplatform.common.Fixtures.mildDay;
import static org.junit.jupiter.api.Assertions.*;

class BallotBuilderTest {

    private static final List<Activity> UNIVERSE = List.of(HIKING, MUSEUM, CINEMA);

    private final BallotBuilder builder = new BallotBuilder();

    private static ScoredCandidate scored(Activity activity, double composite) {
        return new ScoredCandidate(activity, composite, composite, composite);
    }

    @Test
    void strictScoresGiveStrictBallot() {
        Ballot ballot = builder.build("v1",
            List.of(scored(MUSEUM, 0.9), scored(HIKING, 0.6), scored(CINEMA, 0.3)), UNIVERSE);

        assertEquals("v1", ballot.voterId());
        assertEquals(List.of(Set.of("museum"), Set.of("hiking"), Set.of("cinema")), ballot.rankGroups());
    }

    @Test
    void equalCompositesShareATieGroup() {
        Ballot ballot = builder.build("v1",
            List.of(scored(CINEMA, 0.7), scored(HIKING, 0.7), scored(MUSEUM, 0.5)), UNIVERSE);

        assertEquals(List.of(Set.of("cinema", "hiking"), Set.of("museum")), ballot.rankGroups());
    }

    @Test
    void blendRoundingNeverSplitsEqualComposites() {
        // 0.4 × 0.75 + 0.6 × 0.5 and 0.4 × 0.0 + 0.6 × 1.0 differ only in the last bit before blending
        Activity zoo = Activity.of("zoo", "Zoo", "family", EnvironmentalTolerance.indoor(5, 19.5));
        Activity aquarium = Activity.of("aquarium", "Aquarium", "family", EnvironmentalTolerance.indoor(0, 12));
        List<Activity> universe = List.of(zoo, aquarium, MUSEUM);
        UserProfile p = new UserProfile("v1", Map.of("zoo", 1.0, "aquarium", 2.0), null, null);

        List<ScoredCandidate> ranked = new CompositeRecommender(
            new WeatherSuitabilityScorer(), new PreferenceAffinityScorer()).recommend(mildDay(), universe, p);
        Ballot ballot = builder.build("v1", ranked, universe);

        assertEquals(List.of(Set.of("aquarium", "zoo"), Set.of("museum")), ballot.rankGroups());
        assertFalse(ballot.prefers("zoo", "aquarium"));
    }

    @Test
    void unscoredUniverseMembersFormOneFinalGroup() {
        List<Activity> universe = List.of(HIKING, MUSEUM, CINEMA, CYCLING);
        Ballot ballot = builder.build("v1", List.of(scored(MUSEUM, 0.8)), universe);

        assertEquals(List.of(Set.of("museum"), Set.of("cinema", "cycling", "hiking")), ballot.rankGroups());
    }

    @Test
    void candidatesOutsideUniverseAreDropped() {
        Ballot ballot = builder.build("v1",
            List.of(scored(CYCLING, 1.0), scored(HIKING, 0.6), scored(MUSEUM, 0.4), scored(CINEMA, 0.2)),
            UNIVERSE);

        assertEquals(Set.of("cinema", "hiking", "museum"), ballot.candidates());
        assertEquals(0, ballot.rankOf("hiking"));
    }

    @Test
    void firstOccurrenceOfRepeatedCandidateWins() {
        Ballot ballot = builder.build("v1",
            List.of(scored(HIKING, 0.9), scored(MUSEUM, 0.5), scored(HIKING, 0.1), scored(CINEMA, 0.1)),
            UNIVERSE);

        assertEquals(List.of(Set.of("hiking"), Set.of("museum"), Set.of("cinema")), ballot.rankGroups());
    }

    @Test
    void noRankingMeansEverythingTied() {
        Ballot ballot = builder.build("v1", null, UNIVERSE);
        assertEquals(List.of(Set.of("cinema", "hiking", "museum")), ballot.rankGroups());
    }

    @Test
    void emptyUniverseIsRejected() {
        assertThrows(EmptyCandidateSetException.class,
            () -> builder.build("v1", List.of(scored(HIKING, 0.5)), List.of()));
    }
}

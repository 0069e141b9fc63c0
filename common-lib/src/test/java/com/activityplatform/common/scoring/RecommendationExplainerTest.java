package com.activityplatform.common.scoring;

import com.activityplatform.common.model.ActivityHistory;
import com.activityplatform.common.model.ScoredCandidate;
import com.activityplatform.common.model.UserProfile;
import com.activityplatform.common.model.WeatherObservation;
import com.activityplatform.common.scoring.RecommendationExplainer.Explanation;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.activityplatform.common.Fixtures.HIKING;
import static com.activityplatform.common.Fixtures.MUSEUM;
import static com.activityplatform.common.Fixtures.NOW;
import static com.activityplatform.common.Fixtures.mildDay;
import static com.activityplatform.common.Fixtures.weather;
import static org.junit.jupiter.api.Assertions.*;

class RecommendationExplainerTest {

    private final WeatherSuitabilityScorer weatherScorer = new WeatherSuitabilityScorer();
    private final CompositeRecommender recommender =
        new CompositeRecommender(weatherScorer, new PreferenceAffinityScorer());

    private Explanation explain(WeatherObservation observation, UserProfile profile, String activityId) {
        List<ScoredCandidate> ranked = recommender.recommend(observation, List.of(HIKING, MUSEUM), profile);
        ScoredCandidate candidate = ranked.stream()
            .filter(c -> c.activityId().equals(activityId))
            .findFirst()
            .orElseThrow();
        return RecommendationExplainer.explain(candidate,
            weatherScorer.assess(observation, candidate.activity()), observation, profile);
    }

    @Test
    void idealOutdoorDayHasNoWarnings() {
        Explanation e = explain(mildDay(), UserProfile.newcomer("u1"), "hiking");

        assertEquals("hiking", e.activityId());
        assertEquals(List.of(
            "Temperature within comfortable range",
            "Wind well within tolerance",
            "Rain risk well within tolerance",
            "No preference history yet: neutral affinity"), e.positives());
        assertTrue(e.warnings().isEmpty());
    }

    @Test
    void indoorActivityIgnoresWindAndRain() {
        Explanation e = explain(weather(22.0, 60.0, 0.9), UserProfile.newcomer("u1"), "museum");

        assertTrue(e.positives().contains("Indoor activity: wind and rain do not matter"));
        assertTrue(e.warnings().isEmpty());
    }

    @Test
    void outOfRangeConditionsBecomeWarnings() {
        Explanation e = explain(weather(35.0, 15.0, 0.5), UserProfile.newcomer("u1"), "hiking");

        assertEquals(3, e.warnings().size());
        assertTrue(e.warnings().get(0).endsWith("outside comfortable range [10, 30]"));
        assertEquals("Wind close to tolerance", e.warnings().get(1));
        assertEquals("Rain risk exceeds tolerance", e.warnings().get(2));
    }

    @Test
    void unhealthyAirIsFlaggedOutdoorsOnly() {
        WeatherObservation smog = new WeatherObservation("Lyon", NOW, 22.0, 5.0, 0.05, 180);

        assertTrue(explain(smog, UserProfile.newcomer("u1"), "hiking").warnings()
            .contains("Air quality index 180 is unhealthy for outdoor activity"));
        assertTrue(explain(smog, UserProfile.newcomer("u1"), "museum").warnings().isEmpty());
    }

    @Test
    void preferenceFactorsAreListed() {
        UserProfile p = new UserProfile("u1",
            Map.of("hiking", 1.0),
            Map.of("hiking", ActivityHistory.of(4, NOW, "outdoor-sport")),
            Set.of("museum"));

        assertTrue(explain(mildDay(), p, "hiking").positives()
            .containsAll(List.of("Marked as favourite", "Chosen 4 time(s) before")));
        assertTrue(explain(mildDay(), p, "museum").warnings().contains("Excluded by the user"));
    }

    @Test
    void renderListsPositivesThenWarnings() {
        Explanation e = new Explanation("hiking", 0.7, List.of("Marked as favourite"), List.of("Wind exceeds tolerance"));
        String rendered = e.render("Hiking");

        assertTrue(rendered.startsWith("Hiking (score "));
        assertTrue(rendered.endsWith("\n+ Marked as favourite\n! Wind exceeds tolerance"));
    }
}

package com.activityplatform.groupdecision.service;

import com.activityplatform.common.model.Activity;
import com.activityplatform.common.model.EnvironmentalTolerance;
import com.activityplatform.common.model.ScoredCandidate;
import com.activityplatform.common.model.UserProfile;
import com.activityplatform.common.model.WeatherObservation;
import com.activityplatform.common.scoring.CompositeRecommender;
import com.activityplatform.common.scoring.PreferenceAffinityScorer;
import com.activityplatform.common.scoring.RecommendationExplainer.Explanation;
import com.activityplatform.common.scoring.ScoringWeights;
import com.activityplatform.common.scoring.WeatherSuitabilityScorer;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RecommendationServiceTest {

    private static final Activity HIKING = Activity.of("hiking", "Hiking", "outdoor-sport",
        EnvironmentalTolerance.outdoor(10, 30, 20, 0.3));
    private static final Activity CYCLING = Activity.of("cycling", "Cycling", "outdoor-sport",
        EnvironmentalTolerance.outdoor(12, 28, 25, 0.2));
    private static final Activity MUSEUM = Activity.of("museum", "Museum visit", "culture",
        EnvironmentalTolerance.indoor(15, 25));
    private static final Activity CINEMA = Activity.of("cinema", "Cinema", "entertainment",
        EnvironmentalTolerance.indoor(15, 25));

    private static final List<Activity> CATALOG = List.of(HIKING, CYCLING, MUSEUM, CINEMA);

    private static final WeatherObservation MILD_DAY =
        WeatherObservation.of("Lyon", Instant.parse("2024-06-15T10:00:00Z"), 22.0, 5.0, 0.05);

    // hiking 1.0, cycling 0.94, cinema 0.4, museum 0.4
    private static final UserProfile OUTDOORSY =
        new UserProfile("ana", Map.of("hiking", 1.0, "cycling", 0.9), null, null);

    private final WeatherSuitabilityScorer weatherScorer = new WeatherSuitabilityScorer();
    private final CompositeRecommender recommender =
        new CompositeRecommender(weatherScorer, new PreferenceAffinityScorer());

    private static List<String> ids(List<ScoredCandidate> ranked) {
        return ranked.stream().map(ScoredCandidate::activityId).toList();
    }

    @Test
    void shortListIsReturnedWhole() {
        RecommendationService service = new RecommendationService(recommender, weatherScorer, 10, true);
        assertEquals(List.of("hiking", "cycling", "cinema", "museum"),
            ids(service.recommend(MILD_DAY, CATALOG, OUTDOORSY)));
    }

    @Test
    void truncatesToMaxResults() {
        RecommendationService service = new RecommendationService(recommender, weatherScorer, 2, false);
        assertEquals(List.of("hiking", "cycling"), ids(service.recommend(MILD_DAY, CATALOG, OUTDOORSY)));
    }

    @Test
    void diversificationTakesOnePerCategoryFirst() {
        RecommendationService service = new RecommendationService(recommender, weatherScorer, 2, true);
        assertEquals(List.of("hiking", "cinema"), ids(service.recommend(MILD_DAY, CATALOG, OUTDOORSY)));

        RecommendationService wider = new RecommendationService(recommender, weatherScorer, 3, true);
        assertEquals(List.of("hiking", "cinema", "museum"), ids(wider.recommend(MILD_DAY, CATALOG, OUTDOORSY)));
    }

    @Test
    void weightsOverridePassesThrough() {
        RecommendationService service = new RecommendationService(recommender, weatherScorer, 10, false);
        List<ScoredCandidate> ranked = service.recommend(MILD_DAY, CATALOG, OUTDOORSY, new ScoringWeights(1.0, 0.0));

        assertEquals(List.of("cinema", "cycling", "hiking", "museum"), ids(ranked));
    }

    @Test
    void explainsTopCandidate() {
        RecommendationService service = new RecommendationService(recommender, weatherScorer, 10, true);
        ScoredCandidate top = service.recommend(MILD_DAY, CATALOG, OUTDOORSY).get(0);

        Explanation explanation = service.explain(MILD_DAY, top, OUTDOORSY);
        assertEquals("hiking", explanation.activityId());
        assertTrue(explanation.positives().contains("Marked as favourite"));
        assertTrue(explanation.warnings().isEmpty());
    }

    @Test
    void rejectsNonPositiveMaxResults() {
        assertThrows(IllegalArgumentException.class,
            () -> new RecommendationService(recommender, weatherScorer, 0, true));
    }
}

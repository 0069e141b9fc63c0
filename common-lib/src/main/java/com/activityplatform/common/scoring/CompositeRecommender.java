package com.activityplatform.common.scoring;

import com.activityplatform.common.exception.DuplicateActivityException;
import com.activityplatform.common.exception.EmptyCandidateSetException;
import com.activityplatform.common.model.Activity;
import com.activityplatform.common.model.ScoredCandidate;
import com.activityplatform.common.model.UserProfile;
import com.activityplatform.common.model.WeatherObservation;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Blends {@link WeatherSuitabilityScorer} and {@link PreferenceAffinityScorer} into one ranked
 * list of candidates for a single user.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>Validate the observation and profile once, before any activity is scored.</li>
 *   <li>For each distinct activity compute {@code weather} and {@code preference} scores
 *       (recency measured at the observation's timestamp).</li>
 *   <li>{@code composite = weights.blend(weather, preference)}; 0.4 / 0.6 unless the caller
 *       supplies other {@link ScoringWeights}.</li>
 *   <li>Sort by composite descending, equal composites by activity id ascending.</li>
 * </ol>
 *
 * <p>The full ranking is returned; truncation is left to the caller.
 *
 * <p>This class is stateless and thread-safe.
 */
public final class CompositeRecommender {

    public static final Comparator<ScoredCandidate> RANKING_ORDER =
        Comparator.comparingDouble(ScoredCandidate::compositeScore).reversed()
            .thenComparing(ScoredCandidate::activityId);

    private final WeatherSuitabilityScorer weatherScorer;
    private final PreferenceAffinityScorer preferenceScorer;
    private final ScoringWeights defaultWeights;

    public CompositeRecommender(WeatherSuitabilityScorer weatherScorer,
                                PreferenceAffinityScorer preferenceScorer) {
        this(weatherScorer, preferenceScorer, ScoringWeights.DEFAULT);
    }

    public CompositeRecommender(WeatherSuitabilityScorer weatherScorer,
                                PreferenceAffinityScorer preferenceScorer,
                                ScoringWeights defaultWeights) {
        this.weatherScorer    = weatherScorer;
        this.preferenceScorer = preferenceScorer;
        this.defaultWeights   = defaultWeights != null ? defaultWeights : ScoringWeights.DEFAULT;
    }

    public List<ScoredCandidate> recommend(WeatherObservation weather,
                                           Collection<Activity> activities,
                                           UserProfile profile) {
        return recommend(weather, activities, profile, null);
    }

    /**
     * @param weights per-call override; {@code null} uses the recommender's default weights
     * @return every input activity exactly once, best first
     * @throws EmptyCandidateSetException if {@code activities} is null or empty
     * @throws DuplicateActivityException if two different activities share an id
     */
    public List<ScoredCandidate> recommend(WeatherObservation weather,
                                           Collection<Activity> activities,
                                           UserProfile profile,
                                           ScoringWeights weights) {
        if (activities == null || activities.isEmpty()) {
            throw new EmptyCandidateSetException("recommend called without candidate activities");
        }
        weatherScorer.validate(weather);
        preferenceScorer.validate(profile);
        ScoringWeights effective = weights != null ? weights : defaultWeights;

        List<ScoredCandidate> ranked = new ArrayList<>();
        for (Activity activity : distinctById(activities)) {
            double weatherScore    = weatherScorer.score(weather, activity);
            double preferenceScore = preferenceScorer.score(profile, activity, weather.timestamp());
            ranked.add(new ScoredCandidate(activity, weatherScore, preferenceScore,
                effective.blend(weatherScore, preferenceScore)));
        }
        ranked.sort(RANKING_ORDER);
        return List.copyOf(ranked);
    }

    public ScoringWeights defaultWeights() {
        return defaultWeights;
    }

    static Collection<Activity> distinctById(Collection<Activity> activities) {
        Map<String, Activity> byId = new LinkedHashMap<>();
        for (Activity activity : activities) {
            if (activity == null) {
                throw new IllegalArgumentException("candidate activities must not contain null");
            }
            Activity existing = byId.putIfAbsent(activity.id(), activity);
            if (existing != null && !existing.equals(activity)) {
                throw new DuplicateActivityException("activity id '" + activity.id() + "' maps to two activities");
            }
        }
        return byId.values();
    }
}

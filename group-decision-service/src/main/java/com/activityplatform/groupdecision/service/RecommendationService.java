package com.activityplatform.groupdecision.service;

import com.activityplatform.common.model.Activity;
import com.activityplatform.common.model.ScoredCandidate;
import com.activityplatform.common.model.UserProfile;
import com.activityplatform.common.model.WeatherObservation;
import com.activityplatform.common.scoring.CompositeRecommender;
import com.activityplatform.common.scoring.RecommendationExplainer;
import com.activityplatform.common.scoring.RecommendationExplainer.Explanation;
import com.activityplatform.common.scoring.ScoringWeights;
import com.activityplatform.common.scoring.WeatherSuitabilityScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Single-user recommendations with the caller-side concerns the engine leaves out:
 * truncation to {@code engine.recommendation.max-results} and, when enabled, a round-robin
 * over categories so one category cannot fill the whole page.
 */
@Service
public class RecommendationService {

    private static final Logger log = LoggerFactory.getLogger(RecommendationService.class);

    private final CompositeRecommender recommender;
    private final WeatherSuitabilityScorer weatherScorer;
    private final int maxResults;
    private final boolean diversificationEnabled;

    public RecommendationService(
            CompositeRecommender recommender,
            WeatherSuitabilityScorer weatherScorer,
            @Value("${engine.recommendation.max-results:20}") int maxResults,
            @Value("${engine.recommendation.diversification-enabled:true}") boolean diversificationEnabled) {
        if (maxResults < 1) {
            throw new IllegalArgumentException("engine.recommendation.max-results must be >= 1: " + maxResults);
        }
        this.recommender            = recommender;
        this.weatherScorer          = weatherScorer;
        this.maxResults             = maxResults;
        this.diversificationEnabled = diversificationEnabled;
    }

    public List<ScoredCandidate> recommend(WeatherObservation observation,
                                           Collection<Activity> activities,
                                           UserProfile profile) {
        return recommend(observation, activities, profile, null);
    }

    /**
     * @param weights per-request override of the configured weights; {@code null} keeps them
     */
    public List<ScoredCandidate> recommend(WeatherObservation observation,
                                           Collection<Activity> activities,
                                           UserProfile profile,
                                           ScoringWeights weights) {
        List<ScoredCandidate> ranked = recommender.recommend(observation, activities, profile, weights);
        List<ScoredCandidate> page = page(ranked);
        log.info("Recommended {} of {} activities for user={} top={}",
                 page.size(), ranked.size(), profile.userId(), page.get(0).activityId());
        return page;
    }

    public Explanation explain(WeatherObservation observation, ScoredCandidate candidate, UserProfile profile) {
        return RecommendationExplainer.explain(candidate,
            weatherScorer.assess(observation, candidate.activity()), observation, profile);
    }

    List<ScoredCandidate> page(List<ScoredCandidate> ranked) {
        if (ranked.size() <= maxResults) {
            return ranked;
        }
        if (!diversificationEnabled) {
            return List.copyOf(ranked.subList(0, maxResults));
        }

        // Categories keep the order of their best candidate.
        Map<String, Deque<ScoredCandidate>> byCategory = new LinkedHashMap<>();
        for (ScoredCandidate candidate : ranked) {
            byCategory.computeIfAbsent(candidate.activity().category(), k -> new ArrayDeque<>()).add(candidate);
        }

        List<ScoredCandidate> selected = new ArrayList<>(maxResults);
        while (selected.size() < maxResults) {
            for (Deque<ScoredCandidate> queue : byCategory.values()) {
                if (selected.size() >= maxResults) break;
                ScoredCandidate next = queue.poll();
                if (next != null) selected.add(next);
            }
        }
        selected.sort(CompositeRecommender.RANKING_ORDER);
        return List.copyOf(selected);
    }
}

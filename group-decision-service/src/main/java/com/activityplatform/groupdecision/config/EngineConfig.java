package com.activityplatform.groupdecision.config;

import com.activityplatform.common.scoring.CompositeRecommender;
import com.activityplatform.common.scoring.PreferenceAffinityScorer;
import com.activityplatform.common.scoring.ScoringWeights;
import com.activityplatform.common.scoring.WeatherSuitabilityScorer;
import com.activityplatform.common.voting.BallotBuilder;
import com.activityplatform.common.voting.CondorcetResolver;
import com.activityplatform.common.voting.VoteResolver;
import com.activityplatform.common.voting.VoteStabilityAnalyzer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class EngineConfig {

    @Value("${engine.weights.weather:0.4}")
    private double weatherWeight;

    @Value("${engine.weights.preference:0.6}")
    private double preferenceWeight;

    /** Fails startup when the configured weights are negative or do not sum to 1.0. */
    @Bean
    public ScoringWeights scoringWeights() {
        return new ScoringWeights(weatherWeight, preferenceWeight);
    }

    @Bean
    public WeatherSuitabilityScorer weatherSuitabilityScorer() {
        return new WeatherSuitabilityScorer();
    }

    @Bean
    public PreferenceAffinityScorer preferenceAffinityScorer() {
        return new PreferenceAffinityScorer();
    }

    @Bean
    public CompositeRecommender compositeRecommender(WeatherSuitabilityScorer weatherSuitabilityScorer,
                                                     PreferenceAffinityScorer preferenceAffinityScorer,
                                                     ScoringWeights scoringWeights) {
        return new CompositeRecommender(weatherSuitabilityScorer, preferenceAffinityScorer, scoringWeights);
    }

    @Bean
    public BallotBuilder ballotBuilder() {
        return new BallotBuilder();
    }

    @Bean
    public VoteResolver voteResolver() {
        return new CondorcetResolver();
    }

    @Bean
    public VoteStabilityAnalyzer voteStabilityAnalyzer(VoteResolver voteResolver) {
        return new VoteStabilityAnalyzer(voteResolver);
    }
}

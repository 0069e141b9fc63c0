package com.activityplatform.common.scoring;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Blend applied by {@link CompositeRecommender}:
 * <pre>
 *   composite = weatherWeight × weatherScore + preferenceWeight × preferenceScore
 * </pre>
 * {@link #DEFAULT} is the 40/60 weather/preference contract. Overrides must be finite,
 * non-negative and sum to 1.0 so the composite stays in [0.0, 1.0].
 *
 * <p>The blended value is rounded to nine decimal places so mathematically equal
 * composites compare equal when ranking and when grouping ties on a ballot.
 */
public record ScoringWeights(
    @JsonProperty("weatherWeight")    double weatherWeight,
    @JsonProperty("preferenceWeight") double preferenceWeight
) {
    public static final ScoringWeights DEFAULT = new ScoringWeights(0.4, 0.6);

    static final double SUM_TOLERANCE = 1e-9;
    static final double COMPOSITE_SCALE = 1e9;

    public ScoringWeights {
        if (!Double.isFinite(weatherWeight) || !Double.isFinite(preferenceWeight)
                || weatherWeight < 0.0 || preferenceWeight < 0.0) {
            throw new IllegalArgumentException(
                "Weights must be finite and non-negative: weather=" + weatherWeight
                    + " preference=" + preferenceWeight);
        }
        if (Math.abs(weatherWeight + preferenceWeight - 1.0) > SUM_TOLERANCE) {
            throw new IllegalArgumentException(
                "Weights must sum to 1.0: weather=" + weatherWeight + " preference=" + preferenceWeight);
        }
    }

    public double blend(double weatherScore, double preferenceScore) {
        double raw = weatherWeight * weatherScore + preferenceWeight * preferenceScore;
        return Math.round(raw * COMPOSITE_SCALE) / COMPOSITE_SCALE;
    }
}

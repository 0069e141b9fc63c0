package com.activityplatform.common.scoring;

/**
 * Sub-scores behind one weather suitability score. All values lie in [0.0, 1.0].
 * For indoor activities {@code score} equals {@code temperatureFit}; the wind and
 * precipitation fits are still reported but do not contribute.
 */
public record WeatherBreakdown(
    double  temperatureFit,
    double  windFit,
    double  precipitationFit,
    boolean indoor,
    double  score
) {}

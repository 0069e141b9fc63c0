package com.activityplatform.common.scoring;

import com.activityplatform.common.model.Activity;
import com.activityplatform.common.model.ActivityHistory;
import com.activityplatform.common.model.EnvironmentalTolerance;
import com.activityplatform.common.model.ScoredCandidate;
import com.activityplatform.common.model.UserProfile;
import com.activityplatform.common.model.WeatherObservation;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a scored candidate and the signals behind it into short human-readable factors,
 * split into positives and warnings.
 *
 * <p>Explanations never change a score. Air quality in particular is reported here only:
 * an AQI above {@value #UNHEALTHY_AIR_QUALITY_INDEX} is flagged for outdoor activities.
 */
public final class RecommendationExplainer {

    static final int UNHEALTHY_AIR_QUALITY_INDEX = 100;

    private RecommendationExplainer() {}

    public record Explanation(
        String       activityId,
        double       compositeScore,
        List<String> positives,
        List<String> warnings
    ) {
        public String render(String title) {
            StringBuilder sb = new StringBuilder()
                .append(title)
                .append(String.format(" (score %.2f/1.00)", compositeScore));
            positives.forEach(p -> sb.append("\n+ ").append(p));
            warnings.forEach(w -> sb.append("\n! ").append(w));
            return sb.toString();
        }
    }

    public static Explanation explain(ScoredCandidate candidate,
                                      WeatherBreakdown breakdown,
                                      WeatherObservation weather,
                                      UserProfile profile) {
        Activity activity = candidate.activity();
        EnvironmentalTolerance tolerance = activity.tolerance();
        List<String> positives = new ArrayList<>();
        List<String> warnings  = new ArrayList<>();

        // ── weather ──────────────────────────────────────────────────────
        if (breakdown.temperatureFit() >= 1.0) {
            positives.add("Temperature within comfortable range");
        } else {
            warnings.add(String.format("Temperature %.1f°C outside comfortable range [%.0f, %.0f]",
                weather.temperature(), tolerance.minTemperature(), tolerance.maxTemperature()));
        }

        if (breakdown.indoor()) {
            positives.add("Indoor activity: wind and rain do not matter");
        } else {
            describeLimit(breakdown.windFit(), "Wind", positives, warnings);
            describeLimit(breakdown.precipitationFit(), "Rain risk", positives, warnings);
            Integer aqi = weather.airQualityIndex();
            if (aqi != null && aqi > UNHEALTHY_AIR_QUALITY_INDEX) {
                warnings.add("Air quality index " + aqi + " is unhealthy for outdoor activity");
            }
        }

        // ── preferences ──────────────────────────────────────────────────
        if (profile.exclusions().contains(activity.id())) {
            warnings.add("Excluded by the user");
        } else if (profile.isColdStart()) {
            positives.add("No preference history yet: neutral affinity");
        } else {
            if (profile.favorites().containsKey(activity.id())) {
                positives.add("Marked as favourite");
            }
            ActivityHistory history = profile.history().get(activity.id());
            if (history != null && history.selectionCount() > 0) {
                positives.add("Chosen " + history.selectionCount() + " time(s) before");
            }
        }

        return new Explanation(activity.id(), candidate.compositeScore(),
            List.copyOf(positives), List.copyOf(warnings));
    }

    private static void describeLimit(double fit, String label, List<String> positives, List<String> warnings) {
        if (fit >= 1.0) {
            positives.add(label + " well within tolerance");
        } else if (fit <= 0.0) {
            warnings.add(label + " exceeds tolerance");
        } else {
            warnings.add(label + " close to tolerance");
        }
    }
}

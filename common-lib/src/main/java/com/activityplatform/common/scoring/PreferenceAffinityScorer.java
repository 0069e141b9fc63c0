package com.activityplatform.common.scoring;

import com.activityplatform.common.exception.InvalidProfileException;
import com.activityplatform.common.model.Activity;
import com.activityplatform.common.model.ActivityHistory;
import com.activityplatform.common.model.UserProfile;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Maps one user's preference profile and one activity to an affinity score in [0.0, 1.0].
 *
 * <h3>Components</h3>
 * <pre>
 *   favoriteComponent = weight(activity) / max(weight) if favourite, else 0.0
 *   historyComponent  = max over history entries of
 *                         relation × recency × frequency
 *     relation  = 1.0 same activity, {@value #RELATED_ACTIVITY_FACTOR} same category, else 0
 *     recency   = 0.5 ^ (age / half-life)           half-life = {@value #HISTORY_HALF_LIFE_DAYS} days
 *     frequency = 1 − 0.5 ^ selectionCount
 * </pre>
 *
 * <h3>Combination</h3>
 * <pre>
 *   excluded                → 0.0 (absolute veto)
 *   no favourites, no history → {@value #NEUTRAL_AFFINITY}
 *   favourites only         → favoriteComponent
 *   history only            → historyComponent
 *   both                    → {@value #FAVORITE_SHARE} × favorite + {@value #HISTORY_SHARE} × history
 * </pre>
 *
 * <p>Recency is measured against a reference instant. {@link CompositeRecommender} passes the
 * observation time; the two-argument {@link #score(UserProfile, Activity)} uses the profile's most
 * recent selection so the result stays a pure function of its inputs.
 *
 * <p>This class is stateless, pure, and thread-safe.
 */
public final class PreferenceAffinityScorer {

    static final double NEUTRAL_AFFINITY        = 0.5;
    static final double RELATED_ACTIVITY_FACTOR = 0.5;
    static final long   HISTORY_HALF_LIFE_DAYS  = 30;
    static final double FAVORITE_SHARE          = 0.6;
    static final double HISTORY_SHARE           = 0.4;

    private static final double HALF_LIFE_SECONDS = Duration.ofDays(HISTORY_HALF_LIFE_DAYS).getSeconds();

    public double score(UserProfile profile, Activity activity) {
        return score(profile, activity, null);
    }

    /**
     * @param referenceTime instant recency is measured against; {@code null} falls back to the
     *                      profile's most recent selection
     * @throws InvalidProfileException if the profile carries malformed weights or history
     */
    public double score(UserProfile profile, Activity activity, Instant referenceTime) {
        validate(profile);
        if (activity == null) {
            throw new IllegalArgumentException("activity must not be null");
        }

        if (profile.exclusions().contains(activity.id())) {
            return 0.0;
        }
        if (profile.isColdStart()) {
            return NEUTRAL_AFFINITY;
        }

        Instant reference = referenceTime != null ? referenceTime : latestSelection(profile);
        boolean hasFavorites = !profile.favorites().isEmpty();
        boolean hasHistory   = !profile.history().isEmpty();

        if (hasFavorites && hasHistory) {
            return FAVORITE_SHARE * favoriteComponent(profile, activity)
                 + HISTORY_SHARE  * historyComponent(profile, activity, reference);
        }
        return hasFavorites
            ? favoriteComponent(profile, activity)
            : historyComponent(profile, activity, reference);
    }

    /**
     * @throws InvalidProfileException naming the first malformed entry
     */
    public void validate(UserProfile profile) {
        if (profile == null) {
            throw new InvalidProfileException("profile must not be null");
        }
        if (profile.userId() == null || profile.userId().isBlank()) {
            throw new InvalidProfileException("userId must not be blank");
        }
        for (Map.Entry<String, Double> favorite : profile.favorites().entrySet()) {
            Double weight = favorite.getValue();
            if (favorite.getKey() == null || weight == null || !Double.isFinite(weight) || weight < 0.0) {
                throw new InvalidProfileException(
                    "user=" + profile.userId() + " favourite " + favorite.getKey() + " has invalid weight " + weight);
            }
        }
        for (Map.Entry<String, ActivityHistory> entry : profile.history().entrySet()) {
            ActivityHistory history = entry.getValue();
            if (entry.getKey() == null || history == null || history.selectionCount() < 0) {
                throw new InvalidProfileException(
                    "user=" + profile.userId() + " history entry " + entry.getKey() + " is malformed");
            }
        }
        if (profile.exclusions().contains(null)) {
            throw new InvalidProfileException("user=" + profile.userId() + " exclusions contain null");
        }
    }

    static double favoriteComponent(UserProfile profile, Activity activity) {
        Double weight = profile.favorites().get(activity.id());
        if (weight == null) return 0.0;

        double maxWeight = profile.favorites().values().stream()
            .mapToDouble(Double::doubleValue)
            .max()
            .orElse(0.0);
        return maxWeight > 0.0 ? weight / maxWeight : 0.0;
    }

    static double historyComponent(UserProfile profile, Activity activity, Instant reference) {
        double best = 0.0;
        for (Map.Entry<String, ActivityHistory> entry : profile.history().entrySet()) {
            double relation = relation(entry.getKey(), entry.getValue(), activity);
            if (relation == 0.0) continue;

            ActivityHistory history = entry.getValue();
            double signal = relation
                * recency(history.lastSelectedAt(), reference)
                * frequency(history);
            best = Math.max(best, signal);
        }
        return best;
    }

    private static double relation(String historyActivityId, ActivityHistory history, Activity activity) {
        if (historyActivityId.equals(activity.id())) {
            return 1.0;
        }
        String category = history.category();
        if (category != null && !category.isBlank() && category.equals(activity.category())) {
            return RELATED_ACTIVITY_FACTOR;
        }
        return 0.0;
    }

    /** Selections without a timestamp, or without a reference instant, are treated as current. */
    static double recency(Instant lastSelectedAt, Instant reference) {
        if (lastSelectedAt == null || reference == null) return 1.0;
        long ageSeconds = Math.max(0L, Duration.between(lastSelectedAt, reference).getSeconds());
        return Math.pow(0.5, ageSeconds / HALF_LIFE_SECONDS);
    }

    /** A timestamp without a count still records one selection. */
    static double frequency(ActivityHistory history) {
        int count = history.selectionCount();
        if (count == 0 && history.lastSelectedAt() != null) count = 1;
        return 1.0 - Math.pow(0.5, count);
    }

    private static Instant latestSelection(UserProfile profile) {
        return profile.history().values().stream()
            .map(ActivityHistory::lastSelectedAt)
            .filter(t -> t != null)
            .max(Instant::compareTo)
            .orElse(null);
    }
}

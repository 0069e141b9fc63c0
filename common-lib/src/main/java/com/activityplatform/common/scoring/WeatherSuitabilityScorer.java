package com.activityplatform.common.scoring;

import com.activityplatform.common.exception.InvalidObservationException;
import com.activityplatform.common.model.Activity;
import com.activityplatform.common.model.EnvironmentalTolerance;
import com.activityplatform.common.model.WeatherObservation;

/**
 * Maps one weather observation and one activity's tolerance profile to a suitability
 * score in [0.0, 1.0].
 *
 * <h3>Sub-scores</h3>
 * <pre>
 *   temperatureFit   = 1.0 inside [min, max], falling linearly to 0.0 at
 *                      {@value #TEMPERATURE_MARGIN}°C outside the range
 *   windFit          = 1.0 up to half of maxWindSpeed, falling linearly to 0.0 at maxWindSpeed
 *   precipitationFit = 1.0 up to half of the precipitation limit, falling linearly to 0.0 at
 *                      min(1.0, maxPrecipitationProbability)
 * </pre>
 *
 * <h3>Final score</h3>
 * <pre>
 *   outdoor → mean(temperatureFit, windFit, precipitationFit)
 *   indoor  → temperatureFit   (comfort of getting there, not of the activity itself)
 * </pre>
 *
 * <p>Observations are validated before scoring; an out-of-range value raises
 * {@link InvalidObservationException} instead of being clamped.
 *
 * <p>This class is stateless, pure, and thread-safe.
 */
public final class WeatherSuitabilityScorer {

    static final double MIN_TEMPERATURE = -60.0;
    static final double MAX_TEMPERATURE =  60.0;
    static final double MAX_WIND_SPEED  = 400.0;
    static final int    MAX_AIR_QUALITY_INDEX = 500;

    /** Distance in °C outside the comfortable range at which the temperature fit reaches 0. */
    static final double TEMPERATURE_MARGIN = 10.0;

    /** Fraction of a limit below which wind or precipitation costs nothing. */
    static final double COMFORT_FRACTION = 0.5;

    public double score(WeatherObservation weather, Activity activity) {
        return assess(weather, activity).score();
    }

    /**
     * Computes the full sub-score breakdown.
     *
     * @throws InvalidObservationException if the observation is missing or out of range
     */
    public WeatherBreakdown assess(WeatherObservation weather, Activity activity) {
        validate(weather);
        if (activity == null) {
            throw new IllegalArgumentException("activity must not be null");
        }
        EnvironmentalTolerance tolerance = activity.tolerance();

        double temperatureFit   = temperatureFit(weather.temperature(), tolerance);
        double windFit          = linearPenalty(weather.windSpeed(), tolerance.maxWindSpeed());
        double precipitationFit = linearPenalty(weather.precipitationProbability(),
                                                Math.min(1.0, tolerance.maxPrecipitationProbability()));

        double score = tolerance.indoor()
            ? temperatureFit
            : (temperatureFit + windFit + precipitationFit) / 3.0;

        return new WeatherBreakdown(temperatureFit, windFit, precipitationFit, tolerance.indoor(), score);
    }

    /**
     * Rejects non-finite or physically implausible observations.
     *
     * @throws InvalidObservationException naming the offending field
     */
    public void validate(WeatherObservation weather) {
        if (weather == null) {
            throw new InvalidObservationException("observation must not be null");
        }
        double t = weather.temperature();
        if (!Double.isFinite(t) || t < MIN_TEMPERATURE || t > MAX_TEMPERATURE) {
            throw new InvalidObservationException(String.format(
                "temperature %s outside [%.0f, %.0f]°C", t, MIN_TEMPERATURE, MAX_TEMPERATURE));
        }
        double wind = weather.windSpeed();
        if (!Double.isFinite(wind) || wind < 0.0 || wind > MAX_WIND_SPEED) {
            throw new InvalidObservationException(String.format(
                "windSpeed %s outside [0, %.0f] km/h", wind, MAX_WIND_SPEED));
        }
        double precipitation = weather.precipitationProbability();
        if (!Double.isFinite(precipitation) || precipitation < 0.0 || precipitation > 1.0) {
            throw new InvalidObservationException(
                "precipitationProbability " + precipitation + " outside [0, 1]");
        }
        Integer aqi = weather.airQualityIndex();
        if (aqi != null && (aqi < 0 || aqi > MAX_AIR_QUALITY_INDEX)) {
            throw new InvalidObservationException(
                "airQualityIndex " + aqi + " outside [0, " + MAX_AIR_QUALITY_INDEX + "]");
        }
    }

    static double temperatureFit(double temperature, EnvironmentalTolerance tolerance) {
        double distance;
        if (temperature < tolerance.minTemperature()) {
            distance = tolerance.minTemperature() - temperature;
        } else if (temperature > tolerance.maxTemperature()) {
            distance = temperature - tolerance.maxTemperature();
        } else {
            return 1.0;
        }
        return Math.max(0.0, 1.0 - distance / TEMPERATURE_MARGIN);
    }

    /**
     * 1.0 up to {@code limit × COMFORT_FRACTION}, then linear down to 0.0 at {@code limit}.
     * A limit of 0 tolerates nothing above 0.
     */
    static double linearPenalty(double value, double limit) {
        double threshold = limit * COMFORT_FRACTION;
        if (value <= threshold) return 1.0;
        if (value >= limit)     return 0.0;
        return 1.0 - (value - threshold) / (limit - threshold);
    }
}

package com.activityplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Weather conditions an activity tolerates.
 *
 * <ul>
 *   <li>{@code minTemperature} / {@code maxTemperature} – comfortable range in °C (inclusive)</li>
 *   <li>{@code maxWindSpeed} – wind speed in km/h at which the activity becomes unsuitable</li>
 *   <li>{@code maxPrecipitationProbability} – highest tolerated precipitation probability [0.0, 1.0]</li>
 *   <li>{@code indoor} – indoor activities are only judged on temperature (comfort of travel)</li>
 * </ul>
 *
 * Validated at catalog load time; an inconsistent profile never reaches a scoring request.
 */
public record EnvironmentalTolerance(
    @JsonProperty("minTemperature")              double  minTemperature,
    @JsonProperty("maxTemperature")              double  maxTemperature,
    @JsonProperty("maxWindSpeed")                double  maxWindSpeed,
    @JsonProperty("maxPrecipitationProbability") double  maxPrecipitationProbability,
    @JsonProperty("indoor")                      boolean indoor
) {
    public EnvironmentalTolerance {
        if (!Double.isFinite(minTemperature) || !Double.isFinite(maxTemperature)
                || minTemperature > maxTemperature) {
            throw new IllegalArgumentException(
                "Temperature range must be finite with min <= max: [" + minTemperature + ", " + maxTemperature + "]");
        }
        if (!Double.isFinite(maxWindSpeed) || maxWindSpeed < 0.0) {
            throw new IllegalArgumentException("maxWindSpeed must be finite and >= 0: " + maxWindSpeed);
        }
        if (!Double.isFinite(maxPrecipitationProbability)
                || maxPrecipitationProbability < 0.0 || maxPrecipitationProbability > 1.0) {
            throw new IllegalArgumentException(
                "maxPrecipitationProbability must lie in [0, 1]: " + maxPrecipitationProbability);
        }
    }

    public static EnvironmentalTolerance outdoor(double minTemperature, double maxTemperature,
                                                 double maxWindSpeed, double maxPrecipitationProbability) {
        return new EnvironmentalTolerance(minTemperature, maxTemperature,
            maxWindSpeed, maxPrecipitationProbability, false);
    }

    /** Wind and precipitation limits are irrelevant indoors; they are stored wide open. */
    public static EnvironmentalTolerance indoor(double minTemperature, double maxTemperature) {
        return new EnvironmentalTolerance(minTemperature, maxTemperature, Double.MAX_VALUE, 1.0, true);
    }
}

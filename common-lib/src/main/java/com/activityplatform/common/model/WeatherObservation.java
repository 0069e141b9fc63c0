package com.activityplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One already-merged weather snapshot supplied by the weather-provider collaborator.
 *
 * <ul>
 *   <li>{@code temperature} – °C</li>
 *   <li>{@code windSpeed} – km/h</li>
 *   <li>{@code precipitationProbability} – [0.0, 1.0]</li>
 *   <li>{@code airQualityIndex} – optional AQI (0–500), {@code null} when the provider had none</li>
 * </ul>
 *
 * No validation here: range checks belong to
 * {@link com.activityplatform.common.scoring.WeatherSuitabilityScorer} so that bad input is
 * reported as an {@code InvalidObservationException} at the scoring boundary.
 */
public record WeatherObservation(
    @JsonProperty("location")                 String  location,
    @JsonProperty("timestamp")                Instant timestamp,
    @JsonProperty("temperature")              double  temperature,
    @JsonProperty("windSpeed")                double  windSpeed,
    @JsonProperty("precipitationProbability") double  precipitationProbability,
    @JsonProperty("airQualityIndex")          Integer airQualityIndex
) {
    public static WeatherObservation of(String location, Instant timestamp, double temperature,
                                        double windSpeed, double precipitationProbability) {
        return new WeatherObservation(location, timestamp, temperature, windSpeed,
            precipitationProbability, null);
    }
}

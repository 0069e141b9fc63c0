package com.activityplatform.common;

import com.activityplatform.common.model.Activity;
import com.activityplatform.common.model.EnvironmentalTolerance;
import com.activityplatform.common.model.WeatherObservation;

import java.time.Instant;

/**
 * Shared catalog and weather used across engine tests.
 */
public final class Fixtures {

    public static final Instant NOW = Instant.parse("2024-06-15T10:00:00Z");

    public static final Activity HIKING = Activity.of("hiking", "Hiking", "outdoor-sport",
        EnvironmentalTolerance.outdoor(10, 30, 20, 0.3));

    public static final Activity MUSEUM = Activity.of("museum", "Museum visit", "culture",
        EnvironmentalTolerance.indoor(15, 25));

    public static final Activity CINEMA = Activity.of("cinema", "Cinema", "entertainment",
        EnvironmentalTolerance.indoor(15, 25));

    public static final Activity CYCLING = Activity.of("cycling", "Cycling", "outdoor-sport",
        EnvironmentalTolerance.outdoor(12, 28, 25, 0.2));

    private Fixtures() {}

    /** 22°C, 5 km/h wind, 5% precipitation. */
    public static WeatherObservation mildDay() {
        return WeatherObservation.of("Lyon", NOW, 22.0, 5.0, 0.05);
    }

    public static WeatherObservation weather(double temperature, double wind, double precipitation) {
        return WeatherObservation.of("Lyon", NOW, temperature, wind, precipitation);
    }
}

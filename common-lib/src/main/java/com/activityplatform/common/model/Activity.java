package com.activityplatform.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Immutable catalog entry. Created when the catalog is loaded and never mutated at request time.
 *
 * <p>{@code category} groups related activities (e.g. "outdoor-sport", "culture"); history on one
 * member of a category counts, at a discount, towards the others.
 */
public record Activity(
    @JsonProperty("id")        String id,
    @JsonProperty("name")      String name,
    @JsonProperty("category")  String category,
    @JsonProperty("tolerance") EnvironmentalTolerance tolerance
) {
    public Activity {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(tolerance, "tolerance");
        if (id.isBlank()) {
            throw new IllegalArgumentException("Activity id must not be blank");
        }
        if (name == null) name = id;
        if (category == null) category = "";
    }

    public static Activity of(String id, String name, String category, EnvironmentalTolerance tolerance) {
        return new Activity(id, name, category, tolerance);
    }

    @JsonIgnore
    public boolean isIndoor() {
        return tolerance.indoor();
    }
}

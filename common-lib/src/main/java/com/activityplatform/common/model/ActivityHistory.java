package com.activityplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * A user's past selections of one activity.
 *
 * <p>{@code lastSelectedAt} may be {@code null} when the profile store only tracks counts.
 * {@code category} is the category the activity had when it was chosen; it lets history on one
 * activity raise the affinity of related activities without a catalog lookup.
 */
public record ActivityHistory(
    @JsonProperty("selectionCount") int     selectionCount,
    @JsonProperty("lastSelectedAt") Instant lastSelectedAt,
    @JsonProperty("category")       String  category
) {
    public static ActivityHistory of(int selectionCount, Instant lastSelectedAt, String category) {
        return new ActivityHistory(selectionCount, lastSelectedAt, category);
    }
}

package com.activityplatform.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Read-only view of a user's preference signals, owned by the user-profile store.
 *
 * <ul>
 *   <li>{@code favorites} – activity id → user-supplied weight (&gt; 0 favours more strongly)</li>
 *   <li>{@code history} – activity id → past selections</li>
 *   <li>{@code exclusions} – activity ids the user vetoes outright</li>
 * </ul>
 *
 * Collections are copied and wrapped on construction; {@code null} collections become empty.
 * Value checks are left to {@link com.activityplatform.common.scoring.PreferenceAffinityScorer}.
 */
public record UserProfile(
    @JsonProperty("userId")     String userId,
    @JsonProperty("favorites")  Map<String, Double> favorites,
    @JsonProperty("history")    Map<String, ActivityHistory> history,
    @JsonProperty("exclusions") Set<String> exclusions
) {
    public UserProfile {
        favorites  = favorites  == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(favorites));
        history    = history    == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(history));
        exclusions = exclusions == null ? Collections.emptySet() : Collections.unmodifiableSet(new LinkedHashSet<>(exclusions));
    }

    /** Profile of a user with no signals at all; scores a neutral affinity everywhere. */
    public static UserProfile newcomer(String userId) {
        return new UserProfile(userId, Map.of(), Map.of(), Set.of());
    }

    @JsonIgnore
    public boolean isColdStart() {
        return favorites.isEmpty() && history.isEmpty();
    }
}

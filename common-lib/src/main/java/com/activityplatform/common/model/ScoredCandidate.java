package com.activityplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One activity scored for one user. Every score lies in [0.0, 1.0]; the composite is the
 * weighted blend of the other two under the weights the recommendation ran with.
 * Created per request and never persisted by the engine.
 */
public record ScoredCandidate(
    @JsonProperty("activity")        Activity activity,
    @JsonProperty("weatherScore")    double   weatherScore,
    @JsonProperty("preferenceScore") double   preferenceScore,
    @JsonProperty("compositeScore")  double   compositeScore
) {
    public String activityId() {
        return activity.id();
    }
}

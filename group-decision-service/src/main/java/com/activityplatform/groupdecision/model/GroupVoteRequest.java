package com.activityplatform.groupdecision.model;

import com.activityplatform.common.model.Activity;
import com.activityplatform.common.model.UserProfile;
import com.activityplatform.common.model.WeatherObservation;

import java.util.List;

/**
 * One group voting round as handed over by the transport layer: the shared weather, the
 * candidate activities the group agreed to choose from, and each member's profile.
 */
public record GroupVoteRequest(
    String             groupId,
    WeatherObservation observation,
    List<Activity>     candidates,
    List<UserProfile>  members
) {
    public GroupVoteRequest {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
        members    = members    == null ? List.of() : List.copyOf(members);
    }
}

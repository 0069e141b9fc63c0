package com.activityplatform.common.exception;

/**
 * Error codes raised by the engine. Every code is a client-side validation failure
 * scoped to a single request; none of them is worth retrying.
 */
public enum ErrorCode {
    INVALID_OBSERVATION("INVALID_OBSERVATION", "Weather observation is malformed or out of range"),
    INVALID_PROFILE("INVALID_PROFILE", "User profile contains malformed preference data"),
    EMPTY_CANDIDATE_SET("EMPTY_CANDIDATE_SET", "No candidate activities were supplied"),
    DUPLICATE_ACTIVITY("DUPLICATE_ACTIVITY", "Two different activities share one identifier"),
    INVALID_BALLOT("INVALID_BALLOT", "Ballot ordering is malformed"),
    EMPTY_BALLOT_SET("EMPTY_BALLOT_SET", "No ballots were cast"),
    CANDIDATE_SET_MISMATCH("CANDIDATE_SET_MISMATCH", "Ballots reference different candidate sets");

    private final String code;
    private final String defaultMessage;

    ErrorCode(String code, String defaultMessage) {
        this.code = code;
        this.defaultMessage = defaultMessage;
    }

    public String getCode() {
        return code;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }
}

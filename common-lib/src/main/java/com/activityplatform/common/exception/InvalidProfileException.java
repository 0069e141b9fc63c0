package com.activityplatform.common.exception;

/**
 * Thrown when a user profile carries negative, non-finite or otherwise malformed preference data.
 */
public class InvalidProfileException extends EngineException {

    public InvalidProfileException(String message) {
        super(ErrorCode.INVALID_PROFILE, message);
    }
}

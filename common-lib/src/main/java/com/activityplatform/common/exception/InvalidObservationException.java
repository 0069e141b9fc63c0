package com.activityplatform.common.exception;

/**
 * Thrown when a weather observation has a non-finite or physically implausible value.
 */
public class InvalidObservationException extends EngineException {

    public InvalidObservationException(String message) {
        super(ErrorCode.INVALID_OBSERVATION, message);
    }
}

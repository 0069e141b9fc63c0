package com.activityplatform.common.exception;

/**
 * Thrown when a ballot lists a candidate twice or contains an empty tie group.
 */
public class InvalidBallotException extends EngineException {

    public InvalidBallotException(String message) {
        super(ErrorCode.INVALID_BALLOT, message);
    }
}

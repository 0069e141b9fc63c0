package com.activityplatform.common.exception;

/**
 * Thrown when a voting round is resolved with zero ballots.
 */
public class EmptyBallotSetException extends EngineException {

    public EmptyBallotSetException(String message) {
        super(ErrorCode.EMPTY_BALLOT_SET, message);
    }
}

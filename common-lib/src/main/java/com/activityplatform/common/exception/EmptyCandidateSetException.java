package com.activityplatform.common.exception;

/**
 * Thrown when recommendation or ballot building is asked to work over no activities.
 */
public class EmptyCandidateSetException extends EngineException {

    public EmptyCandidateSetException(String message) {
        super(ErrorCode.EMPTY_CANDIDATE_SET, message);
    }
}

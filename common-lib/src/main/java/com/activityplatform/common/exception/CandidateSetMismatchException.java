package com.activityplatform.common.exception;

/**
 * Thrown when the ballots of one voting round do not all rank the same candidate set.
 */
public class CandidateSetMismatchException extends EngineException {

    public CandidateSetMismatchException(String message) {
        super(ErrorCode.CANDIDATE_SET_MISMATCH, message);
    }
}

package com.activityplatform.common.exception;

/**
 * Thrown when a candidate set holds two distinct activities under the same identifier.
 */
public class DuplicateActivityException extends EngineException {

    public DuplicateActivityException(String message) {
        super(ErrorCode.DUPLICATE_ACTIVITY, message);
    }
}

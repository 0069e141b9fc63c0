package com.activityplatform.common.exception;

/**
 * Base type for all validation failures raised by the scoring and voting engine.
 */
public abstract class EngineException extends RuntimeException {
    private final ErrorCode errorCode;

    protected EngineException(ErrorCode errorCode, String message) {
        super("[" + errorCode.getCode() + "] " + message);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}

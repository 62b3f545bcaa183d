package com.flagship.wager_engine.exception;

import lombok.Getter;

/**
 * Base class for expected, reportable engine errors.
 * These never indicate a broken engine; they are returned to the caller that triggered them.
 */
@Getter
public class WagerException extends RuntimeException {

    private final ErrorCode errorCode;

    public WagerException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public WagerException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}

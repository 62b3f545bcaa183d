package com.flagship.wager_engine.exception;

public class InvalidPhaseException extends WagerException {

    public InvalidPhaseException(String message) {
        super(ErrorCode.INVALID_PHASE, message);
    }
}

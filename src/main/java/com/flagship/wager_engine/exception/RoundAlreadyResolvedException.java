package com.flagship.wager_engine.exception;

public class RoundAlreadyResolvedException extends WagerException {

    public RoundAlreadyResolvedException(String message) {
        super(ErrorCode.ROUND_ALREADY_RESOLVED, message);
    }
}

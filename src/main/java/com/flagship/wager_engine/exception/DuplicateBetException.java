package com.flagship.wager_engine.exception;

public class DuplicateBetException extends WagerException {

    public DuplicateBetException(String message) {
        super(ErrorCode.DUPLICATE_BET, message);
    }
}

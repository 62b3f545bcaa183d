package com.flagship.wager_engine.exception;

public class InsufficientFundsException extends WagerException {

    public InsufficientFundsException(String message) {
        super(ErrorCode.INSUFFICIENT_FUNDS, message);
    }
}

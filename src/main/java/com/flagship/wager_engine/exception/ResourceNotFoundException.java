package com.flagship.wager_engine.exception;

public class ResourceNotFoundException extends WagerException {

    public ResourceNotFoundException(String message) {
        super(ErrorCode.NOT_FOUND, message);
    }
}

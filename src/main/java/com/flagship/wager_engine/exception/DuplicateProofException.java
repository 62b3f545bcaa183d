package com.flagship.wager_engine.exception;

public class DuplicateProofException extends WagerException {

    public DuplicateProofException(String message) {
        super(ErrorCode.DUPLICATE_PROOF, message);
    }
}

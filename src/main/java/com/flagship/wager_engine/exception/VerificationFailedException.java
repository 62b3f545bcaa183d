package com.flagship.wager_engine.exception;

/**
 * External confirmation of a proof failed after all retries and endpoints were exhausted,
 * or the external record did not match the expected transfer.
 */
public class VerificationFailedException extends WagerException {

    public VerificationFailedException(String message) {
        super(ErrorCode.VERIFICATION_FAILED, message);
    }

    public VerificationFailedException(String message, Throwable cause) {
        super(ErrorCode.VERIFICATION_FAILED, message, cause);
    }
}

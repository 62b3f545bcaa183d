package com.flagship.wager_engine.exception;

import org.springframework.http.HttpStatus;

/**
 * Error taxonomy of the engine.
 *
 * Each code carries the HTTP status used when the error reaches the REST layer.
 * Real-time channel errors reuse the code name as the error type.
 */
public enum ErrorCode {
    /** Action arrived outside its valid state-machine window. */
    INVALID_PHASE(HttpStatus.CONFLICT),
    /** Available balance (balance - locked) is below the requested amount. */
    INSUFFICIENT_FUNDS(HttpStatus.BAD_REQUEST),
    /** External proof already held by another transaction. */
    DUPLICATE_PROOF(HttpStatus.CONFLICT),
    /** Player already holds a bet in this round. */
    DUPLICATE_BET(HttpStatus.CONFLICT),
    /** External confirmation could not be obtained. */
    VERIFICATION_FAILED(HttpStatus.PAYMENT_REQUIRED),
    /** Cashout lost the race against round resolution. */
    ROUND_ALREADY_RESOLVED(HttpStatus.CONFLICT),
    NOT_FOUND(HttpStatus.NOT_FOUND),
    /** Persistence transaction could not commit. */
    STORE_FAILURE(HttpStatus.SERVICE_UNAVAILABLE);

    private final HttpStatus httpStatus;

    ErrorCode(HttpStatus httpStatus) {
        this.httpStatus = httpStatus;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }
}

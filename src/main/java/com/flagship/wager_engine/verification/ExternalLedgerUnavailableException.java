package com.flagship.wager_engine.verification;

/**
 * Transport-level failure talking to an external ledger endpoint. Triggers failover to the
 * next endpoint; never reported to players directly.
 */
public class ExternalLedgerUnavailableException extends RuntimeException {

    public ExternalLedgerUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.flagship.wager_engine.verification;

public enum VerificationOutcome {
    /** The external ledger confirmed the transfer. */
    CONFIRMED,
    /** Confirmation failed but provisional acceptance is enabled; reconciliation finishes the job. */
    PROVISIONAL
}

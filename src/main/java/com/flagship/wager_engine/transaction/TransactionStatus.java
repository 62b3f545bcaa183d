package com.flagship.wager_engine.transaction;

/**
 * Transaction status.
 *
 * PENDING waits for external confirmation; CONFIRMED and FAILED are terminal.
 */
public enum TransactionStatus {
    PENDING,
    CONFIRMED,
    FAILED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}

package com.flagship.wager_engine.transaction;

public enum TransactionType {
    BET,
    CASHOUT,
    DEPOSIT,
    WITHDRAWAL
}

package com.flagship.wager_engine.ledger;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Point-in-time view of a player's balance.
 */
@Value
public class BalanceSnapshot {
    String address;
    BigDecimal balance;
    BigDecimal lockedBalance;

    public BigDecimal getAvailableBalance() {
        return balance.subtract(lockedBalance);
    }
}

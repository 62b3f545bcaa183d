package com.flagship.wager_engine.verification;

import lombok.Value;

import java.math.BigDecimal;

/**
 * A transfer as reported by the external ledger network.
 */
@Value
public class ExternalTransactionRecord {
    String hash;
    String from;
    String to;
    BigDecimal amount;
    boolean confirmed;
}

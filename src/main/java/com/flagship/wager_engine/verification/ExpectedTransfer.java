package com.flagship.wager_engine.verification;

import lombok.Value;

import java.math.BigDecimal;

/**
 * What an external proof must show to be accepted.
 */
@Value
public class ExpectedTransfer {
    String from;
    String to;
    BigDecimal amount;
}

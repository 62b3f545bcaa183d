package com.flagship.wager_engine.game;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Outcome of a successful cashout.
 */
@Value
public class Settlement {
    UUID betId;
    BetStatus status;
    BigDecimal multiplier;
    BigDecimal winAmount;
}

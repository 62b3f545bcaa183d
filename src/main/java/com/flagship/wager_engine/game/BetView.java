package com.flagship.wager_engine.game;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Client-facing representation of a bet.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BetView {
    UUID betId;
    UUID roundId;
    String address;
    BigDecimal amount;
    BigDecimal target;
    BetStatus status;
    BigDecimal multiplier;
    BigDecimal winAmount;

    public static BetView from(Bet bet) {
        return new BetView(bet.getId(), bet.getRoundId(), bet.getAddress(), bet.getAmount(), bet.getTarget(),
            bet.getStatus(), bet.getMultiplier(), bet.getPayout());
    }
}

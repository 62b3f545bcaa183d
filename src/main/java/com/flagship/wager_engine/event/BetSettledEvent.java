package com.flagship.wager_engine.event;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.flagship.wager_engine.game.Bet;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Published when a bet reaches its terminal status.
 * Exactly one of these exists per bet.
 */
@Value
public class BetSettledEvent implements WagerEvent {
    UUID eventId;
    UUID betId;
    UUID roundId;
    String gameType;
    String address;
    String status;
    BigDecimal amount;
    BigDecimal multiplier;
    BigDecimal payout;
    Instant occurredAt;

    public static final String EVENT_TYPE = "BetSettled";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    @JsonIgnore
    public UUID getAggregateId() {
        return betId;
    }

    @Override
    @JsonIgnore
    public String getAggregateType() {
        return "Bet";
    }

    public static BetSettledEvent fromBet(Bet settled) {
        return new BetSettledEvent(
            UUID.randomUUID(),
            settled.getId(),
            settled.getRoundId(),
            settled.getGameType().name(),
            settled.getAddress(),
            settled.getStatus().name(),
            settled.getAmount(),
            settled.getMultiplier(),
            settled.getPayout(),
            Instant.now()
        );
    }
}

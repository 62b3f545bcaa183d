package com.flagship.wager_engine.event;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.flagship.wager_engine.game.Bet;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Published when a bet is registered and its amount locked.
 */
@Value
public class BetPlacedEvent implements WagerEvent {
    UUID eventId;
    UUID betId;
    UUID roundId;
    String gameType;
    String address;
    BigDecimal amount;
    BigDecimal target;
    Instant occurredAt;

    public static final String EVENT_TYPE = "BetPlaced";

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

    public static BetPlacedEvent fromBet(Bet bet) {
        return new BetPlacedEvent(
            UUID.randomUUID(),
            bet.getId(),
            bet.getRoundId(),
            bet.getGameType().name(),
            bet.getAddress(),
            bet.getAmount(),
            bet.getTarget(),
            Instant.now()
        );
    }
}

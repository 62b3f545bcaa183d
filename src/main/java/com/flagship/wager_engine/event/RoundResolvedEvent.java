package com.flagship.wager_engine.event;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Published when a round flips to RESOLVED and its outcome becomes final.
 */
@Value
public class RoundResolvedEvent implements WagerEvent {
    UUID eventId;
    UUID roundId;
    String gameType;
    BigDecimal result;
    Instant occurredAt;

    public static final String EVENT_TYPE = "RoundResolved";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    @JsonIgnore
    public UUID getAggregateId() {
        return roundId;
    }

    @Override
    @JsonIgnore
    public String getAggregateType() {
        return "Round";
    }

    public static RoundResolvedEvent of(UUID roundId, String gameType, BigDecimal result) {
        return new RoundResolvedEvent(UUID.randomUUID(), roundId, gameType, result, Instant.now());
    }
}

package com.flagship.wager_engine.game;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Snapshot of a round driver, sent to channel clients and reported by {@code /health}.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RoundStatus {
    GameType game;
    RoundPhase phase;
    UUID roundId;
    BigDecimal multiplier;
    int players;
}

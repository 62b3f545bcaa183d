package com.flagship.wager_engine.game.mines;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flagship.wager_engine.game.BetStatus;
import com.flagship.wager_engine.game.RoundPhase;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Client view of a mine-field session. Mine positions are only included once the session
 * is finished.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MineSessionView {
    UUID sessionId;
    UUID betId;
    String address;
    BigDecimal amount;
    int mines;
    RoundPhase phase;
    BetStatus status;
    List<Integer> revealed;
    BigDecimal multiplier;
    BigDecimal potentialWin;
    BigDecimal winAmount;
    Integer hitPoint;
    List<Integer> mineCells;
}

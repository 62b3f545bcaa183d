package com.flagship.wager_engine.game.poker;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flagship.wager_engine.game.BetStatus;
import com.flagship.wager_engine.game.RoundPhase;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Client view of a draw-poker session. The undealt deck is never exposed.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PokerSessionView {
    UUID sessionId;
    UUID betId;
    String address;
    BigDecimal amount;
    RoundPhase phase;
    BetStatus status;
    List<String> hand;
    List<Boolean> held;
    PokerHand handRank;
    BigDecimal multiplier;
    BigDecimal winAmount;
}

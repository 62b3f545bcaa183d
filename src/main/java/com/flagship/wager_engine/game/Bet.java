package com.flagship.wager_engine.game;

import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.UUID;

/**
 * A player's wager on a round.
 *
 * {@code target} is game specific: the auto-cashout multiplier for crash, the predicted
 * minimum result for slide, unused for turn-based sessions.
 */
@Value
public class Bet {

    public static final int AMOUNT_SCALE = 8;

    UUID id;
    UUID roundId;
    GameType gameType;
    String address;
    BigDecimal amount;
    BigDecimal target;
    BetStatus status;
    BigDecimal multiplier;
    BigDecimal payout;
    Instant createdAt;
    Instant settledAt;

    public static Bet open(Round round, String address, BigDecimal amount, BigDecimal target) {
        return new Bet(UUID.randomUUID(), round.getId(), round.getGameType(), address, amount, target,
            BetStatus.OPEN, null, null, Instant.now(), null);
    }

    /**
     * Moves the bet to its terminal status.
     *
     * @param terminal CASHED_OUT, WON or LOST
     * @param multiplier payout multiplier applied for a win, ignored for a loss
     * @throws IllegalStateException if the bet is not OPEN
     */
    public Bet settle(BetStatus terminal, BigDecimal multiplier) {
        if (status != BetStatus.OPEN) {
            throw new IllegalStateException(
                String.format("Cannot settle bet %s in %s status. Only OPEN bets can be settled.", id, status));
        }
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException("Settlement status must be terminal: " + terminal);
        }
        BigDecimal payout = terminal.isWin()
            ? amount.multiply(multiplier).setScale(AMOUNT_SCALE, RoundingMode.DOWN)
            : BigDecimal.ZERO;
        return new Bet(id, roundId, gameType, address, amount, target, terminal,
            terminal.isWin() ? multiplier : null, payout, createdAt, Instant.now());
    }
}

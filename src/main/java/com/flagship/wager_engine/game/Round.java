package com.flagship.wager_engine.game;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * One play cycle of a game: a shared timed round or a single player's session.
 *
 * The result is set only when the round is resolved and never changes afterwards.
 */
@Value
public class Round {
    UUID id;
    GameType gameType;
    RoundPhase phase;
    BigDecimal result;
    Instant openedAt;
    Instant resolvedAt;

    /**
     * Opens a new round. Timed games start in COUNTDOWN, turn-based sessions in CREATED.
     */
    public static Round open(GameType gameType) {
        RoundPhase initial = gameType.isTurnBased() ? RoundPhase.CREATED : RoundPhase.COUNTDOWN;
        return new Round(UUID.randomUUID(), gameType, initial, null, Instant.now(), null);
    }

    /**
     * Phase in which new bets are accepted: COUNTDOWN for crash, BETTING for slide,
     * CREATED for a session's single stake.
     */
    public boolean acceptsRegistration() {
        return switch (gameType) {
            case CRASH -> phase == RoundPhase.COUNTDOWN;
            case SLIDE -> phase == RoundPhase.BETTING;
            case MINES, VIDEO_POKER -> phase == RoundPhase.CREATED;
        };
    }

    /**
     * Early cashout is only possible while the multiplier runs or the session is in progress.
     */
    public boolean acceptsCashout() {
        return phase == RoundPhase.RUNNING || phase == RoundPhase.IN_PROGRESS;
    }

    public boolean isResolved() {
        return phase == RoundPhase.RESOLVED;
    }

    /**
     * Checks if a transition from the current phase to the target phase is allowed.
     */
    public boolean canTransitionTo(RoundPhase target) {
        return switch (phase) {
            case COUNTDOWN -> gameType == GameType.CRASH ? target == RoundPhase.RUNNING : target == RoundPhase.BETTING;
            case BETTING, RUNNING, IN_PROGRESS -> target == RoundPhase.RESOLVED;
            case CREATED -> target == RoundPhase.IN_PROGRESS || target == RoundPhase.RESOLVED;
            case IDLE, RESOLVED -> false;
        };
    }
}

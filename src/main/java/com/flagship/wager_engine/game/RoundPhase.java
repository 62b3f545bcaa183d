package com.flagship.wager_engine.game;

/**
 * Phases of a round or session.
 *
 * Timed games: IDLE -> COUNTDOWN -> (BETTING | RUNNING) -> RESOLVED.
 * Turn-based sessions: CREATED -> IN_PROGRESS -> RESOLVED.
 * IDLE is never persisted; it only describes a scheduler without an open round.
 */
public enum RoundPhase {
    IDLE,
    COUNTDOWN,
    BETTING,
    RUNNING,
    CREATED,
    IN_PROGRESS,
    RESOLVED;

    public boolean isTerminal() {
        return this == RESOLVED;
    }
}

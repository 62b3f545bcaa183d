package com.flagship.wager_engine.game;

/**
 * Bet lifecycle status.
 *
 * OPEN is the only non-terminal status; each bet leaves it exactly once.
 */
public enum BetStatus {
    OPEN,
    CASHED_OUT,
    LOST,
    WON;

    public boolean isTerminal() {
        return this != OPEN;
    }

    public boolean isWin() {
        return this == CASHED_OUT || this == WON;
    }
}

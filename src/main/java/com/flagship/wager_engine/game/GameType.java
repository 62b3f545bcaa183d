package com.flagship.wager_engine.game;

/**
 * Game types served by the engine.
 */
public enum GameType {
    /** Continuously growing multiplier, shared timed rounds. */
    CRASH(false),
    /** Discrete outcome drawn at the end of a timed betting window. */
    SLIDE(false),
    /** Per-player mine-field reveal session. */
    MINES(true),
    /** Per-player five-card draw session. */
    VIDEO_POKER(true);

    private final boolean turnBased;

    GameType(boolean turnBased) {
        this.turnBased = turnBased;
    }

    public boolean isTurnBased() {
        return turnBased;
    }
}

package com.flagship.wager_engine.game.poker;

import java.math.BigDecimal;

/**
 * Hand rankings with their payout multiplier on the stake.
 */
public enum PokerHand {
    ROYAL_FLUSH(800),
    STRAIGHT_FLUSH(60),
    FOUR_OF_A_KIND(22),
    FULL_HOUSE(9),
    FLUSH(6),
    STRAIGHT(4),
    THREE_OF_A_KIND(3),
    JACKS_OR_BETTER(1),
    NOTHING(0);

    private final BigDecimal multiplier;

    PokerHand(int multiplier) {
        this.multiplier = BigDecimal.valueOf(multiplier);
    }

    public BigDecimal getMultiplier() {
        return multiplier;
    }

    public boolean pays() {
        return multiplier.signum() > 0;
    }
}

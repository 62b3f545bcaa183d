package com.flagship.wager_engine.game.mines;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Payout multiplier of a mine-field session.
 */
public final class MinePayout {

    public static final int CELLS = 25;

    private MinePayout() {
        // Utility class
    }

    /**
     * {@code totalSafe / (totalSafe - safeRevealed + 1)}, or 1 before the first safe reveal.
     * Truncated to four decimals.
     */
    public static BigDecimal multiplier(int mines, int safeRevealed) {
        int totalSafe = CELLS - mines;
        if (safeRevealed < 0 || safeRevealed > totalSafe) {
            throw new IllegalArgumentException(
                String.format("Safe reveals must be between 0 and %d: %d", totalSafe, safeRevealed));
        }
        if (safeRevealed == 0) {
            return BigDecimal.ONE;
        }
        return BigDecimal.valueOf(totalSafe)
            .divide(BigDecimal.valueOf(totalSafe - safeRevealed + 1L), 4, RoundingMode.DOWN);
    }
}

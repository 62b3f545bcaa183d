package com.flagship.wager_engine.game.mines;

import lombok.Value;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * State of a mine-field session: the hidden mine cells and the safe cells revealed so far.
 */
@Value
public class MineSession {
    UUID roundId;
    int mineCount;
    List<Integer> mineCells;
    List<Integer> revealed;

    public static MineSession create(UUID roundId, List<Integer> mineCells) {
        return new MineSession(roundId, mineCells.size(), List.copyOf(mineCells), List.of());
    }

    public boolean isMine(int point) {
        return mineCells.contains(point);
    }

    public boolean isRevealed(int point) {
        return revealed.contains(point);
    }

    /**
     * Adds a safe cell to the revealed set.
     *
     * @throws IllegalArgumentException if the point is off the board or already revealed
     */
    public MineSession reveal(int point) {
        checkPoint(point);
        if (isRevealed(point)) {
            throw new IllegalArgumentException("Point " + point + " is already revealed");
        }
        List<Integer> next = new ArrayList<>(revealed);
        next.add(point);
        return new MineSession(roundId, mineCount, mineCells, List.copyOf(next));
    }

    public int safeRevealed() {
        return revealed.size();
    }

    public BigDecimal multiplier() {
        return MinePayout.multiplier(mineCount, revealed.size());
    }

    /**
     * Every safe cell has been revealed.
     */
    public boolean isCleared() {
        return revealed.size() == MinePayout.CELLS - mineCount;
    }

    public static void checkPoint(int point) {
        if (point < 0 || point >= MinePayout.CELLS) {
            throw new IllegalArgumentException("Point must be between 0 and " + (MinePayout.CELLS - 1) + ": " + point);
        }
    }
}

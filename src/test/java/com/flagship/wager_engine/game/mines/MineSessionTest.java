package com.flagship.wager_engine.game.mines;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class MineSessionTest {

    @Test
    @DisplayName("Multiplier is totalSafe / (totalSafe - revealed + 1)")
    void testPayoutFormula() {
        assertEquals(BigDecimal.ONE, MinePayout.multiplier(5, 0));
        assertEquals(new BigDecimal("1.0000"), MinePayout.multiplier(5, 1));
        assertEquals(new BigDecimal("1.0526"), MinePayout.multiplier(5, 2));
        assertEquals(new BigDecimal("20.0000"), MinePayout.multiplier(5, 20));
        assertEquals(new BigDecimal("24.0000"), MinePayout.multiplier(1, 24));
        assertThrows(IllegalArgumentException.class, () -> MinePayout.multiplier(5, 21));
    }

    @Test
    @DisplayName("Revealing a cell twice or off the board is rejected")
    void testReveal() {
        MineSession session = MineSession.create(UUID.randomUUID(), List.of(0, 1, 2));

        MineSession next = session.reveal(10);

        assertTrue(next.isRevealed(10));
        assertFalse(session.isRevealed(10));
        assertEquals(1, next.safeRevealed());
        assertThrows(IllegalArgumentException.class, () -> next.reveal(10));
        assertThrows(IllegalArgumentException.class, () -> next.reveal(25));
        assertThrows(IllegalArgumentException.class, () -> next.reveal(-1));
    }

    @Test
    @DisplayName("Board is cleared once every safe cell is revealed")
    void testCleared() {
        MineSession session = MineSession.create(UUID.randomUUID(), List.of(
                0, 1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12, 13, 14, 15, 16, 17, 18, 19, 20, 21, 22));

        MineSession one = session.reveal(23);
        assertFalse(one.isCleared());
        MineSession both = one.reveal(24);

        assertTrue(both.isCleared());
        assertEquals(23, both.getMineCount());
        assertTrue(both.isMine(22));
    }
}

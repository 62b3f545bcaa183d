package com.flagship.wager_engine.game;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class RoundHistoryTest {

    @Test
    void keepsMostRecentFirstAndDropsOldest() {
        RoundHistory history = new RoundHistory(3);
        for (int i = 1; i <= 5; i++) {
            history.record(new RoundHistoryEntry(UUID.randomUUID(), BigDecimal.valueOf(i), Instant.now()));
        }

        List<RoundHistoryEntry> all = history.all();
        assertEquals(3, history.size());
        assertEquals(BigDecimal.valueOf(5), all.get(0).getResult());
        assertEquals(BigDecimal.valueOf(3), all.get(2).getResult());
    }

    @Test
    void recentIsLimited() {
        RoundHistory history = new RoundHistory(10);
        history.record(new RoundHistoryEntry(UUID.randomUUID(), BigDecimal.ONE, Instant.now()));
        history.record(new RoundHistoryEntry(UUID.randomUUID(), BigDecimal.TEN, Instant.now()));

        assertEquals(1, history.recent(1).size());
        assertEquals(BigDecimal.TEN, history.recent(1).get(0).getResult());
        assertEquals(2, history.recent(50).size());
    }

    @Test
    void rejectsNonPositiveLimit() {
        RoundHistory history = new RoundHistory(10);

        assertThrows(IllegalArgumentException.class, () -> history.recent(0));
        assertThrows(IllegalArgumentException.class, () -> history.recent(-1));
    }

    @Test
    void rejectsNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new RoundHistory(0));
    }
}

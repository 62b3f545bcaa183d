package com.flagship.wager_engine.ledger;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PlayerAddressTest {

    private static final String ADDRESS = "A".repeat(PlayerAddress.LENGTH);

    @Test
    void keepsAddressOfExactLength() {
        assertEquals(ADDRESS, PlayerAddress.normalize("  " + ADDRESS + " "));
    }

    @Test
    void keepsTrailingCharactersOfLongerValue() {
        assertEquals(ADDRESS, PlayerAddress.normalize("WALLET" + ADDRESS));
    }

    @Test
    void keepsShortValueAsIs() {
        assertEquals("ABC", PlayerAddress.normalize("ABC"));
    }

    @Test
    void rejectsBlank() {
        assertThrows(IllegalArgumentException.class, () -> PlayerAddress.normalize(" "));
        assertThrows(IllegalArgumentException.class, () -> PlayerAddress.normalize(null));
    }
}

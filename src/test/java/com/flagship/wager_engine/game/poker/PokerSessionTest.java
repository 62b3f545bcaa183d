package com.flagship.wager_engine.game.poker;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class PokerSessionTest {

    @Test
    @DisplayName("Draw replaces the cards that are not held, from the top of the deck")
    void testDraw() {
        List<Card> deck = HandEvaluatorTest.cards("JC JD 4H 7S 9C JH JS 2D 3D 5D 6D");
        PokerSession dealt = PokerSession.deal(UUID.randomUUID(), deck);
        assertEquals(List.of("JC", "JD", "4H", "7S", "9C"), dealt.getHand());

        PokerSession drawn = dealt.draw(List.of(true, true, false, false, true));

        assertEquals(List.of("JC", "JD", "JH", "JS", "9C"), drawn.getHand());
        assertEquals(PokerHand.FOUR_OF_A_KIND, drawn.getHandRank());
        assertEquals(List.of("2D", "3D", "5D", "6D"), drawn.getDeck());
        assertThrows(IllegalStateException.class, () -> drawn.draw(List.of(true, true, true, true, true)));
    }

    @Test
    void testHeldMustHaveFiveFlags() {
        PokerSession dealt = PokerSession.deal(UUID.randomUUID(), Card.fullDeck());

        assertThrows(IllegalArgumentException.class, () -> dealt.draw(List.of(true, false)));
    }
}

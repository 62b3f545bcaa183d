package com.flagship.wager_engine.game.poker;

import lombok.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * State of a draw-poker session: the five cards in hand and the undealt rest of the deck,
 * stored as card codes.
 *
 * {@code held} and {@code handRank} are null until the draw.
 */
@Value
public class PokerSession {

    public static final int HAND_SIZE = 5;

    UUID roundId;
    List<String> deck;
    List<String> hand;
    List<Boolean> held;
    PokerHand handRank;

    /**
     * Deals the first five cards of a shuffled deck.
     */
    public static PokerSession deal(UUID roundId, List<Card> shuffled) {
        if (shuffled.size() < HAND_SIZE * 2) {
            throw new IllegalArgumentException("Deck too small to deal and draw: " + shuffled.size());
        }
        List<String> codes = shuffled.stream().map(Card::code).toList();
        return new PokerSession(roundId, codes.subList(HAND_SIZE, codes.size()), codes.subList(0, HAND_SIZE),
            null, null);
    }

    public boolean isDrawn() {
        return handRank != null;
    }

    /**
     * Replaces every card not held with the next card of the deck and ranks the final hand.
     *
     * @param held one flag per card in hand
     * @throws IllegalStateException if the session was already drawn
     */
    public PokerSession draw(List<Boolean> held) {
        if (isDrawn()) {
            throw new IllegalStateException(String.format("Cannot draw session %s twice", roundId));
        }
        if (held == null || held.size() != HAND_SIZE || held.contains(null)) {
            throw new IllegalArgumentException("Held must contain exactly " + HAND_SIZE + " flags");
        }
        List<String> remaining = new ArrayList<>(deck);
        List<String> finalHand = new ArrayList<>(HAND_SIZE);
        for (int i = 0; i < HAND_SIZE; i++) {
            finalHand.add(held.get(i) ? hand.get(i) : remaining.remove(0));
        }
        PokerHand rank = HandEvaluator.evaluate(toCards(finalHand));
        return new PokerSession(roundId, List.copyOf(remaining), List.copyOf(finalHand), List.copyOf(held), rank);
    }

    public List<Card> cards() {
        return toCards(hand);
    }

    private static List<Card> toCards(List<String> codes) {
        return codes.stream().map(Card::parse).toList();
    }
}

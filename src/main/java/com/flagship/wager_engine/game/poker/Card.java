package com.flagship.wager_engine.game.poker;

import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * A playing card. Ranks run from 2 to 14 (ace high).
 *
 * The two-character code ("AS", "TD", "7H") is the stored and transmitted form.
 */
@Value
public class Card {

    private static final String RANK_SYMBOLS = "23456789TJQKA";

    int rank;
    Suit suit;

    public static Card of(int rank, Suit suit) {
        if (rank < 2 || rank > 14) {
            throw new IllegalArgumentException("Rank must be between 2 and 14: " + rank);
        }
        return new Card(rank, suit);
    }

    public static Card parse(String code) {
        if (code == null || code.length() != 2) {
            throw new IllegalArgumentException("Invalid card code: " + code);
        }
        int index = RANK_SYMBOLS.indexOf(code.charAt(0));
        if (index < 0) {
            throw new IllegalArgumentException("Invalid card rank: " + code);
        }
        return new Card(index + 2, Suit.fromSymbol(code.charAt(1)));
    }

    /**
     * Standard 52-card deck in a fixed order.
     */
    public static List<Card> fullDeck() {
        List<Card> deck = new ArrayList<>(52);
        for (Suit suit : Suit.values()) {
            for (int rank = 2; rank <= 14; rank++) {
                deck.add(new Card(rank, suit));
            }
        }
        return deck;
    }

    public String code() {
        return "" + RANK_SYMBOLS.charAt(rank - 2) + suit.getSymbol();
    }

    @Override
    public String toString() {
        return code();
    }
}

package com.flagship.wager_engine.game.poker;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Ranks a five-card hand for jacks-or-better draw poker.
 */
public final class HandEvaluator {

    private static final int JACK = 11;
    private static final int ACE = 14;

    private HandEvaluator() {
        // Utility class
    }

    public static PokerHand evaluate(List<Card> hand) {
        if (hand == null || hand.size() != 5) {
            throw new IllegalArgumentException("A hand has exactly five cards");
        }

        Map<Integer, Integer> rankCounts = new TreeMap<>();
        EnumSet<Suit> suits = EnumSet.noneOf(Suit.class);
        for (Card card : hand) {
            rankCounts.merge(card.getRank(), 1, Integer::sum);
            suits.add(card.getSuit());
        }

        boolean flush = suits.size() == 1;
        boolean straight = isStraight(rankCounts);

        if (flush && straight) {
            TreeSet<Integer> ranks = new TreeSet<>(rankCounts.keySet());
            return ranks.first() == 10 ? PokerHand.ROYAL_FLUSH : PokerHand.STRAIGHT_FLUSH;
        }
        if (rankCounts.containsValue(4)) {
            return PokerHand.FOUR_OF_A_KIND;
        }
        if (rankCounts.containsValue(3) && rankCounts.containsValue(2)) {
            return PokerHand.FULL_HOUSE;
        }
        if (flush) {
            return PokerHand.FLUSH;
        }
        if (straight) {
            return PokerHand.STRAIGHT;
        }
        if (rankCounts.containsValue(3)) {
            return PokerHand.THREE_OF_A_KIND;
        }
        boolean highPair = rankCounts.entrySet().stream()
            .anyMatch(e -> e.getValue() == 2 && e.getKey() >= JACK);
        return highPair ? PokerHand.JACKS_OR_BETTER : PokerHand.NOTHING;
    }

    /**
     * Five distinct consecutive ranks, with the ace also playing low (A-2-3-4-5).
     */
    private static boolean isStraight(Map<Integer, Integer> rankCounts) {
        if (rankCounts.size() != 5) {
            return false;
        }
        TreeSet<Integer> ranks = new TreeSet<>(rankCounts.keySet());
        if (ranks.last() - ranks.first() == 4) {
            return true;
        }
        return ranks.equals(new TreeSet<>(List.of(2, 3, 4, 5, ACE)));
    }
}

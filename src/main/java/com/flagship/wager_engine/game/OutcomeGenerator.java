package com.flagship.wager_engine.game;

import com.flagship.wager_engine.game.mines.MinePayout;
import com.flagship.wager_engine.game.poker.Card;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Draws round outcomes. Each outcome is generated once per round and never redrawn.
 *
 * The source of randomness is the injected {@link Random}. It is not a provably-fair
 * commitment scheme: no server seed is committed before the round.
 */
@Component
public class OutcomeGenerator {

    public static final BigDecimal MIN_MULTIPLIER = new BigDecimal("1.01");
    public static final BigDecimal MAX_CRASH_MULTIPLIER = new BigDecimal("1000.00");
    public static final BigDecimal MAX_SLIDE_MULTIPLIER = new BigDecimal("100.00");

    private static final double HOUSE_FACTOR = 0.99;
    private static final double SLIDE_SPAN = 98.99;

    private final Random random;

    public OutcomeGenerator(Random outcomeRandom) {
        this.random = outcomeRandom;
    }

    /**
     * Crash point in [1.01, 1000], heavy-tailed: {@code 0.99 / (1 - u)} floored to two decimals.
     */
    public BigDecimal crashPoint() {
        double u = random.nextDouble();
        double raw = HOUSE_FACTOR / (1.0 - u);
        return clamp(floor2(raw), MIN_MULTIPLIER, MAX_CRASH_MULTIPLIER);
    }

    /**
     * Slide result in [1.01, 100], uniform: {@code 1.01 + u * 98.99} floored to two decimals.
     */
    public BigDecimal slideResult() {
        double raw = 1.01 + random.nextDouble() * SLIDE_SPAN;
        return clamp(floor2(raw), MIN_MULTIPLIER, MAX_SLIDE_MULTIPLIER);
    }

    /**
     * Picks {@code mines} distinct cells out of 25 (partial Fisher-Yates), sorted ascending.
     */
    public List<Integer> mineLayout(int mines) {
        if (mines < 1 || mines >= MinePayout.CELLS) {
            throw new IllegalArgumentException("Mines must be between 1 and " + (MinePayout.CELLS - 1));
        }
        int[] cells = IntStream.range(0, MinePayout.CELLS).toArray();
        for (int i = 0; i < mines; i++) {
            int j = i + random.nextInt(MinePayout.CELLS - i);
            int tmp = cells[i];
            cells[i] = cells[j];
            cells[j] = tmp;
        }
        return IntStream.of(cells).limit(mines).sorted().boxed().collect(Collectors.toList());
    }

    /**
     * A full 52-card deck in shuffled order.
     */
    public List<Card> shuffledDeck() {
        List<Card> deck = new ArrayList<>(Card.fullDeck());
        Collections.shuffle(deck, random);
        return deck;
    }

    private static BigDecimal floor2(double value) {
        if (Double.isInfinite(value) || Double.isNaN(value)) {
            return MAX_CRASH_MULTIPLIER;
        }
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.FLOOR);
    }

    private static BigDecimal clamp(BigDecimal value, BigDecimal min, BigDecimal max) {
        if (value.compareTo(min) < 0) {
            return min;
        }
        return value.compareTo(max) > 0 ? max : value;
    }
}

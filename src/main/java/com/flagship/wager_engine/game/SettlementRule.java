package com.flagship.wager_engine.game;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Game-specific win/lose rule applied to every open bet when a round resolves.
 */
@FunctionalInterface
public interface SettlementRule {

    /**
     * @return the payout multiplier if the bet wins against the outcome, empty if it loses
     */
    Optional<BigDecimal> evaluate(Bet bet, BigDecimal outcome);

    /**
     * Every bet still open at resolution loses (crash: the player did not cash out in time;
     * mines: a mine was hit).
     */
    static SettlementRule allLose() {
        return (bet, outcome) -> Optional.empty();
    }

    /**
     * Wins when the outcome reaches the bet's target and pays the outcome (slide).
     */
    static SettlementRule outcomeReachesTarget(BigDecimal defaultTarget) {
        return (bet, outcome) -> {
            BigDecimal target = bet.getTarget() != null ? bet.getTarget() : defaultTarget;
            return outcome.compareTo(target) >= 0 ? Optional.of(outcome) : Optional.empty();
        };
    }

    /**
     * The outcome is itself the payout multiplier; zero loses (draw poker).
     */
    static SettlementRule outcomeIsMultiplier() {
        return (bet, outcome) -> outcome.signum() > 0 ? Optional.of(outcome) : Optional.empty();
    }
}

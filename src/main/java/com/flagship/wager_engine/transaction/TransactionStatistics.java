package com.flagship.wager_engine.transaction;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Aggregated betting statistics of one player over settled bets.
 * Win rate is a percentage with two decimals.
 */
@Value
@Builder
public class TransactionStatistics {
    long totalBets;
    long wins;
    long losses;
    BigDecimal totalWagered;
    BigDecimal totalWon;
    BigDecimal netProfit;
    BigDecimal winRate;
    BigDecimal averageBet;
    BigDecimal biggestWin;
    BigDecimal biggestLoss;
}

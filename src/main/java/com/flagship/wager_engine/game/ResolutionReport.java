package com.flagship.wager_engine.game;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Summary of one resolution pass over a round's open bets.
 *
 * {@code failed} bets stayed OPEN because their store transaction did not commit;
 * a later pass settles them.
 */
@Value
public class ResolutionReport {
    UUID roundId;
    BigDecimal result;
    boolean flipped;
    int won;
    int lost;
    int failed;
}

package com.flagship.wager_engine.game;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class RoundHistoryEntry {
    UUID roundId;
    BigDecimal result;
    Instant resolvedAt;
}

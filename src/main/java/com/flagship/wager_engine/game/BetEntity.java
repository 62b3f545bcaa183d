package com.flagship.wager_engine.game;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for bets.
 *
 * Settlement fields are written only by {@link BetRepository#settleIfOpen}, a conditional
 * update that succeeds for exactly one caller.
 */
@Entity
@Table(name = "bets")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class BetEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "round_id", nullable = false, updatable = false)
    private UUID roundId;

    @Enumerated(EnumType.STRING)
    @Column(name = "game_type", nullable = false, updatable = false)
    private GameType gameType;

    @Column(nullable = false, updatable = false, length = 64)
    private String address;

    @Column(nullable = false, updatable = false, precision = 30, scale = 8)
    private BigDecimal amount;

    @Column(updatable = false, precision = 12, scale = 2)
    private BigDecimal target;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private BetStatus status;

    @Column(precision = 12, scale = 4)
    private BigDecimal multiplier;

    @Column(precision = 30, scale = 8)
    private BigDecimal payout;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "settled_at")
    private Instant settledAt;

    static BetEntity fromDomain(Bet bet) {
        return new BetEntity(
            bet.getId(),
            bet.getRoundId(),
            bet.getGameType(),
            bet.getAddress(),
            bet.getAmount(),
            bet.getTarget(),
            bet.getStatus(),
            bet.getMultiplier(),
            bet.getPayout(),
            bet.getCreatedAt(),
            bet.getSettledAt()
        );
    }

    public Bet toDomain() {
        return new Bet(id, roundId, gameType, address, amount, target, status, multiplier, payout,
            createdAt, settledAt);
    }
}

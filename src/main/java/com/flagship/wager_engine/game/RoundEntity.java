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
 * JPA entity for rounds.
 *
 * Phase changes go through conditional bulk updates in {@link RoundRepository}, never through
 * this entity, so a phase flip is a single compare-and-set on the row.
 */
@Entity
@Table(name = "rounds")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RoundEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(name = "game_type", nullable = false, updatable = false)
    private GameType gameType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private RoundPhase phase;

    @Column(precision = 12, scale = 4)
    private BigDecimal result;

    @Column(name = "opened_at", nullable = false, updatable = false)
    private Instant openedAt;

    @Column(name = "resolved_at")
    private Instant resolvedAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    static RoundEntity fromDomain(Round round) {
        return new RoundEntity(
            round.getId(),
            round.getGameType(),
            round.getPhase(),
            round.getResult(),
            round.getOpenedAt(),
            round.getResolvedAt(),
            Instant.now()
        );
    }

    public Round toDomain() {
        return new Round(id, gameType, phase, result, openedAt, resolvedAt);
    }
}

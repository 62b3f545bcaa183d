package com.flagship.wager_engine.game.mines;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * JPA entity for mine-field sessions. Cell lists are stored as typed jsonb arrays.
 */
@Entity
@Table(name = "mine_sessions")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class MineSessionEntity {

    @Id
    @Column(name = "round_id", nullable = false, updatable = false)
    private UUID roundId;

    @Column(name = "mine_count", nullable = false, updatable = false)
    private int mineCount;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "mine_cells", nullable = false, updatable = false)
    private List<Integer> mineCells;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(nullable = false)
    private List<Integer> revealed;

    static MineSessionEntity fromDomain(MineSession session) {
        return new MineSessionEntity(
            session.getRoundId(),
            session.getMineCount(),
            new ArrayList<>(session.getMineCells()),
            new ArrayList<>(session.getRevealed())
        );
    }

    void updateFromDomain(MineSession session) {
        this.revealed = new ArrayList<>(session.getRevealed());
    }

    public MineSession toDomain() {
        return new MineSession(roundId, mineCount, List.copyOf(mineCells), List.copyOf(revealed));
    }
}

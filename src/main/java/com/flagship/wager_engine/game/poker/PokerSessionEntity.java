package com.flagship.wager_engine.game.poker;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
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

@Entity
@Table(name = "poker_sessions")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PokerSessionEntity {

    @Id
    @Column(name = "round_id", nullable = false, updatable = false)
    private UUID roundId;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(nullable = false)
    private List<String> deck;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(nullable = false)
    private List<String> hand;

    @JdbcTypeCode(SqlTypes.JSON)
    private List<Boolean> held;

    @Enumerated(EnumType.STRING)
    @Column(name = "hand_rank", length = 32)
    private PokerHand handRank;

    static PokerSessionEntity fromDomain(PokerSession session) {
        return new PokerSessionEntity(
            session.getRoundId(),
            new ArrayList<>(session.getDeck()),
            new ArrayList<>(session.getHand()),
            session.getHeld() != null ? new ArrayList<>(session.getHeld()) : null,
            session.getHandRank()
        );
    }

    void updateFromDomain(PokerSession session) {
        this.deck = new ArrayList<>(session.getDeck());
        this.hand = new ArrayList<>(session.getHand());
        this.held = session.getHeld() != null ? new ArrayList<>(session.getHeld()) : null;
        this.handRank = session.getHandRank();
    }

    public PokerSession toDomain() {
        return new PokerSession(roundId, List.copyOf(deck), List.copyOf(hand),
            held != null ? List.copyOf(held) : null, handRank);
    }
}

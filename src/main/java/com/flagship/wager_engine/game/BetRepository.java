package com.flagship.wager_engine.game;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface BetRepository extends JpaRepository<BetEntity, UUID> {

    List<BetEntity> findByRoundIdAndStatusOrderByCreatedAtAsc(UUID roundId, BetStatus status);

    List<BetEntity> findByRoundIdOrderByCreatedAtAsc(UUID roundId);

    Optional<BetEntity> findByRoundIdAndAddress(UUID roundId, String address);

    boolean existsByRoundIdAndAddress(UUID roundId, String address);

    /**
     * Open bets of a player in one game, newest first. For turn-based games this is the
     * player's active session.
     */
    @Query("""
        SELECT b FROM BetEntity b
        WHERE b.address = :address AND b.gameType = :gameType
          AND b.status = com.flagship.wager_engine.game.BetStatus.OPEN
        ORDER BY b.createdAt DESC
        """)
    List<BetEntity> findOpenBets(@Param("address") String address, @Param("gameType") GameType gameType);

    /**
     * Moves an OPEN bet to its terminal status.
     *
     * @return 1 for the single caller that won the transition, 0 for everyone else
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE BetEntity b
        SET b.status = :status, b.multiplier = :multiplier, b.payout = :payout, b.settledAt = :settledAt
        WHERE b.id = :id AND b.status = com.flagship.wager_engine.game.BetStatus.OPEN
        """)
    int settleIfOpen(@Param("id") UUID id, @Param("status") BetStatus status,
                     @Param("multiplier") BigDecimal multiplier, @Param("payout") BigDecimal payout,
                     @Param("settledAt") Instant settledAt);

    /**
     * Open bets whose round is already resolved. Settlement finishes a round's bets in the
     * transaction that resolves it, so anything counted here is stuck.
     */
    @Query("""
        SELECT COUNT(b) FROM BetEntity b
        WHERE b.status = com.flagship.wager_engine.game.BetStatus.OPEN
          AND b.roundId IN (SELECT r.id FROM RoundEntity r
                            WHERE r.phase = com.flagship.wager_engine.game.RoundPhase.RESOLVED)
        """)
    long countOpenInResolvedRounds();

    @Query("SELECT COALESCE(SUM(b.amount), 0) FROM BetEntity b WHERE b.status = com.flagship.wager_engine.game.BetStatus.OPEN")
    BigDecimal sumOpenAmount();
}

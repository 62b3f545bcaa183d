package com.flagship.wager_engine.game;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collection;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface RoundRepository extends JpaRepository<RoundEntity, UUID> {

    /**
     * Reads the round under a shared row lock (FOR SHARE).
     *
     * Registration and cashout hold this lock for their whole transaction; a phase flip has
     * to wait for them, and they in turn observe any flip that committed first.
     */
    @Lock(LockModeType.PESSIMISTIC_READ)
    @Query("SELECT r FROM RoundEntity r WHERE r.id = :id")
    Optional<RoundEntity> findByIdForShare(@Param("id") UUID id);

    /**
     * Compare-and-set of the phase.
     *
     * @return 1 if the round was in {@code from} and is now in {@code to}, 0 otherwise
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE RoundEntity r SET r.phase = :to, r.updatedAt = :now
        WHERE r.id = :id AND r.phase = :from
        """)
    int transition(@Param("id") UUID id, @Param("from") RoundPhase from,
                   @Param("to") RoundPhase to, @Param("now") Instant now);

    /**
     * Flips the round to RESOLVED and records its outcome, if it is still in one of {@code from}.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE RoundEntity r
        SET r.phase = com.flagship.wager_engine.game.RoundPhase.RESOLVED,
            r.result = :result, r.resolvedAt = :now, r.updatedAt = :now
        WHERE r.id = :id AND r.phase IN :from
        """)
    int resolve(@Param("id") UUID id, @Param("from") Collection<RoundPhase> from,
                @Param("result") BigDecimal result, @Param("now") Instant now);
}

package com.flagship.wager_engine.game.poker;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface PokerSessionRepository extends JpaRepository<PokerSessionEntity, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM PokerSessionEntity s WHERE s.roundId = :roundId")
    Optional<PokerSessionEntity> findForUpdate(@Param("roundId") UUID roundId);
}

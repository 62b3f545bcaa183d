package com.flagship.wager_engine.game.mines;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface MineSessionRepository extends JpaRepository<MineSessionEntity, UUID> {

    /**
     * Loads a session with a write lock, serializing reveals and cashouts of one session.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM MineSessionEntity s WHERE s.roundId = :roundId")
    Optional<MineSessionEntity> findForUpdate(@Param("roundId") UUID roundId);
}

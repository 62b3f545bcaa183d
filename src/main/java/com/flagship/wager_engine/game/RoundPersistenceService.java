package com.flagship.wager_engine.game;

import com.flagship.wager_engine.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Persistence of rounds and their phase transitions.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RoundPersistenceService {

    private static final Set<RoundPhase> RESOLVABLE =
        EnumSet.of(RoundPhase.CREATED, RoundPhase.IN_PROGRESS, RoundPhase.BETTING, RoundPhase.RUNNING);

    private final RoundRepository roundRepository;

    @Transactional
    public Round open(GameType gameType) {
        Round round = Round.open(gameType);
        roundRepository.save(RoundEntity.fromDomain(round));
        log.info("Opened {} round {} in {}", gameType, round.getId(), round.getPhase());
        return round;
    }

    @Transactional(readOnly = true)
    public Optional<Round> findById(UUID roundId) {
        return roundRepository.findById(roundId).map(RoundEntity::toDomain);
    }

    /**
     * Loads the round under a shared lock. Must run inside the caller's transaction,
     * which then keeps the lock until it ends.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Round lockForShare(UUID roundId) {
        return roundRepository.findByIdForShare(roundId)
            .map(RoundEntity::toDomain)
            .orElseThrow(() -> new ResourceNotFoundException("Round not found: " + roundId));
    }

    /**
     * Moves the round from {@code from} to {@code to}.
     *
     * @return false if the round was no longer in {@code from}
     * @throws IllegalStateException if the transition is not part of the game's state machine
     */
    @Transactional
    public boolean advance(Round round, RoundPhase from, RoundPhase to) {
        Round expected = new Round(round.getId(), round.getGameType(), from, null, round.getOpenedAt(), null);
        if (!expected.canTransitionTo(to)) {
            throw new IllegalStateException(
                String.format("Cannot move %s round %s from %s to %s", round.getGameType(), round.getId(), from, to));
        }
        boolean moved = roundRepository.transition(round.getId(), from, to, Instant.now()) == 1;
        if (moved) {
            log.debug("Round {} moved {} -> {}", round.getId(), from, to);
        }
        return moved;
    }

    /**
     * Atomically flips the round to RESOLVED with its final result.
     *
     * @return false if the round was already resolved
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public boolean flipToResolved(UUID roundId, BigDecimal result) {
        return roundRepository.resolve(roundId, RESOLVABLE, result, Instant.now()) == 1;
    }
}

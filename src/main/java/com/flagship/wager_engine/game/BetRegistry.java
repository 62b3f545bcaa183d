package com.flagship.wager_engine.game;

import com.flagship.wager_engine.event.BetPlacedEvent;
import com.flagship.wager_engine.exception.DuplicateBetException;
import com.flagship.wager_engine.exception.InvalidPhaseException;
import com.flagship.wager_engine.ledger.LedgerService;
import com.flagship.wager_engine.ledger.PlayerAddress;
import com.flagship.wager_engine.observability.CorrelationContext;
import com.flagship.wager_engine.observability.GameMetrics;
import com.flagship.wager_engine.outbox.OutboxService;
import com.flagship.wager_engine.transaction.IdempotencyGuard;
import com.flagship.wager_engine.transaction.LedgerTransaction;
import com.flagship.wager_engine.transaction.LedgerTransactionPersistenceService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Registry of bets per round.
 *
 * Registration locks the stake and inserts the bet in one transaction that also holds a
 * shared lock on the round row. A concurrent resolution therefore either sees the complete
 * bet or flips the phase first and makes the registration fail with INVALID_PHASE.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BetRegistry {

    private final LedgerService ledgerService;
    private final RoundPersistenceService roundPersistenceService;
    private final BetRepository betRepository;
    private final IdempotencyGuard idempotencyGuard;
    private final LedgerTransactionPersistenceService transactionPersistenceService;
    private final OutboxService outboxService;
    private final GameMetrics metrics;

    /**
     * Registers a bet on a round.
     *
     * @param proof optional external payment proof backing the stake
     * @param proofVerified whether the proof was confirmed externally; unverified proofs are
     *                      recorded as pending and left to reconciliation
     * @throws InvalidPhaseException if the round does not accept registrations
     * @throws com.flagship.wager_engine.exception.InsufficientFundsException if available balance is below amount
     * @throws com.flagship.wager_engine.exception.DuplicateProofException if the proof is already used
     * @throws DuplicateBetException if the player already holds a bet on this round
     */
    @Transactional
    public Bet register(UUID roundId, String address, BigDecimal amount, BigDecimal target,
                        String proof, boolean proofVerified) {
        String player = PlayerAddress.normalize(address);
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Bet amount must be positive");
        }
        MDC.put(CorrelationContext.ADDRESS_MDC_KEY, player);
        try {
            ledgerService.ensureUser(player);
            Round round = roundPersistenceService.lockForShare(roundId);
            if (!round.acceptsRegistration()) {
                throw new InvalidPhaseException(
                    String.format("%s round %s is not accepting bets (phase %s)",
                        round.getGameType(), roundId, round.getPhase()));
            }
            if (betRepository.existsByRoundIdAndAddress(roundId, player)) {
                throw new DuplicateBetException("Player already has a bet on round " + roundId);
            }
            if (proof != null) {
                idempotencyGuard.requireUnused(proof);
            }

            ledgerService.lock(player, amount);

            Bet bet = Bet.open(round, player, amount, target);
            try {
                betRepository.saveAndFlush(BetEntity.fromDomain(bet));
            } catch (DataIntegrityViolationException e) {
                throw new DuplicateBetException("Player already has a bet on round " + roundId);
            }
            transactionPersistenceService.save(
                LedgerTransaction.bet(player, round.getGameType(), amount, bet.getId(), proof, proofVerified));
            if (proof != null && proofVerified) {
                idempotencyGuard.markConsumed(proof);
            }
            outboxService.saveEvent(BetPlacedEvent.fromBet(bet));

            metrics.recordBetRegistered(round.getGameType());
            log.info("Registered bet {} on {} round {}: amount={}, target={}",
                bet.getId(), round.getGameType(), roundId, amount, target);
            return bet;
        } finally {
            MDC.remove(CorrelationContext.ADDRESS_MDC_KEY);
        }
    }

    @Transactional(readOnly = true)
    public Optional<Bet> findById(UUID betId) {
        return betRepository.findById(betId).map(BetEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public List<Bet> openBets(UUID roundId) {
        return betRepository.findByRoundIdAndStatusOrderByCreatedAtAsc(roundId, BetStatus.OPEN).stream()
            .map(BetEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public List<Bet> bets(UUID roundId) {
        return betRepository.findByRoundIdOrderByCreatedAtAsc(roundId).stream()
            .map(BetEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public Optional<Bet> findBet(UUID roundId, String address) {
        return betRepository.findByRoundIdAndAddress(roundId, PlayerAddress.normalize(address))
            .map(BetEntity::toDomain);
    }

    /**
     * The player's most recent open bet in a game, i.e. the active session of a turn-based game.
     */
    @Transactional(readOnly = true)
    public Optional<Bet> findOpenBet(String address, GameType gameType) {
        return betRepository.findOpenBets(PlayerAddress.normalize(address), gameType).stream()
            .findFirst()
            .map(BetEntity::toDomain);
    }
}

package com.flagship.wager_engine.game;

import com.flagship.wager_engine.event.BetSettledEvent;
import com.flagship.wager_engine.event.RoundResolvedEvent;
import com.flagship.wager_engine.exception.InvalidPhaseException;
import com.flagship.wager_engine.exception.ResourceNotFoundException;
import com.flagship.wager_engine.exception.RoundAlreadyResolvedException;
import com.flagship.wager_engine.ledger.LedgerService;
import com.flagship.wager_engine.observability.CorrelationContext;
import com.flagship.wager_engine.observability.GameMetrics;
import com.flagship.wager_engine.outbox.OutboxService;
import com.flagship.wager_engine.transaction.LedgerTransaction;
import com.flagship.wager_engine.transaction.LedgerTransactionPersistenceService;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Settles bets exactly once.
 *
 * The bet status change, the ledger adjustment, the payout transaction and the outbox event
 * are written in one store transaction, and the status change is a compare-and-set from OPEN.
 * A bet whose compare-and-set fails was settled by someone else and is left untouched.
 *
 * Cashout vs. resolution: cashout holds a shared lock on the round row and checks the phase;
 * resolution first flips the phase to RESOLVED (which waits for that lock) and only then
 * iterates the bets. Whichever commits first wins; the other is rejected or finds nothing open.
 */
@Service
@Slf4j
public class SettlementEngine {

    private final RoundPersistenceService roundPersistenceService;
    private final BetRepository betRepository;
    private final LedgerService ledgerService;
    private final LedgerTransactionPersistenceService transactionPersistenceService;
    private final OutboxService outboxService;
    private final GameMetrics metrics;
    private final TransactionTemplate transactionTemplate;

    public SettlementEngine(RoundPersistenceService roundPersistenceService,
                            BetRepository betRepository,
                            LedgerService ledgerService,
                            LedgerTransactionPersistenceService transactionPersistenceService,
                            OutboxService outboxService,
                            GameMetrics metrics,
                            PlatformTransactionManager transactionManager) {
        this.roundPersistenceService = roundPersistenceService;
        this.betRepository = betRepository;
        this.ledgerService = ledgerService;
        this.transactionPersistenceService = transactionPersistenceService;
        this.outboxService = outboxService;
        this.metrics = metrics;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    /**
     * Cashes out an open bet at {@code multiplier} while its round is still running.
     *
     * Releases the stake and credits {@code amount * multiplier}, i.e. the balance changes by
     * {@code winAmount - amount}.
     *
     * @throws RoundAlreadyResolvedException if resolution of the round has already begun
     * @throws InvalidPhaseException if the round is not running or the bet is no longer open
     */
    @Transactional
    public Settlement cashout(UUID betId, BigDecimal multiplier) {
        if (multiplier == null || multiplier.compareTo(BigDecimal.ONE) < 0) {
            throw new IllegalArgumentException("Cashout multiplier must be at least 1: " + multiplier);
        }
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.BET_ID_MDC_KEY, betId.toString());

        try {
            Bet bet = betRepository.findById(betId)
                .map(BetEntity::toDomain)
                .orElseThrow(() -> new ResourceNotFoundException("Bet not found: " + betId));

            Round round = roundPersistenceService.lockForShare(bet.getRoundId());
            if (round.isResolved()) {
                metrics.recordCashoutRaceLost(round.getGameType());
                log.info("Cashout rejected, round {} already resolved", round.getId());
                throw new RoundAlreadyResolvedException("Round " + round.getId() + " is already resolved");
            }
            if (!round.acceptsCashout()) {
                throw new InvalidPhaseException(
                    String.format("Cannot cash out while %s round is in %s", round.getGameType(), round.getPhase()));
            }
            if (bet.getStatus() != BetStatus.OPEN) {
                throw new InvalidPhaseException("Bet is already settled as " + bet.getStatus());
            }

            Bet settled = bet.settle(BetStatus.CASHED_OUT, multiplier);
            if (!apply(settled)) {
                throw new InvalidPhaseException("Bet was settled concurrently");
            }

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordSettlementDuration(Duration.ofMillis(duration));
            log.info("Cashed out at {}: amount={}, winAmount={}, duration={}ms",
                multiplier, bet.getAmount(), settled.getPayout(), duration);

            return new Settlement(betId, BetStatus.CASHED_OUT, multiplier, settled.getPayout());
        } finally {
            MDC.remove(CorrelationContext.BET_ID_MDC_KEY);
        }
    }

    /**
     * Resolves a round: flips it to RESOLVED with its outcome, then settles every bet that is
     * still open against {@code rule}.
     *
     * Safe to call again for the same round: the flip happens once, the stored outcome is reused,
     * and bets that are no longer open are skipped. Each bet settles in its own store
     * transaction; a bet whose transaction fails stays OPEN, is counted in the report and does
     * not stop the others.
     *
     * @throws InvalidPhaseException if the round has not reached a resolvable phase
     */
    public ResolutionReport resolveRound(UUID roundId, BigDecimal outcome, SettlementRule rule) {
        MDC.put(CorrelationContext.ROUND_ID_MDC_KEY, roundId.toString());
        try {
            Boolean flipped = transactionTemplate.execute(status -> {
                boolean moved = roundPersistenceService.flipToResolved(roundId, outcome);
                if (moved) {
                    Round round = roundPersistenceService.lockForShare(roundId);
                    outboxService.saveEvent(RoundResolvedEvent.of(roundId, round.getGameType().name(), outcome));
                }
                return moved;
            });

            Round round = roundPersistenceService.findById(roundId)
                .orElseThrow(() -> new ResourceNotFoundException("Round not found: " + roundId));
            if (!round.isResolved()) {
                throw new InvalidPhaseException(
                    String.format("Round %s cannot be resolved from %s", roundId, round.getPhase()));
            }
            BigDecimal finalOutcome = round.getResult();

            int won = 0;
            int lost = 0;
            int failed = 0;
            List<Bet> openBets = betRepository.findByRoundIdAndStatusOrderByCreatedAtAsc(roundId, BetStatus.OPEN)
                .stream()
                .map(BetEntity::toDomain)
                .toList();

            for (Bet bet : openBets) {
                try {
                    BetStatus settled = transactionTemplate.execute(status -> settleAtResolution(bet, rule, finalOutcome));
                    if (settled == BetStatus.WON) {
                        won++;
                    } else if (settled == BetStatus.LOST) {
                        lost++;
                    }
                } catch (RuntimeException e) {
                    failed++;
                    log.error("Failed to settle bet {} of round {}, it stays open: {}",
                        bet.getId(), roundId, e.getMessage(), e);
                }
            }

            if (Boolean.TRUE.equals(flipped)) {
                metrics.recordRoundDuration(round.getGameType(), Duration.between(round.getOpenedAt(), Instant.now()));
            }
            log.info("Resolved {} round {} at {}: won={}, lost={}, failed={}",
                round.getGameType(), roundId, finalOutcome, won, lost, failed);

            return new ResolutionReport(roundId, finalOutcome, Boolean.TRUE.equals(flipped), won, lost, failed);
        } finally {
            MDC.remove(CorrelationContext.ROUND_ID_MDC_KEY);
        }
    }

    private BetStatus settleAtResolution(Bet bet, SettlementRule rule, BigDecimal outcome) {
        Optional<BigDecimal> multiplier = rule.evaluate(bet, outcome);
        Bet settled = multiplier
            .map(m -> bet.settle(BetStatus.WON, m))
            .orElseGet(() -> bet.settle(BetStatus.LOST, null));
        if (!apply(settled)) {
            log.debug("Bet {} already settled, skipping", bet.getId());
            return null;
        }
        return settled.getStatus();
    }

    /**
     * Writes a settlement if the bet is still OPEN. Must run inside a transaction.
     *
     * @return false if another caller already settled the bet
     */
    private boolean apply(Bet settled) {
        int updated = betRepository.settleIfOpen(settled.getId(), settled.getStatus(),
            settled.getMultiplier(), settled.getPayout(), settled.getSettledAt());
        if (updated == 0) {
            return false;
        }

        ledgerService.settleLocked(settled.getAddress(), settled.getAmount(), settled.getPayout());
        if (settled.getStatus().isWin()) {
            transactionPersistenceService.save(LedgerTransaction.cashout(
                settled.getAddress(), settled.getGameType(), settled.getAmount(), settled.getPayout(), settled.getId()));
        }
        outboxService.saveEvent(BetSettledEvent.fromBet(settled));
        metrics.recordBetSettled(settled.getGameType(), settled.getStatus());
        return true;
    }
}

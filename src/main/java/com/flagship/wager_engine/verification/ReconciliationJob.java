package com.flagship.wager_engine.verification;

import com.flagship.wager_engine.event.TransactionFinalizedEvent;
import com.flagship.wager_engine.ledger.LedgerService;
import com.flagship.wager_engine.observability.GameMetrics;
import com.flagship.wager_engine.outbox.OutboxService;
import com.flagship.wager_engine.transaction.IdempotencyGuard;
import com.flagship.wager_engine.transaction.LedgerTransaction;
import com.flagship.wager_engine.transaction.LedgerTransactionPersistenceService;
import com.flagship.wager_engine.transaction.TransactionType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodically re-verifies pending transactions that carry an external proof, and expires
 * withdrawals that never received one.
 *
 * The external ledger is queried outside any store transaction. Finalizing then claims the row
 * with a lock that concurrent passes skip, and runs in its own store transaction:
 * - confirmed deposit: balance credited
 * - confirmed withdrawal: amount debited and unlocked
 * - confirmed bet stake: only the record is confirmed, the stake was locked at registration
 * - older than the max age: marked FAILED; a withdrawal's locked amount is released
 *
 * A withdrawal that was signed but has no proof yet is left alone: its transfer may already be
 * on the ledger, so only an operator attaching the hash moves it forward.
 *
 * Passes never overlap within one instance.
 */
@Component
@ConditionalOnProperty(name = "reconciliation.enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class ReconciliationJob {

    private final LedgerTransactionPersistenceService transactionPersistenceService;
    private final TransactionVerifier verifier;
    private final LedgerService ledgerService;
    private final IdempotencyGuard idempotencyGuard;
    private final OutboxService outboxService;
    private final GameMetrics metrics;
    private final TransactionTemplate transactionTemplate;
    private final AtomicBoolean running = new AtomicBoolean(false);

    @Value("${reconciliation.batch-size:50}")
    private int batchSize;

    @Value("${reconciliation.max-age-minutes:10}")
    private long maxAgeMinutes;

    @Value("${reconciliation.max-retries:1}")
    private int maxRetries;

    @Value("${reconciliation.retry-delay-ms:2000}")
    private long retryDelayMs;

    public ReconciliationJob(LedgerTransactionPersistenceService transactionPersistenceService,
                             TransactionVerifier verifier,
                             LedgerService ledgerService,
                             IdempotencyGuard idempotencyGuard,
                             OutboxService outboxService,
                             GameMetrics metrics,
                             PlatformTransactionManager transactionManager) {
        this.transactionPersistenceService = transactionPersistenceService;
        this.verifier = verifier;
        this.ledgerService = ledgerService;
        this.idempotencyGuard = idempotencyGuard;
        this.outboxService = outboxService;
        this.metrics = metrics;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    @Scheduled(fixedDelayString = "${reconciliation.interval-ms:60000}",
               initialDelayString = "${reconciliation.interval-ms:60000}")
    public void reconcilePendingTransactions() {
        try {
            reconcile();
        } catch (Exception e) {
            log.error("Error in reconciliation pass", e);
        }
    }

    /**
     * Runs one pass. Returns an empty summary if a pass is already running.
     */
    public ReconciliationSummary reconcile() {
        if (!running.compareAndSet(false, true)) {
            log.debug("Reconciliation pass already running, skipping");
            return ReconciliationSummary.empty();
        }
        try {
            List<UUID> candidates = transactionPersistenceService.findReconcilable(expiryCutoff(), batchSize);
            if (candidates.isEmpty()) {
                return ReconciliationSummary.empty();
            }
            log.info("Reconciling {} pending transactions", candidates.size());

            int confirmed = 0;
            int expired = 0;
            int pending = 0;
            for (UUID id : candidates) {
                try {
                    Outcome outcome = reconcileOne(id);
                    if (outcome == Outcome.CONFIRMED) {
                        confirmed++;
                    } else if (outcome == Outcome.EXPIRED) {
                        expired++;
                    } else if (outcome == Outcome.PENDING) {
                        pending++;
                    }
                } catch (RuntimeException e) {
                    pending++;
                    log.error("Failed to reconcile transaction {}", id, e);
                }
            }

            ReconciliationSummary summary = new ReconciliationSummary(candidates.size(), confirmed, expired, pending);
            log.info("Reconciliation pass done: {}", summary);
            return summary;
        } finally {
            running.set(false);
        }
    }

    private Outcome reconcileOne(UUID id) {
        Optional<LedgerTransaction> snapshot = transactionPersistenceService.findById(id)
            .filter(tx -> !tx.isTerminal());
        if (snapshot.isEmpty()) {
            return Outcome.SKIPPED;
        }
        LedgerTransaction tx = snapshot.get();

        if (isExpired(tx)) {
            return transactionTemplate.execute(status -> expire(id));
        }
        if (tx.getExternalProof() == null) {
            return Outcome.PENDING;
        }

        // no row lock held here: verification may take several round trips and retry delays
        if (!verifier.verify(tx.getExternalProof(), verifier.expectedFor(tx), maxRetries, retryDelayMs)) {
            metrics.recordReconciliation(tx.getType().name(), "pending");
            return Outcome.PENDING;
        }
        return transactionTemplate.execute(status -> confirm(id));
    }

    private Outcome expire(UUID id) {
        Optional<LedgerTransaction> claimed = transactionPersistenceService.claimPending(id);
        if (claimed.isEmpty()) {
            return Outcome.SKIPPED;
        }
        LedgerTransaction tx = claimed.get();
        if (tx.getExternalProof() == null && tx.isSigned()) {
            return Outcome.PENDING;
        }

        LedgerTransaction failed = transactionPersistenceService.update(tx.fail(tx.getExternalProof() == null
            ? "No proof attached within " + maxAgeMinutes + " minutes"
            : "Not confirmed within " + maxAgeMinutes + " minutes"));
        if (tx.getType() == TransactionType.WITHDRAWAL) {
            ledgerService.unlock(tx.getAddress(), tx.getAmount());
        }
        outboxService.saveEvent(TransactionFinalizedEvent.fromTransaction(failed));
        metrics.recordReconciliation(tx.getType().name(), "expired");
        log.warn("Expired {} transaction {} with proof {}", tx.getType(), tx.getId(), tx.getExternalProof());
        return Outcome.EXPIRED;
    }

    /**
     * Finalizes a verified transaction. Empty claim means another pass finalized it in the meantime.
     */
    private Outcome confirm(UUID id) {
        Optional<LedgerTransaction> claimed = transactionPersistenceService.claimPending(id);
        if (claimed.isEmpty()) {
            return Outcome.SKIPPED;
        }
        LedgerTransaction tx = claimed.get();

        switch (tx.getType()) {
            case DEPOSIT -> ledgerService.credit(tx.getAddress(), tx.getAmount());
            case WITHDRAWAL -> ledgerService.settleLocked(tx.getAddress(), tx.getAmount(), BigDecimal.ZERO);
            default -> {
                // bet stake is already locked
            }
        }
        LedgerTransaction confirmed = transactionPersistenceService.update(tx.confirm());
        idempotencyGuard.markConsumed(tx.getExternalProof());
        outboxService.saveEvent(TransactionFinalizedEvent.fromTransaction(confirmed));
        metrics.recordReconciliation(tx.getType().name(), "confirmed");
        log.info("Confirmed {} transaction {}: address={}, amount={}",
            tx.getType(), tx.getId(), tx.getAddress(), tx.getAmount());
        return Outcome.CONFIRMED;
    }

    private Instant expiryCutoff() {
        return Instant.now().minus(Duration.ofMinutes(maxAgeMinutes));
    }

    private boolean isExpired(LedgerTransaction tx) {
        return tx.getCreatedAt().isBefore(expiryCutoff());
    }

    private enum Outcome {
        CONFIRMED, EXPIRED, PENDING, SKIPPED
    }
}

package com.flagship.wager_engine.wallet;

import com.flagship.wager_engine.event.TransactionFinalizedEvent;
import com.flagship.wager_engine.ledger.LedgerService;
import com.flagship.wager_engine.ledger.PlayerAddress;
import com.flagship.wager_engine.observability.GameMetrics;
import com.flagship.wager_engine.outbox.OutboxService;
import com.flagship.wager_engine.transaction.IdempotencyGuard;
import com.flagship.wager_engine.transaction.LedgerTransaction;
import com.flagship.wager_engine.transaction.LedgerTransactionPersistenceService;
import com.flagship.wager_engine.verification.ExpectedTransfer;
import com.flagship.wager_engine.verification.TransactionVerifier;
import com.flagship.wager_engine.verification.VerificationOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;

/**
 * Credits external deposits.
 *
 * The transfer is verified before any store transaction is opened. A confirmed deposit credits
 * the balance and records a CONFIRMED transaction together; a provisionally accepted one is
 * recorded as PENDING and credited by reconciliation once the external ledger confirms it.
 * The unique proof column turns a concurrent second submission of the same proof into
 * DUPLICATE_PROOF and rolls back its credit.
 */
@Service
@Slf4j
public class DepositService {

    private final TransactionVerifier verifier;
    private final LedgerService ledgerService;
    private final LedgerTransactionPersistenceService transactionPersistenceService;
    private final IdempotencyGuard idempotencyGuard;
    private final OutboxService outboxService;
    private final GameMetrics metrics;
    private final TransactionTemplate transactionTemplate;

    public DepositService(TransactionVerifier verifier,
                          LedgerService ledgerService,
                          LedgerTransactionPersistenceService transactionPersistenceService,
                          IdempotencyGuard idempotencyGuard,
                          OutboxService outboxService,
                          GameMetrics metrics,
                          PlatformTransactionManager transactionManager) {
        this.verifier = verifier;
        this.ledgerService = ledgerService;
        this.transactionPersistenceService = transactionPersistenceService;
        this.idempotencyGuard = idempotencyGuard;
        this.outboxService = outboxService;
        this.metrics = metrics;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    /**
     * @throws com.flagship.wager_engine.exception.DuplicateProofException if the proof was already used
     * @throws com.flagship.wager_engine.exception.VerificationFailedException if the transfer could not be
     *         confirmed and provisional acceptance is disabled
     */
    public LedgerTransaction deposit(String address, BigDecimal amount, String proof) {
        String player = PlayerAddress.normalize(address);
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Deposit amount must be positive");
        }
        if (proof == null || proof.isBlank()) {
            throw new IllegalArgumentException("Transaction hash is required");
        }
        String txHash = proof.trim();
        String house = verifier.getHouseAddress().isEmpty() ? null : verifier.getHouseAddress();

        VerificationOutcome outcome = verifier.submit(txHash, new ExpectedTransfer(player, house, amount));
        boolean confirmed = outcome == VerificationOutcome.CONFIRMED;

        LedgerTransaction recorded = transactionTemplate.execute(status -> {
            ledgerService.ensureUser(player);
            LedgerTransaction saved = transactionPersistenceService.save(
                LedgerTransaction.deposit(player, amount, txHash, confirmed));
            if (confirmed) {
                ledgerService.credit(player, amount);
                idempotencyGuard.markConsumed(txHash);
                outboxService.saveEvent(TransactionFinalizedEvent.fromTransaction(saved));
            }
            return saved;
        });

        metrics.recordDeposit(confirmed ? "confirmed" : "pending");
        log.info("Deposit {} of {} for {} recorded as {}", txHash, amount, player, recorded.getStatus());
        return recorded;
    }
}

package com.flagship.wager_engine.wallet;

import com.flagship.wager_engine.exception.InvalidPhaseException;
import com.flagship.wager_engine.exception.ResourceNotFoundException;
import com.flagship.wager_engine.ledger.LedgerService;
import com.flagship.wager_engine.ledger.PlayerAddress;
import com.flagship.wager_engine.observability.GameMetrics;
import com.flagship.wager_engine.transaction.IdempotencyGuard;
import com.flagship.wager_engine.transaction.LedgerTransaction;
import com.flagship.wager_engine.transaction.LedgerTransactionPersistenceService;
import com.flagship.wager_engine.transaction.TransactionStatus;
import com.flagship.wager_engine.transaction.TransactionType;
import com.flagship.wager_engine.verification.TransactionVerifier;
import com.flagship.wager_engine.verification.WalletSigner;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.UUID;

/**
 * Withdrawals: the amount is locked when requested and leaves the balance only when
 * reconciliation confirms the outgoing transfer. An unconfirmed withdrawal expires and
 * releases the lock.
 */
@Service
@Slf4j
public class WithdrawalService {

    private final LedgerService ledgerService;
    private final LedgerTransactionPersistenceService transactionPersistenceService;
    private final IdempotencyGuard idempotencyGuard;
    private final TransactionVerifier verifier;
    private final Optional<WalletSigner> walletSigner;
    private final GameMetrics metrics;
    private final TransactionTemplate transactionTemplate;

    public WithdrawalService(LedgerService ledgerService,
                             LedgerTransactionPersistenceService transactionPersistenceService,
                             IdempotencyGuard idempotencyGuard,
                             TransactionVerifier verifier,
                             Optional<WalletSigner> walletSigner,
                             GameMetrics metrics,
                             PlatformTransactionManager transactionManager) {
        this.ledgerService = ledgerService;
        this.transactionPersistenceService = transactionPersistenceService;
        this.idempotencyGuard = idempotencyGuard;
        this.verifier = verifier;
        this.walletSigner = walletSigner;
        this.metrics = metrics;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    /**
     * Locks {@code amount} and records a PENDING withdrawal to {@code destination}.
     *
     * @throws com.flagship.wager_engine.exception.InsufficientFundsException if available balance is below amount
     */
    @Transactional
    public LedgerTransaction request(String address, BigDecimal amount, String destination) {
        String player = PlayerAddress.normalize(address);
        String target = PlayerAddress.normalize(destination);
        ledgerService.ensureUser(player);
        ledgerService.lock(player, amount);

        LedgerTransaction saved = transactionPersistenceService.save(LedgerTransaction.withdrawal(player, amount, target));
        metrics.recordWithdrawal("requested");
        log.info("Withdrawal {} of {} requested by {} to {}", saved.getId(), amount, player, target);
        return saved;
    }

    /**
     * Attaches the proof of the outgoing transfer. Without a hash the transfer is signed and
     * broadcast through the configured {@link WalletSigner}.
     *
     * The signing mark is committed before the broadcast, and the broadcast runs outside any
     * store transaction. A withdrawal that was signed once is never broadcast again: if storing
     * the resulting hash fails, the hash has to be attached explicitly.
     *
     * @throws InvalidPhaseException if the withdrawal is no longer pending, already has a proof,
     *                               or was already signed and no hash is given
     */
    public LedgerTransaction attachProof(UUID withdrawalId, String txHash) {
        if (txHash != null && !txHash.isBlank()) {
            return transactionTemplate.execute(status -> recordProof(withdrawalId, txHash.trim()));
        }

        byte[] signed = transactionTemplate.execute(status -> sign(withdrawalId));
        String proof = broadcast(withdrawalId, signed);
        return transactionTemplate.execute(status -> recordProof(withdrawalId, proof));
    }

    private String broadcast(UUID withdrawalId, byte[] signed) {
        try {
            return verifier.broadcast(signed);
        } catch (RuntimeException e) {
            metrics.recordWithdrawal("broadcast_failed");
            log.error("Broadcast of signed withdrawal {} failed; attach the transfer hash once it is known",
                withdrawalId, e);
            throw e;
        }
    }

    private byte[] sign(UUID withdrawalId) {
        LedgerTransaction tx = lockPendingWithdrawal(withdrawalId);
        if (tx.isSigned()) {
            throw new InvalidPhaseException(String.format(
                "Withdrawal %s was signed at %s; attach the hash of the broadcast transfer", withdrawalId, tx.getSignedAt()));
        }
        WalletSigner signer = walletSigner.orElseThrow(() ->
            new IllegalArgumentException("Transaction hash is required: no wallet signer is configured"));
        byte[] signed = signer.sign(tx.getDestination(), tx.getAmount(), signer.currentSequenceNumber() + 1);
        transactionPersistenceService.update(tx.markSigned());
        metrics.recordWithdrawal("signed");
        return signed;
    }

    private LedgerTransaction recordProof(UUID withdrawalId, String proof) {
        LedgerTransaction tx = lockPendingWithdrawal(withdrawalId);
        idempotencyGuard.requireUnused(proof);
        LedgerTransaction updated = transactionPersistenceService.update(tx.attachProof(proof));
        metrics.recordWithdrawal("proof_attached");
        log.info("Attached proof {} to withdrawal {}", proof, withdrawalId);
        return updated;
    }

    private LedgerTransaction lockPendingWithdrawal(UUID withdrawalId) {
        LedgerTransaction tx = transactionPersistenceService.lockForUpdate(withdrawalId)
            .filter(t -> t.getType() == TransactionType.WITHDRAWAL)
            .orElseThrow(() -> new ResourceNotFoundException("Withdrawal not found: " + withdrawalId));
        if (tx.getStatus() != TransactionStatus.PENDING || tx.getExternalProof() != null) {
            throw new InvalidPhaseException(
                String.format("Withdrawal %s is %s and cannot take a proof", withdrawalId, tx.getStatus()));
        }
        return tx;
    }
}

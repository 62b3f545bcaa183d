package com.flagship.wager_engine.transaction;

import com.flagship.wager_engine.exception.DuplicateProofException;
import com.flagship.wager_engine.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.hibernate.exception.ConstraintViolationException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Bridges {@link LedgerTransaction} and its entity.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerTransactionPersistenceService {

    static final String PROOF_CONSTRAINT = "uq_ledger_transactions_external_proof";

    private final LedgerTransactionRepository repository;

    /**
     * Inserts a new transaction and flushes, so a proof collision with a concurrent
     * request surfaces here as {@link DuplicateProofException}.
     */
    @Transactional
    public LedgerTransaction save(LedgerTransaction tx) {
        try {
            LedgerTransactionEntity saved = repository.saveAndFlush(LedgerTransactionEntity.fromDomain(tx));
            log.debug("Saved {} transaction {} for {}", tx.getType(), saved.getId(), tx.getAddress());
            return saved.toDomain();
        } catch (DataIntegrityViolationException e) {
            if (isProofCollision(e)) {
                throw new DuplicateProofException("External proof already used: " + tx.getExternalProof());
            }
            throw e;
        }
    }

    @Transactional
    public LedgerTransaction update(LedgerTransaction tx) {
        LedgerTransactionEntity existing = repository.findById(tx.getId())
            .orElseThrow(() -> new ResourceNotFoundException("Transaction not found: " + tx.getId()));
        existing.updateFromDomain(tx);
        try {
            LedgerTransactionEntity updated = repository.saveAndFlush(existing);
            log.debug("Updated transaction {} to {}", updated.getId(), updated.getStatus());
            return updated.toDomain();
        } catch (DataIntegrityViolationException e) {
            if (isProofCollision(e)) {
                throw new DuplicateProofException("External proof already used: " + tx.getExternalProof());
            }
            throw e;
        }
    }

    @Transactional(readOnly = true)
    public Optional<LedgerTransaction> findById(UUID id) {
        return repository.findById(id).map(LedgerTransactionEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public Optional<LedgerTransaction> findByExternalProof(String proof) {
        return repository.findByExternalProof(proof).map(LedgerTransactionEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public Optional<LedgerTransaction> findBetStake(UUID betId) {
        return repository.findFirstByBetIdAndType(betId, TransactionType.BET)
            .map(LedgerTransactionEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public List<UUID> findReconcilable(Instant unprovenCutoff, int limit) {
        return repository.findReconcilableIds(unprovenCutoff, PageRequest.of(0, limit));
    }

    @Transactional(readOnly = true)
    public List<LedgerTransaction> findRecentPendingWithProof(int limit) {
        return repository.findRecentPendingWithProof(PageRequest.of(0, limit)).stream()
            .map(LedgerTransactionEntity::toDomain)
            .toList();
    }

    /**
     * Locks the transaction row until the caller's transaction ends. Unlike {@link #claimPending}
     * this waits for a concurrent holder, so two callers acting on the same row are serialized.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Optional<LedgerTransaction> lockForUpdate(UUID id) {
        return repository.lockById(id).map(LedgerTransactionEntity::toDomain);
    }

    /**
     * Locks a pending transaction for the caller's transaction, or returns empty if it is
     * no longer pending or another worker holds it.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Optional<LedgerTransaction> claimPending(UUID id) {
        return repository.claimPending(id).map(LedgerTransactionEntity::toDomain);
    }

    private static boolean isProofCollision(DataIntegrityViolationException e) {
        Throwable cause = e.getCause();
        if (cause instanceof ConstraintViolationException violation) {
            return PROOF_CONSTRAINT.equalsIgnoreCase(violation.getConstraintName());
        }
        String message = e.getMostSpecificCause().getMessage();
        return message != null && message.contains(PROOF_CONSTRAINT);
    }
}

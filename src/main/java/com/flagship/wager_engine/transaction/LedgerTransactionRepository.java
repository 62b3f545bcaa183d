package com.flagship.wager_engine.transaction;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface LedgerTransactionRepository extends JpaRepository<LedgerTransactionEntity, UUID> {

    Optional<LedgerTransactionEntity> findByExternalProof(String externalProof);

    Optional<LedgerTransactionEntity> findFirstByBetIdAndType(UUID betId, TransactionType type);

    /**
     * Pending transactions reconciliation has work for, oldest first: those carrying an external
     * proof, and withdrawals that never got one (nor a signature) and were created before {@code cutoff}.
     */
    @Query("SELECT t.id FROM LedgerTransactionEntity t " +
           "WHERE t.status = com.flagship.wager_engine.transaction.TransactionStatus.PENDING " +
           "AND (t.externalProof IS NOT NULL " +
           "  OR (t.type = com.flagship.wager_engine.transaction.TransactionType.WITHDRAWAL " +
           "      AND t.signedAt IS NULL AND t.createdAt < :cutoff)) " +
           "ORDER BY t.createdAt ASC")
    List<UUID> findReconcilableIds(@Param("cutoff") Instant cutoff, Pageable page);

    /**
     * Most recent pending transactions with a proof, for the verification status view.
     */
    @Query("SELECT t FROM LedgerTransactionEntity t " +
           "WHERE t.status = com.flagship.wager_engine.transaction.TransactionStatus.PENDING " +
           "AND t.externalProof IS NOT NULL ORDER BY t.createdAt DESC")
    List<LedgerTransactionEntity> findRecentPendingWithProof(Pageable page);

    /**
     * Locks one transaction row, waiting for any concurrent holder.
     */
    @Query(value = "SELECT * FROM ledger_transactions WHERE id = :id FOR UPDATE", nativeQuery = true)
    Optional<LedgerTransactionEntity> lockById(@Param("id") UUID id);

    /**
     * Claims one pending transaction for the current store transaction.
     * A row locked by a concurrent pass is skipped, so each pass only touches rows it owns.
     */
    @Query(value = """
        SELECT * FROM ledger_transactions
        WHERE id = :id AND status = 'PENDING'
        FOR UPDATE SKIP LOCKED
        """, nativeQuery = true)
    Optional<LedgerTransactionEntity> claimPending(@Param("id") UUID id);

    @Query("SELECT COUNT(t) FROM LedgerTransactionEntity t WHERE t.status = com.flagship.wager_engine.transaction.TransactionStatus.PENDING")
    long countPending();

    /**
     * Withdrawals whose transfer was signed but whose hash never got stored.
     */
    @Query("SELECT COUNT(t) FROM LedgerTransactionEntity t " +
           "WHERE t.status = com.flagship.wager_engine.transaction.TransactionStatus.PENDING " +
           "AND t.signedAt IS NOT NULL AND t.externalProof IS NULL")
    long countSignedAwaitingProof();
}

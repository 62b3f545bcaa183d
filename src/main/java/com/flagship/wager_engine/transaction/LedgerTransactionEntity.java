package com.flagship.wager_engine.transaction;

import com.flagship.wager_engine.game.GameType;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for ledger transactions.
 *
 * Only status, failure reason, the signing mark and the external proof are mutable; everything else is
 * fixed at creation. The unique constraint on external_proof is the double-spend barrier.
 */
@Entity
@Table(name = "ledger_transactions")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class LedgerTransactionEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(nullable = false, updatable = false, length = 64)
    private String address;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private TransactionType type;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private TransactionStatus status;

    @Column(nullable = false, updatable = false, precision = 30, scale = 8)
    private BigDecimal amount;

    @Column(name = "win_amount", updatable = false, precision = 30, scale = 8)
    private BigDecimal winAmount;

    @Column(name = "external_proof", unique = true, length = 128)
    private String externalProof;

    @Column(name = "bet_id", updatable = false)
    private UUID betId;

    @Enumerated(EnumType.STRING)
    @Column(name = "game_type", updatable = false)
    private GameType gameType;

    @Column(updatable = false, length = 64)
    private String destination;

    @Column(name = "failure_reason")
    private String failureReason;

    @Column(name = "signed_at")
    private Instant signedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
        this.updatedAt = Instant.now();
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static LedgerTransactionEntity fromDomain(LedgerTransaction tx) {
        return new LedgerTransactionEntity(
            tx.getId(),
            tx.getAddress(),
            tx.getType(),
            tx.getStatus(),
            tx.getAmount(),
            tx.getWinAmount(),
            tx.getExternalProof(),
            tx.getBetId(),
            tx.getGameType(),
            tx.getDestination(),
            tx.getFailureReason(),
            tx.getSignedAt(),
            tx.getCreatedAt(),
            null // updatedAt - set by @PrePersist
        );
    }

    public LedgerTransaction toDomain() {
        return new LedgerTransaction(
            id,
            address,
            type,
            status,
            amount,
            winAmount,
            externalProof,
            betId,
            gameType,
            destination,
            failureReason,
            signedAt,
            createdAt,
            updatedAt
        );
    }

    /**
     * Copies the mutable fields from the domain object.
     */
    void updateFromDomain(LedgerTransaction tx) {
        if (this.externalProof != null && !this.externalProof.equals(tx.getExternalProof())) {
            throw new IllegalStateException("External proof of transaction " + id + " cannot be replaced");
        }
        this.status = tx.getStatus();
        this.failureReason = tx.getFailureReason();
        this.externalProof = tx.getExternalProof();
        if (this.signedAt == null) {
            this.signedAt = tx.getSignedAt();
        }
    }
}

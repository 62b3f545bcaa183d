package com.flagship.wager_engine.transaction;

import com.flagship.wager_engine.game.GameType;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Record of a balance-affecting event.
 *
 * Status transitions are explicit: only PENDING transactions can be confirmed or failed,
 * and an external proof can be attached only once.
 */
@Value
public class LedgerTransaction {
    UUID id;
    String address;
    TransactionType type;
    TransactionStatus status;
    BigDecimal amount;
    BigDecimal winAmount;
    String externalProof;
    UUID betId;
    GameType gameType;
    String destination;
    String failureReason;
    Instant signedAt;
    Instant createdAt;
    Instant updatedAt;

    /**
     * Stake record of a bet. Pending while the payment proof behind it awaits confirmation;
     * a bet without proof, or with an already verified one, is confirmed immediately.
     */
    public static LedgerTransaction bet(String address, GameType gameType, BigDecimal amount,
                                        UUID betId, String externalProof, boolean proofVerified) {
        TransactionStatus status = externalProof == null || proofVerified
            ? TransactionStatus.CONFIRMED : TransactionStatus.PENDING;
        return create(address, TransactionType.BET, status, amount, null, externalProof, betId, gameType, null);
    }

    /**
     * Payout record of a winning bet.
     */
    public static LedgerTransaction cashout(String address, GameType gameType, BigDecimal stake,
                                            BigDecimal winAmount, UUID betId) {
        return create(address, TransactionType.CASHOUT, TransactionStatus.CONFIRMED,
            stake, winAmount, null, betId, gameType, null);
    }

    public static LedgerTransaction deposit(String address, BigDecimal amount, String externalProof,
                                            boolean confirmed) {
        return create(address, TransactionType.DEPOSIT,
            confirmed ? TransactionStatus.CONFIRMED : TransactionStatus.PENDING,
            amount, null, externalProof, null, null, null);
    }

    /**
     * Withdrawal request. Pending until the outgoing proof is attached and confirmed.
     */
    public static LedgerTransaction withdrawal(String address, BigDecimal amount, String destination) {
        return create(address, TransactionType.WITHDRAWAL, TransactionStatus.PENDING,
            amount, null, null, null, null, destination);
    }

    private static LedgerTransaction create(String address, TransactionType type, TransactionStatus status,
                                            BigDecimal amount, BigDecimal winAmount, String externalProof,
                                            UUID betId, GameType gameType, String destination) {
        Instant now = Instant.now();
        return new LedgerTransaction(UUID.randomUUID(), address, type, status, amount, winAmount,
            externalProof, betId, gameType, destination, null, null, now, now);
    }

    /**
     * @throws IllegalStateException unless the transaction is PENDING
     */
    public LedgerTransaction confirm() {
        if (status != TransactionStatus.PENDING) {
            throw new IllegalStateException(
                String.format("Cannot confirm transaction %s in %s status. Only PENDING transactions can be confirmed.",
                    id, status));
        }
        return new LedgerTransaction(id, address, type, TransactionStatus.CONFIRMED, amount, winAmount,
            externalProof, betId, gameType, destination, null, signedAt, createdAt, Instant.now());
    }

    /**
     * @throws IllegalStateException unless the transaction is PENDING
     */
    public LedgerTransaction fail(String reason) {
        if (status != TransactionStatus.PENDING) {
            throw new IllegalStateException(
                String.format("Cannot fail transaction %s in %s status. Only PENDING transactions can be failed.",
                    id, status));
        }
        return new LedgerTransaction(id, address, type, TransactionStatus.FAILED, amount, winAmount,
            externalProof, betId, gameType, destination, reason, signedAt, createdAt, Instant.now());
    }

    /**
     * Attaches the external proof of an outgoing transfer.
     *
     * @throws IllegalStateException if the transaction is not PENDING or already holds a proof
     */
    public LedgerTransaction attachProof(String proof) {
        if (status != TransactionStatus.PENDING || externalProof != null) {
            throw new IllegalStateException(
                String.format("Cannot attach proof to transaction %s (status=%s, proof present=%s)",
                    id, status, externalProof != null));
        }
        return new LedgerTransaction(id, address, type, status, amount, winAmount,
            proof, betId, gameType, destination, failureReason, signedAt, createdAt, Instant.now());
    }

    /**
     * Marks a withdrawal whose outgoing transfer has been signed and is about to be broadcast.
     * A signed withdrawal is never signed again; only the hash of the broadcast transfer can follow.
     *
     * @throws IllegalStateException unless the transaction is a PENDING withdrawal with no proof and no signature
     */
    public LedgerTransaction markSigned() {
        if (type != TransactionType.WITHDRAWAL || status != TransactionStatus.PENDING
            || externalProof != null || signedAt != null) {
            throw new IllegalStateException(
                String.format("Cannot sign transaction %s (type=%s, status=%s, signed=%s)",
                    id, type, status, signedAt != null));
        }
        Instant now = Instant.now();
        return new LedgerTransaction(id, address, type, status, amount, winAmount,
            externalProof, betId, gameType, destination, failureReason, now, createdAt, now);
    }

    public boolean isSigned() {
        return signedAt != null;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }
}

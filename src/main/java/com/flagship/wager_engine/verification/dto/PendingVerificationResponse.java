package com.flagship.wager_engine.verification.dto;

import com.flagship.wager_engine.transaction.LedgerTransaction;
import com.flagship.wager_engine.transaction.TransactionStatus;
import com.flagship.wager_engine.transaction.TransactionType;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Pending transactions whose proof still awaits confirmation, newest first.
 */
@Value
public class PendingVerificationResponse {
    int pendingCount;
    List<PendingProof> transactions;

    public static PendingVerificationResponse of(List<LedgerTransaction> pending) {
        return new PendingVerificationResponse(pending.size(), pending.stream().map(PendingProof::from).toList());
    }

    @Value
    public static class PendingProof {
        UUID id;
        String address;
        String txHash;
        TransactionType type;
        String gameType;
        BigDecimal amount;
        TransactionStatus status;
        Instant createdAt;

        static PendingProof from(LedgerTransaction tx) {
            return new PendingProof(tx.getId(), tx.getAddress(), tx.getExternalProof(), tx.getType(),
                tx.getGameType() != null ? tx.getGameType().name() : null, tx.getAmount(), tx.getStatus(),
                tx.getCreatedAt());
        }
    }
}

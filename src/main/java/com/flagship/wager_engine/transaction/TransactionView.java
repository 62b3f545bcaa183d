package com.flagship.wager_engine.transaction;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Read model of a transaction for history listings.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TransactionView {
    UUID id;
    TransactionType type;
    TransactionStatus status;
    BigDecimal amount;
    BigDecimal winAmount;
    String gameType;
    String externalProof;
    UUID betId;
    Instant createdAt;

    public static TransactionView from(LedgerTransaction tx) {
        return new TransactionView(tx.getId(), tx.getType(), tx.getStatus(), tx.getAmount(), tx.getWinAmount(),
            tx.getGameType() != null ? tx.getGameType().name() : null, tx.getExternalProof(), tx.getBetId(),
            tx.getCreatedAt());
    }
}

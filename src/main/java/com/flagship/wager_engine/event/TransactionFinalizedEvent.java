package com.flagship.wager_engine.event;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.flagship.wager_engine.transaction.LedgerTransaction;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Published when an externally backed transaction (deposit, withdrawal, bet proof)
 * is confirmed or failed.
 */
@Value
public class TransactionFinalizedEvent implements WagerEvent {
    UUID eventId;
    UUID transactionId;
    String type;
    String status;
    String address;
    BigDecimal amount;
    String externalProof;
    String failureReason;
    Instant occurredAt;

    public static final String EVENT_TYPE = "TransactionFinalized";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    @JsonIgnore
    public UUID getAggregateId() {
        return transactionId;
    }

    @Override
    @JsonIgnore
    public String getAggregateType() {
        return "Transaction";
    }

    public static TransactionFinalizedEvent fromTransaction(LedgerTransaction tx) {
        return new TransactionFinalizedEvent(
            UUID.randomUUID(),
            tx.getId(),
            tx.getType().name(),
            tx.getStatus().name(),
            tx.getAddress(),
            tx.getAmount(),
            tx.getExternalProof(),
            tx.getFailureReason(),
            Instant.now()
        );
    }
}
